package com.library.bookshelf.controller;

import com.library.bookshelf.dto.response.ReservationResponse;
import com.library.bookshelf.exception.InvalidInputException;
import com.library.bookshelf.security.Authorize;
import com.library.bookshelf.security.CurrentUser;
import com.library.bookshelf.security.Gate;
import com.library.bookshelf.security.UserPrincipal;
import com.library.bookshelf.service.ReservationService;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
@Tag(name = "Reservations", description = "Per-book reservations, visible to their owner and admins")
public class ReservationController {

    private final ReservationService reservationService;

    @PostMapping("/books/{bookId}/reservations")
    @Authorize(Gate.RESERVATION_CREATE)
    @Operation(summary = "Reserve a book",
        description = "The reservation is made in the caller's name, taken from their profile.")
    @ApiResponse(responseCode = "201", description = "Reservation created")
    @ApiResponse(responseCode = "302", description = "Not signed in")
    @ApiResponse(responseCode = "404", description = "Book not available")
    public ResponseEntity<ReservationResponse> create(@PathVariable UUID bookId,
                                                      @CurrentUser UserPrincipal principal) {
        return ResponseEntity.status(HttpStatus.CREATED).body(reservationService.create(bookId, principal));
    }

    @GetMapping("/books/{bookId}/reservations/{reservationId}")
    @Authorize(Gate.RESERVATION_ACCESS)
    @Operation(summary = "Get a reservation")
    @ApiResponse(responseCode = "200", description = "Reservation found")
    @ApiResponse(responseCode = "403", description = "Caller is neither the owner nor an admin")
    @ApiResponse(responseCode = "404", description = "Reservation not found")
    public ResponseEntity<ReservationResponse> findById(@PathVariable UUID bookId,
                                                        @PathVariable UUID reservationId,
                                                        @CurrentUser UserPrincipal principal) {
        return ResponseEntity.ok(reservationService.findById(bookId, reservationId, principal));
    }

    @DeleteMapping("/books/{bookId}/reservations/{reservationId}")
    @Authorize(Gate.RESERVATION_ACCESS)
    @Operation(summary = "Cancel a reservation",
        description = "The reservation is kept with state cancelled. Cancelling twice returns 404.")
    @ApiResponse(responseCode = "200", description = "Reservation cancelled")
    @ApiResponse(responseCode = "403", description = "Caller is neither the owner nor an admin")
    @ApiResponse(responseCode = "404", description = "Reservation not found or not reserved")
    public ResponseEntity<ReservationResponse> cancel(@PathVariable UUID bookId,
                                                      @PathVariable UUID reservationId,
                                                      @CurrentUser UserPrincipal principal) {
        return ResponseEntity.ok(reservationService.cancel(bookId, reservationId, principal));
    }

    @GetMapping("/reservations")
    @Authorize(Gate.RESERVATION_LIST)
    @Operation(summary = "List reservations",
        description = "Admins see every reservation, optionally filtered by user_id. "
            + "Everyone else sees only their own; user_id is ignored for them.")
    public ResponseEntity<List<ReservationResponse>> findAll(
            @Parameter(description = "Owner filter, honoured for admins only")
            @RequestParam(name = "user_id", required = false) String userId,
            @CurrentUser UserPrincipal principal) {
        Long requestedUserId = principal.isAdmin() ? parseUserId(userId) : null;
        return ResponseEntity.ok(reservationService.findAll(principal, requestedUserId));
    }

    private static Long parseUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            return null;
        }
        try {
            return Long.valueOf(userId.trim());
        } catch (NumberFormatException e) {
            throw new InvalidInputException("user_id must be an integer");
        }
    }
}
