package com.library.bookshelf.controller;

import com.library.bookshelf.dto.request.BookRequest;
import com.library.bookshelf.dto.response.BookResponse;
import com.library.bookshelf.dto.response.PagedResponse;
import com.library.bookshelf.mapper.BookMapper;
import com.library.bookshelf.security.Authorize;
import com.library.bookshelf.security.CurrentUser;
import com.library.bookshelf.security.Gate;
import com.library.bookshelf.security.UserPrincipal;
import com.library.bookshelf.service.BookService;
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
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.util.UUID;

@RestController
@RequestMapping("/books")
@RequiredArgsConstructor
@Tag(name = "Books", description = "Book catalogue operations")
public class BookController {

    private final BookService bookService;

    @GetMapping
    @Authorize(Gate.BOOK_READ)
    @Operation(summary = "List books",
        description = "Returns a window of the active books. total_count covers all active books.")
    @ApiResponse(responseCode = "200", description = "Books listed")
    @ApiResponse(responseCode = "400", description = "Invalid offset or limit")
    public ResponseEntity<PagedResponse<BookResponse>> findAll(
            @RequestParam(required = false) Integer offset,
            @RequestParam(required = false) Integer limit) {
        String baseUrl = baseUrl();
        return ResponseEntity.ok(bookService.findAll(offset, limit)
            .map(book -> BookMapper.toResponse(book, baseUrl)));
    }

    @GetMapping("/{id}")
    @Authorize(Gate.BOOK_READ)
    @Operation(summary = "Get book by ID")
    @ApiResponse(responseCode = "200", description = "Book found")
    @ApiResponse(responseCode = "404", description = "Book not found or deleted")
    public ResponseEntity<BookResponse> findById(@PathVariable UUID id) {
        return ResponseEntity.ok(BookMapper.toResponse(bookService.findById(id), baseUrl()));
    }

    @PostMapping
    @Authorize(Gate.BOOK_WRITE)
    @Operation(summary = "Create a book",
        description = "title, synopsis and author are required. Admin or editor only.")
    @ApiResponse(responseCode = "201", description = "Book created")
    @ApiResponse(responseCode = "400", description = "Missing or invalid fields")
    @ApiResponse(responseCode = "403", description = "Caller lacks the admin or editor role")
    @ApiResponse(responseCode = "415", description = "Request is not JSON")
    public ResponseEntity<BookResponse> create(@RequestBody BookRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(BookMapper.toResponse(bookService.create(request), baseUrl()));
    }

    @PutMapping("/{id}")
    @Authorize(Gate.BOOK_WRITE)
    @Operation(summary = "Replace a book's title, synopsis and author")
    @ApiResponse(responseCode = "200", description = "Book updated")
    @ApiResponse(responseCode = "400", description = "Missing or invalid fields")
    @ApiResponse(responseCode = "404", description = "Book not found or deleted")
    @ApiResponse(responseCode = "415", description = "Request is not JSON")
    public ResponseEntity<BookResponse> update(@PathVariable UUID id, @RequestBody BookRequest request) {
        return ResponseEntity.ok(BookMapper.toResponse(bookService.update(id, request), baseUrl()));
    }

    @DeleteMapping("/{id}")
    @Authorize(Gate.BOOK_DELETE)
    @Operation(summary = "Delete a book",
        description = "Soft delete. Deleting a book twice returns 404. Admin only.")
    @ApiResponse(responseCode = "204", description = "Book deleted")
    @ApiResponse(responseCode = "404", description = "Book not found or already deleted")
    public ResponseEntity<Void> delete(@PathVariable UUID id, @CurrentUser UserPrincipal principal) {
        bookService.delete(id, principal);
        return ResponseEntity.noContent().build();
    }

    private static String baseUrl() {
        return ServletUriComponentsBuilder.fromCurrentContextPath().toUriString();
    }
}
