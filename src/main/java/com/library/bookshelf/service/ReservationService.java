package com.library.bookshelf.service;

import com.library.bookshelf.dto.response.ReservationResponse;
import com.library.bookshelf.entity.BookState;
import com.library.bookshelf.entity.Reservation;
import com.library.bookshelf.entity.ReservationState;
import com.library.bookshelf.exception.BookUnavailableException;
import com.library.bookshelf.exception.ResourceNotFoundException;
import com.library.bookshelf.mapper.ReservationMapper;
import com.library.bookshelf.repository.BookRepository;
import com.library.bookshelf.repository.ReservationRepository;
import com.library.bookshelf.security.AccessPolicy;
import com.library.bookshelf.security.UserPrincipal;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class ReservationService {

    private static final Logger log = LoggerFactory.getLogger(ReservationService.class);

    private final BookRepository bookRepository;
    private final ReservationRepository reservationRepository;
    private final AccessPolicy accessPolicy;

    @Transactional
    public ReservationResponse create(UUID bookId, UserPrincipal principal) {
        if (bookRepository.findByIdAndState(bookId, BookState.ACTIVE).isEmpty()) {
            throw new BookUnavailableException(bookId);
        }

        ReservationHolderNames.HolderName name = ReservationHolderNames.derive(principal.profile());

        Reservation reservation = new Reservation();
        reservation.setId(UUID.randomUUID());
        reservation.setBookId(bookId);
        reservation.setUserId(principal.id());
        reservation.setForenames(name.forenames());
        reservation.setSurname(name.surname());
        reservation.setState(ReservationState.RESERVED);
        reservation.setReservedAt(Instant.now());

        Reservation saved = reservationRepository.save(reservation);
        log.info("User {} reserved book {} ({})", principal.id(), bookId, saved.getId());
        return ReservationMapper.toResponse(saved);
    }

    @Transactional(readOnly = true)
    public ReservationResponse findById(UUID bookId, UUID reservationId, UserPrincipal principal) {
        return ReservationMapper.toResponse(loadAccessible(bookId, reservationId, principal));
    }

    @Transactional
    public ReservationResponse cancel(UUID bookId, UUID reservationId, UserPrincipal principal) {
        loadAccessible(bookId, reservationId, principal);

        if (reservationRepository.cancelReserved(reservationId, Instant.now()) == 0) {
            throw new ResourceNotFoundException("Reservation", reservationId);
        }
        log.info("User {} cancelled reservation {}", principal.id(), reservationId);

        Reservation cancelled = reservationRepository.findById(reservationId)
            .orElseThrow(() -> new ResourceNotFoundException("Reservation", reservationId));
        return ReservationMapper.toResponse(cancelled);
    }

    @Transactional(readOnly = true)
    public List<ReservationResponse> findAll(UserPrincipal principal, Long requestedUserId) {
        Long ownerId = accessPolicy.reservationScope(principal, requestedUserId);

        Specification<Reservation> spec = Specification.where(null);
        if (ownerId != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("userId"), ownerId));
        }

        return reservationRepository.findAll(spec, Sort.by("reservedAt", "id")).stream()
            .map(ReservationMapper::toListItem)
            .toList();
    }

    /**
     * Existence first, ownership second: a reservation that is missing, or filed under
     * another book, is reported as not found before any ownership decision is made.
     */
    private Reservation loadAccessible(UUID bookId, UUID reservationId, UserPrincipal principal) {
        Reservation reservation = reservationRepository.findByIdAndBookId(reservationId, bookId)
            .orElseThrow(() -> new ResourceNotFoundException("Reservation", reservationId));
        accessPolicy.requireOwnerOrAdmin(principal, reservation.getUserId());
        return reservation;
    }
}
