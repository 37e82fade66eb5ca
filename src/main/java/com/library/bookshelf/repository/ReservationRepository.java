package com.library.bookshelf.repository;

import com.library.bookshelf.entity.Reservation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface ReservationRepository extends JpaRepository<Reservation, UUID>,
        JpaSpecificationExecutor<Reservation> {

    Optional<Reservation> findByIdAndBookId(UUID id, UUID bookId);

    /**
     * Moves a reservation from RESERVED to CANCELLED. Returns the number of rows changed,
     * which is {@code 0} when the reservation is missing or no longer RESERVED.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Reservation r SET r.state = com.library.bookshelf.entity.ReservationState.CANCELLED, "
        + "r.cancelledAt = :now, r.updatedAt = :now "
        + "WHERE r.id = :id AND r.state = com.library.bookshelf.entity.ReservationState.RESERVED")
    int cancelReserved(@Param("id") UUID id, @Param("now") Instant now);
}
