package com.library.bookshelf.dto.response;

import com.library.bookshelf.entity.ReservationState;

import java.time.Instant;
import java.util.UUID;

/**
 * Reservation projection. {@code userId} is only filled in for listings; single
 * reservation responses leave it {@code null}, which drops it from the JSON.
 */
public record ReservationResponse(
    UUID id,
    UUID bookId,
    String userId,
    String forenames,
    String surname,
    ReservationState state,
    Instant reservedAt,
    Instant cancelledAt
) {}
