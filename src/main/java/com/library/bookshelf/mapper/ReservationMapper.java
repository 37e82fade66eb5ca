package com.library.bookshelf.mapper;

import com.library.bookshelf.dto.response.ReservationResponse;
import com.library.bookshelf.entity.Reservation;

public final class ReservationMapper {

    private ReservationMapper() {}

    public static ReservationResponse toResponse(Reservation reservation) {
        return project(reservation, null);
    }

    public static ReservationResponse toListItem(Reservation reservation) {
        return project(reservation, String.valueOf(reservation.getUserId()));
    }

    private static ReservationResponse project(Reservation reservation, String userId) {
        return new ReservationResponse(
            reservation.getId(),
            reservation.getBookId(),
            userId,
            reservation.getForenames(),
            reservation.getSurname(),
            reservation.getState(),
            reservation.getReservedAt(),
            reservation.getCancelledAt()
        );
    }
}
