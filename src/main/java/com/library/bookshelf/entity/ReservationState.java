package com.library.bookshelf.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle states for a {@link Reservation}.
 *
 * <p>Stored by name ({@code EnumType.STRING}); rendered in lower case in JSON.
 * {@link #CANCELLED} is terminal.
 */
public enum ReservationState {
    RESERVED,
    CANCELLED;

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }
}
