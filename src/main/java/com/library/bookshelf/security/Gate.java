package com.library.bookshelf.security;

import java.util.Set;

/**
 * The gated operations of the API together with their authentication and role
 * requirements. An empty role set means any signed-in user passes the role check.
 * Ownership of reservations is checked separately, after the reservation is loaded.
 */
public enum Gate {

    BOOK_READ(false, Set.of()),
    BOOK_WRITE(true, Set.of(Roles.ADMIN, Roles.EDITOR)),
    BOOK_DELETE(true, Set.of(Roles.ADMIN)),
    RESERVATION_CREATE(true, Set.of()),
    RESERVATION_ACCESS(true, Set.of()),
    RESERVATION_LIST(true, Set.of());

    private final boolean authenticationRequired;
    private final Set<String> allowedRoles;

    Gate(boolean authenticationRequired, Set<String> allowedRoles) {
        this.authenticationRequired = authenticationRequired;
        this.allowedRoles = allowedRoles;
    }

    public boolean isAuthenticationRequired() {
        return authenticationRequired;
    }

    public Set<String> getAllowedRoles() {
        return allowedRoles;
    }
}
