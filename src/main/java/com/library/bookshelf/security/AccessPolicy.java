package com.library.bookshelf.security;

import com.library.bookshelf.exception.ForbiddenException;
import com.library.bookshelf.exception.UnauthenticatedException;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Optional;

/**
 * Access decisions for books and reservations.
 *
 * <p>Every method is a pure function of its arguments: it either returns or throws
 * {@link UnauthenticatedException} / {@link ForbiddenException}. Callers are expected to
 * check authentication first, then roles, and to check ownership only once the target
 * resource is known to exist.
 */
@Component
public class AccessPolicy {

    public UserPrincipal requireAuthenticated(Optional<UserPrincipal> principal) {
        return principal.orElseThrow(UnauthenticatedException::new);
    }

    public void requireAnyRole(UserPrincipal principal, Collection<String> allowedRoles) {
        if (!principal.hasAnyRole(allowedRoles)) {
            throw new ForbiddenException("You don't have the permission to access the requested resource.");
        }
    }

    public void requireOwnerOrAdmin(UserPrincipal principal, Long resourceOwnerId) {
        if (principal.isAdmin()) {
            return;
        }
        if (principal.id() == null || !principal.id().equals(resourceOwnerId)) {
            throw new ForbiddenException("You don't have the permission to access the requested resource.");
        }
    }

    /**
     * Applies the authentication and role requirements of a gate.
     *
     * @return the principal, empty only for gates that do not require authentication
     */
    public Optional<UserPrincipal> authorize(Optional<UserPrincipal> principal, Gate gate) {
        if (!gate.isAuthenticationRequired()) {
            return principal;
        }
        UserPrincipal user = requireAuthenticated(principal);
        if (!gate.getAllowedRoles().isEmpty()) {
            requireAnyRole(user, gate.getAllowedRoles());
        }
        return Optional.of(user);
    }

    /**
     * Owner filter for a reservation listing. Admins get the filter they asked for
     * ({@code null} meaning every user); everyone else is pinned to their own id whatever
     * they asked for.
     */
    public Long reservationScope(UserPrincipal principal, Long requestedUserId) {
        if (principal.isAdmin()) {
            return requestedUserId;
        }
        return principal.id();
    }
}
