package com.library.bookshelf.security;

import java.util.Collection;
import java.util.Set;

/**
 * The signed-in user a request acts for.
 */
public record UserPrincipal(
    Long id,
    String email,
    Set<String> roles,
    ProfileClaims profile
) {

    public UserPrincipal {
        roles = roles == null ? Set.of() : Set.copyOf(roles);
    }

    public boolean hasAnyRole(Collection<String> allowed) {
        return allowed.stream().anyMatch(roles::contains);
    }

    public boolean isAdmin() {
        return roles.contains(Roles.ADMIN);
    }
}
