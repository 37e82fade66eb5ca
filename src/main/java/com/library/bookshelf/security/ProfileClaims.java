package com.library.bookshelf.security;

/**
 * Name and email claims of a signed-in user's identity-provider profile. Any component
 * may be {@code null}.
 */
public record ProfileClaims(
    String givenName,
    String familyName,
    String fullName,
    String email
) {}
