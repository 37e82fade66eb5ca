package com.library.bookshelf.service;

import com.library.bookshelf.security.ProfileClaims;

/**
 * Derives the name stored on a reservation from the owner's profile claims.
 *
 * <p>Precedence: given and family name when both are present; otherwise the full name
 * split at its first space; otherwise the email with a placeholder surname; otherwise
 * placeholders for both.
 */
public final class ReservationHolderNames {

    public static final String NO_NAME_PROVIDED = "No name provided";
    public static final String UNKNOWN_USER = "Unknown user";

    private ReservationHolderNames() {}

    public record HolderName(String forenames, String surname) {}

    public static HolderName derive(ProfileClaims profile) {
        if (profile == null) {
            return new HolderName(UNKNOWN_USER, NO_NAME_PROVIDED);
        }
        if (hasText(profile.givenName()) && hasText(profile.familyName())) {
            return new HolderName(profile.givenName(), profile.familyName());
        }
        if (hasText(profile.fullName())) {
            String fullName = profile.fullName().trim();
            int space = fullName.indexOf(' ');
            if (space < 0) {
                return new HolderName(fullName, "");
            }
            return new HolderName(fullName.substring(0, space), fullName.substring(space + 1));
        }
        if (hasText(profile.email())) {
            return new HolderName(profile.email(), NO_NAME_PROVIDED);
        }
        return new HolderName(UNKNOWN_USER, NO_NAME_PROVIDED);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
