package com.library.bookshelf.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.Set;

/**
 * Binds the {@code bookshelf.*} settings of application.yml.
 *
 * @param sessionUserAttribute session attribute holding the signed-in user's internal id
 * @param loginPath            where unauthenticated callers are redirected
 * @param defaultPageLimit     book page size when the request gives no {@code limit}
 * @param defaultRoles         roles granted to a user on first sign-in
 */
@Validated
@ConfigurationProperties(prefix = "bookshelf")
public record BookshelfProperties(
    String sessionUserAttribute,
    @Pattern(regexp = "/.*", message = "must be an absolute path") String loginPath,
    @Max(1000) int defaultPageLimit,
    Set<String> defaultRoles
) {

    public BookshelfProperties {
        if (sessionUserAttribute == null || sessionUserAttribute.isBlank()) {
            sessionUserAttribute = "user_id";
        }
        if (loginPath == null || loginPath.isBlank()) {
            loginPath = "/auth/login";
        }
        if (defaultPageLimit <= 0) {
            defaultPageLimit = 20;
        }
        defaultRoles = defaultRoles == null || defaultRoles.isEmpty() ? Set.of("viewer") : Set.copyOf(defaultRoles);
    }
}
