package com.library.bookshelf.security;

import com.library.bookshelf.config.BookshelfProperties;
import com.library.bookshelf.entity.User;
import com.library.bookshelf.service.UserService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.core.Authentication;
import org.springframework.security.oauth2.core.oidc.user.OidcUser;
import org.springframework.security.oauth2.core.user.OAuth2User;
import org.springframework.security.web.authentication.AuthenticationSuccessHandler;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Completes the provider callback: upserts the local user from the verified profile and
 * stores its internal id in the session, then sends the browser to the book list.
 */
@Component
@RequiredArgsConstructor
public class OAuth2LoginSuccessHandler implements AuthenticationSuccessHandler {

    static final String DEFAULT_TARGET = "/books";

    private static final Logger log = LoggerFactory.getLogger(OAuth2LoginSuccessHandler.class);

    private final UserService userService;
    private final BookshelfProperties properties;

    @Override
    public void onAuthenticationSuccess(HttpServletRequest request, HttpServletResponse response,
                                        Authentication authentication) throws IOException {
        OAuth2User oauthUser = (OAuth2User) authentication.getPrincipal();
        String subject = oauthUser instanceof OidcUser oidcUser
            ? oidcUser.getSubject()
            : oauthUser.getAttribute("sub");

        User user = recordSignIn(subject, profileOf(oauthUser));
        request.getSession(true).setAttribute(properties.sessionUserAttribute(), user.getId());
        log.info("User {} signed in", user.getId());

        response.sendRedirect(request.getContextPath() + DEFAULT_TARGET);
    }

    /**
     * Two simultaneous first sign-ins for one subject both try to insert; the loser hits
     * the unique subject index and retries in a fresh transaction, which finds the row.
     */
    private User recordSignIn(String subject, ProfileClaims profile) {
        try {
            return userService.recordSignIn(subject, profile);
        } catch (DataIntegrityViolationException e) {
            log.info("Concurrent first sign-in for subject {}; retrying", subject);
            return userService.recordSignIn(subject, profile);
        }
    }

    static ProfileClaims profileOf(OAuth2User user) {
        return new ProfileClaims(
            user.getAttribute("given_name"),
            user.getAttribute("family_name"),
            user.getAttribute("name"),
            user.getAttribute("email")
        );
    }
}
