package com.library.bookshelf.security;

import com.library.bookshelf.config.BookshelfProperties;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpSession;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.Optional;

/**
 * Resolves the request's principal from the session and enforces the {@link Authorize}
 * gate of the target handler.
 *
 * <p>Runs before argument resolution, so authentication and role failures are reported
 * before the request body is parsed or validated. The resolved principal is stored as a
 * request attribute for {@link CurrentUserArgumentResolver}.
 */
@Component
@RequiredArgsConstructor
public class AccessControlInterceptor implements HandlerInterceptor {

    public static final String PRINCIPAL_ATTRIBUTE = AccessControlInterceptor.class.getName() + ".principal";

    private static final Logger log = LoggerFactory.getLogger(AccessControlInterceptor.class);

    private final IdentityResolver identityResolver;
    private final AccessPolicy accessPolicy;
    private final BookshelfProperties properties;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod handlerMethod)) {
            return true;
        }

        Optional<UserPrincipal> principal = resolvePrincipal(request);
        request.setAttribute(PRINCIPAL_ATTRIBUTE, principal.orElse(null));

        Authorize gate = handlerMethod.getMethodAnnotation(Authorize.class);
        if (gate != null) {
            accessPolicy.authorize(principal, gate.value());
        }
        return true;
    }

    private Optional<UserPrincipal> resolvePrincipal(HttpServletRequest request) {
        HttpSession session = request.getSession(false);
        if (session == null) {
            return Optional.empty();
        }
        Long userId = toUserId(session.getAttribute(properties.sessionUserAttribute()));
        Optional<UserPrincipal> principal = identityResolver.resolve(userId);
        if (userId != null && principal.isEmpty()) {
            log.info("Session {} refers to unknown user {}; invalidating", session.getId(), userId);
            session.invalidate();
        }
        return principal;
    }

    private static Long toUserId(Object value) {
        if (value instanceof Long id) {
            return id;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text) {
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                log.warn("Ignoring malformed session user id '{}'", text);
                return null;
            }
        }
        return null;
    }
}
