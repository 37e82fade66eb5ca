package com.library.bookshelf.security;

import com.library.bookshelf.entity.User;
import com.library.bookshelf.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Turns the user id carried in a session into the principal of the request.
 *
 * <p>An empty result means the caller is logged out: either the session carries no id or
 * the id no longer matches a user. In the latter case the session is stale and the caller
 * should invalidate it.
 */
@Service
@RequiredArgsConstructor
public class IdentityResolver {

    private final UserRepository userRepository;

    @Transactional(readOnly = true)
    public Optional<UserPrincipal> resolve(Long sessionUserId) {
        if (sessionUserId == null) {
            return Optional.empty();
        }
        return userRepository.findById(sessionUserId).map(IdentityResolver::toPrincipal);
    }

    static UserPrincipal toPrincipal(User user) {
        ProfileClaims profile = new ProfileClaims(
            user.getGivenName(),
            user.getFamilyName(),
            user.getDisplayName(),
            user.getEmail()
        );
        return new UserPrincipal(user.getId(), user.getEmail(), user.getRoles(), profile);
    }
}
