package com.library.bookshelf.service;

import com.library.bookshelf.config.BookshelfProperties;
import com.library.bookshelf.entity.User;
import com.library.bookshelf.repository.UserRepository;
import com.library.bookshelf.security.ProfileClaims;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.HashSet;

@Service
@RequiredArgsConstructor
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final UserRepository userRepository;
    private final BookshelfProperties properties;

    /**
     * Finds the user linked to the provider subject, creating it with the default roles
     * on first sign-in. Profile claims and the login timestamp are refreshed every time;
     * roles are left untouched for existing users.
     */
    @Transactional
    public User recordSignIn(String subject, ProfileClaims profile) {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("Identity provider profile has no subject");
        }
        User user = userRepository.findByExternalSubjectId(subject).orElseGet(() -> {
            User created = new User();
            created.setExternalSubjectId(subject);
            created.setRoles(new HashSet<>(properties.defaultRoles()));
            log.info("Creating user for provider subject {}", subject);
            return created;
        });

        user.setEmail(profile.email());
        user.setDisplayName(profile.fullName());
        user.setGivenName(profile.givenName());
        user.setFamilyName(profile.familyName());
        user.setLastLoginAt(Instant.now());
        return userRepository.save(user);
    }
}
