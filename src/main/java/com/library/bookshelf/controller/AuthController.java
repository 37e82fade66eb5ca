package com.library.bookshelf.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

/**
 * Entry point of the sign-in flow. The provider callback ({@code /auth/callback/google})
 * and {@code /auth/logout} are served by the Spring Security filter chain.
 */
@RestController
@RequestMapping("/auth")
@Tag(name = "Auth", description = "Sign-in through the external identity provider")
public class AuthController {

    static final String AUTHORIZATION_PATH = "/oauth2/authorization/google";

    @GetMapping("/login")
    @Operation(summary = "Start sign-in", description = "Redirects to the identity provider.")
    public ResponseEntity<Void> login() {
        String target = ServletUriComponentsBuilder.fromCurrentContextPath()
            .path(AUTHORIZATION_PATH)
            .toUriString();
        return ResponseEntity.status(HttpStatus.FOUND).header(HttpHeaders.LOCATION, target).build();
    }
}
