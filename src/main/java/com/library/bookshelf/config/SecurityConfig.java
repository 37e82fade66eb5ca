package com.library.bookshelf.config;

import com.library.bookshelf.security.OAuth2LoginFailureHandler;
import com.library.bookshelf.security.OAuth2LoginSuccessHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.logout.HttpStatusReturningLogoutSuccessHandler;

/**
 * Spring Security is used only for the OAuth2 login flow and logout. Per-operation access
 * decisions are made by {@code AccessControlInterceptor}, so every request is permitted
 * at the filter level.
 */
@Configuration
public class SecurityConfig {

    @Bean
    SecurityFilterChain filterChain(HttpSecurity http,
                                   OAuth2LoginSuccessHandler successHandler,
                                   OAuth2LoginFailureHandler failureHandler) throws Exception {
        http
            .csrf(AbstractHttpConfigurer::disable)
            .authorizeHttpRequests(auth -> auth.anyRequest().permitAll())
            .oauth2Login(oauth -> oauth
                .redirectionEndpoint(endpoint -> endpoint.baseUri("/auth/callback/*"))
                .successHandler(successHandler)
                .failureHandler(failureHandler))
            .logout(logout -> logout
                .logoutUrl("/auth/logout")
                .invalidateHttpSession(true)
                .deleteCookies("JSESSIONID")
                .logoutSuccessHandler(new HttpStatusReturningLogoutSuccessHandler(HttpStatus.OK)));

        return http.build();
    }
}
