package com.library.bookshelf.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Documents the session cookie set by the sign-in flow. Operations that need a signed-in
 * caller answer 302 to the login path without it.
 */
@Configuration
public class OpenApiConfig {

    static final String SESSION_SCHEME = "sessionCookie";

    @Bean
    public OpenAPI bookshelfOpenAPI(@Value("${spring.application.name:bookshelf-api}") String applicationName,
                                    BookshelfProperties properties) {
        SecurityScheme sessionCookie = new SecurityScheme()
            .type(SecurityScheme.Type.APIKEY)
            .in(SecurityScheme.In.COOKIE)
            .name("JSESSIONID")
            .description("Issued after signing in at " + properties.loginPath());

        return new OpenAPI()
            .info(new Info()
                .title(applicationName)
                .description("Books, provider-linked accounts and per-book reservations")
                .version("1.0.0"))
            .components(new Components().addSecuritySchemes(SESSION_SCHEME, sessionCookie))
            .addSecurityItem(new SecurityRequirement().addList(SESSION_SCHEME));
    }
}
