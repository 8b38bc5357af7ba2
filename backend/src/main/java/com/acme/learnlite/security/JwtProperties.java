package com.acme.learnlite.security;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.jwt")
public record JwtProperties(@NotBlank String secret, long expirationSeconds) {
    public JwtProperties {
        if (expirationSeconds <= 0) {
            expirationSeconds = 86400;
        }
    }
}
