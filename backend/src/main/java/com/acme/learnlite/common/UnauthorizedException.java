package com.acme.learnlite.common;

import org.springframework.http.HttpStatus;

public class UnauthorizedException extends ApiException {
    public UnauthorizedException(String code, String message) {
        super(code, message, HttpStatus.UNAUTHORIZED);
    }

    public static UnauthorizedException authenticationRequired() {
        return new UnauthorizedException("UNAUTHORIZED", "Authentication required");
    }

    public static UnauthorizedException invalidCredentials() {
        return new UnauthorizedException("INVALID_CREDENTIALS", "Invalid email or password");
    }
}
