package com.acme.learnlite.common;

import org.springframework.http.HttpStatus;

public class RateLimitedException extends ApiException {
    public RateLimitedException() {
        super("RATE_LIMITED", "Too many attempts, please try again later", HttpStatus.TOO_MANY_REQUESTS);
    }
}
