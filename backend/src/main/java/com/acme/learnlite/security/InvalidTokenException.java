package com.acme.learnlite.security;

import com.acme.learnlite.common.ApiException;
import org.springframework.http.HttpStatus;

public abstract class InvalidTokenException extends ApiException {
    protected InvalidTokenException(String code, String message) {
        super(code, message, HttpStatus.UNAUTHORIZED);
    }
}
