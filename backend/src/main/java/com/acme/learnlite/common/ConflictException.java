package com.acme.learnlite.common;

import org.springframework.http.HttpStatus;

public class ConflictException extends ApiException {
    public ConflictException(String code, String message) {
        super(code, message, HttpStatus.CONFLICT);
    }

    public static ConflictException emailExists() {
        return new ConflictException("EMAIL_EXISTS", "Email already registered");
    }

    public static ConflictException alreadyEnrolled() {
        return new ConflictException("ALREADY_ENROLLED", "Already enrolled in this course");
    }
}
