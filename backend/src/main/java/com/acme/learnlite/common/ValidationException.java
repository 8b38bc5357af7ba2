package com.acme.learnlite.common;

import com.acme.learnlite.validation.FieldViolation;
import com.acme.learnlite.validation.ValidationResult;
import org.springframework.http.HttpStatus;

import java.util.List;

public class ValidationException extends ApiException {
    private final List<FieldViolation> details;

    public ValidationException(String code, String message, List<FieldViolation> details) {
        super(code, message, HttpStatus.BAD_REQUEST);
        this.details = details;
    }

    public ValidationException(String message) {
        this("VALIDATION_ERROR", message, null);
    }

    public static ValidationException of(ValidationResult result) {
        String message = result.errors().isEmpty() ? "Validation failed" : result.errors().get(0).message();
        return new ValidationException("VALIDATION_ERROR", message, result.errors());
    }

    public static ValidationException invalidId(String what) {
        return new ValidationException("INVALID_ID", "Invalid " + what + " ID", null);
    }

    @Override
    public List<FieldViolation> getDetails() {
        return details;
    }
}
