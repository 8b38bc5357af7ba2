package com.acme.learnlite.common;

import com.acme.learnlite.validation.FieldViolation;
import com.acme.learnlite.validation.ValidationResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ApiExceptionHandlerTest {
    private final ApiExceptionHandler handler = new ApiExceptionHandler();

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void apiExceptionsKeepTheirStatusAndCode() {
        MDC.put(ApiError.REQUEST_ID_KEY, "req-123");

        ResponseEntity<ApiResponse> response = handler.api(NotFoundException.course());

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        ApiResponse body = response.getBody();
        assertFalse(body.ok());
        assertEquals("COURSE_NOT_FOUND", body.error().code());
        assertEquals("Course not found", body.error().message());
        assertEquals("req-123", body.error().requestId());
        assertNotNull(body.error().timestamp());
    }

    @Test
    void validationDetailsCarryEveryViolation() {
        ValidationResult result = new ValidationResult(List.of(
                new FieldViolation("title", "Title is required and must be a string"),
                new FieldViolation("price_cents", "Price is required")));

        ResponseEntity<ApiResponse> response = handler.api(ValidationException.of(result));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("Title is required and must be a string", response.getBody().error().message());
        assertEquals(result.errors(), response.getBody().error().details());
    }

    @Test
    void accessDeniedBecomesForbidden() {
        ResponseEntity<ApiResponse> response = handler.denied(new AccessDeniedException("nope"));
        assertEquals(HttpStatus.FORBIDDEN, response.getStatusCode());
        assertEquals("FORBIDDEN", response.getBody().error().code());
    }

    @Test
    void unexpectedErrorsDoNotLeakDetails() {
        ResponseEntity<ApiResponse> response = handler.unexpected(new IllegalStateException("db password is hunter2"));
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("INTERNAL_ERROR", response.getBody().error().code());
        assertEquals("An unexpected error occurred", response.getBody().error().message());
    }

    @Test
    void rateLimitIs429() {
        assertEquals(HttpStatus.TOO_MANY_REQUESTS, handler.api(new RateLimitedException()).getStatusCode());
    }
}
