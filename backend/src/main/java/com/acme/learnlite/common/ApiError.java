package com.acme.learnlite.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.slf4j.MDC;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(String code, String message, String requestId, String timestamp, Object details) {
    public static final String REQUEST_ID_KEY = "requestId";

    public static ApiError of(String code, String message, Object details) {
        return new ApiError(code, message, MDC.get(REQUEST_ID_KEY), Instant.now().toString(), details);
    }

    public static ApiError of(String code, String message) {
        return of(code, message, null);
    }
}
