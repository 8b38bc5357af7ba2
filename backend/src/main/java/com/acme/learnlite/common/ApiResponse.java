package com.acme.learnlite.common;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse(boolean ok, String message, Object data, Object user, String token,
                          PageInfo pagination, String version, ApiError error) {

    public static ApiResponse success() {
        return new ApiResponse(true, null, null, null, null, null, null, null);
    }

    public static ApiResponse data(Object data) {
        return success().withData(data);
    }

    public static ApiResponse page(Object data, PageInfo pagination) {
        return new ApiResponse(true, null, data, null, null, pagination, null, null);
    }

    public static ApiResponse message(String message) {
        return success().withMessage(message);
    }

    public static ApiResponse failure(ApiError error) {
        return new ApiResponse(false, null, null, null, null, null, null, error);
    }

    public ApiResponse withMessage(String message) {
        return new ApiResponse(ok, message, data, user, token, pagination, version, error);
    }

    public ApiResponse withData(Object data) {
        return new ApiResponse(ok, message, data, user, token, pagination, version, error);
    }

    public ApiResponse withUser(Object user) {
        return new ApiResponse(ok, message, data, user, token, pagination, version, error);
    }

    public ApiResponse withToken(String token) {
        return new ApiResponse(ok, message, data, user, token, pagination, version, error);
    }

    public ApiResponse withVersion(String version) {
        return new ApiResponse(ok, message, data, user, token, pagination, version, error);
    }
}
