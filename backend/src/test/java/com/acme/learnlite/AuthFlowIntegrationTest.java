package com.acme.learnlite;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

public class AuthFlowIntegrationTest extends IntegrationTestBase {

    @Test
    void registerLoginMe() throws Exception {
        mvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"User@Example.com\",\"password\":\"password123\",\"name\":\"Test User\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.message").value("User registered successfully"))
                .andExpect(jsonPath("$.user.email").value("user@example.com"))
                .andExpect(jsonPath("$.user.role").value("student"))
                .andExpect(jsonPath("$.user.password_hash").doesNotExist())
                .andExpect(jsonPath("$.token").exists())
                .andExpect(jsonPath("$.version").value("v1.0"));

        String token = login("user@example.com", "password123");

        mvc.perform(get("/api/auth/me").header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user.email").value("user@example.com"))
                .andExpect(jsonPath("$.user.name").value("Test User"));
    }

    @Test
    void duplicateEmailIsConflict() throws Exception {
        register("dup@example.com", "password123", "First", null);
        mvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"dup@example.com\",\"password\":\"password123\",\"name\":\"Second\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.ok").value(false))
                .andExpect(jsonPath("$.error.code").value("EMAIL_EXISTS"))
                .andExpect(jsonPath("$.error.requestId").exists());
    }

    @Test
    void wrongPasswordIsRejected() throws Exception {
        register("login@example.com", "password123", "Login", null);
        mvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"login@example.com\",\"password\":\"wrongpassword\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error.code").value("INVALID_CREDENTIALS"))
                .andExpect(jsonPath("$.error.message").value("Invalid email or password"));
    }

    @Test
    void missingFieldsAreValidationErrors() throws Exception {
        mvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"x@example.com\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.message").value("Email, password, and name are required"));
    }

    @Test
    void unauthorizedBlocked() throws Exception {
        mvc.perform(get("/api/auth/me")).andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error.code").value("UNAUTHORIZED"));
        mvc.perform(get("/api/users").header(HttpHeaders.AUTHORIZATION, "Bearer not-a-token"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void requestIdIsEchoed() throws Exception {
        mvc.perform(get("/api/health").header("X-Request-ID", "trace-1"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-ID", "trace-1"))
                .andExpect(jsonPath("$.database").value("up"));
    }

    @Test
    void adminManagesUsers() throws Exception {
        String student = register("managed@example.com", "password123", "Managed", null);
        String admin = login(ADMIN_EMAIL, ADMIN_PASSWORD);

        mvc.perform(get("/api/users").header(HttpHeaders.AUTHORIZATION, bearer(student)))
                .andExpect(status().isForbidden());

        mvc.perform(get("/api/users").param("limit", "5").header(HttpHeaders.AUTHORIZATION, bearer(admin)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pagination.limit").value(5))
                .andExpect(jsonPath("$.data").isArray());

        mvc.perform(post("/api/users")
                        .header(HttpHeaders.AUTHORIZATION, bearer(admin))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"lecturer@example.com\",\"password\":\"password123\",\"name\":\"Lecturer\",\"role\":\"instructor\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.role").value("instructor"));

        mvc.perform(put("/api/users/abc")
                        .header(HttpHeaders.AUTHORIZATION, bearer(admin))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_ID"));
    }
}
