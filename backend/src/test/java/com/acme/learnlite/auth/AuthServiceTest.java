package com.acme.learnlite.auth;

import com.acme.learnlite.common.ConflictException;
import com.acme.learnlite.common.NotFoundException;
import com.acme.learnlite.common.Role;
import com.acme.learnlite.common.UnauthorizedException;
import com.acme.learnlite.common.ValidationException;
import com.acme.learnlite.db.QueryResult;
import com.acme.learnlite.db.SqlClient;
import com.acme.learnlite.user.UserDtos;
import com.acme.learnlite.user.UserProfile;
import com.acme.learnlite.user.UserService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class AuthServiceTest {
    private static final UserProfile PROFILE = new UserProfile(1L, "test@example.com", "Test User", Role.STUDENT, Instant.parse("2024-01-01T00:00:00Z"));

    @Mock
    private SqlClient sql;

    @Mock
    private CredentialService credentials;

    @Mock
    private UserService userService;

    @InjectMocks
    private AuthService authService;

    private AutoCloseable mocks;

    @BeforeEach
    void setup() {
        mocks = MockitoAnnotations.openMocks(this);
        when(credentials.generateToken(any())).thenReturn("jwt-token");
    }

    @AfterEach
    void tearDown() throws Exception {
        mocks.close();
    }

    private static Map<String, Object> body(Object... kv) {
        Map<String, Object> map = new HashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            map.put((String) kv[i], kv[i + 1]);
        }
        return map;
    }

    @Test
    void registerCreatesUserAndIssuesToken() {
        when(userService.createUser(any())).thenReturn(PROFILE);

        AuthDtos.AuthResult result = authService.register(body("email", " Test@Example.com ", "password", "password123", "name", "Test User"));

        assertEquals(PROFILE, result.user());
        assertEquals("jwt-token", result.token());
        verify(userService).createUser(new UserDtos.CreateUserCommand("test@example.com", "password123", "Test User", Role.STUDENT));
    }

    @Test
    void registerHonoursRequestedRole() {
        when(userService.createUser(any())).thenReturn(PROFILE);
        authService.register(body("email", "i@example.com", "password", "password123", "name", "I", "role", "instructor"));
        verify(userService).createUser(new UserDtos.CreateUserCommand("i@example.com", "password123", "I", Role.INSTRUCTOR));
    }

    @Test
    void registerRequiresAllFields() {
        ValidationException ex = assertThrows(ValidationException.class, () -> authService.register(body("email", "test@example.com")));
        assertEquals("Email, password, and name are required", ex.getMessage());
        verifyNoInteractions(userService);
    }

    @Test
    void registerRunsUserValidation() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> authService.register(body("email", "invalid-email", "password", "password123", "name", "Test")));
        assertEquals("Invalid email format", ex.getMessage());
    }

    @Test
    void registerPropagatesDuplicateEmail() {
        when(userService.createUser(any())).thenThrow(ConflictException.emailExists());
        ConflictException ex = assertThrows(ConflictException.class,
                () -> authService.register(body("email", "test@example.com", "password", "password123", "name", "Test")));
        assertEquals("Email already registered", ex.getMessage());
    }

    @Test
    void loginWithValidCredentials() {
        Map<String, Object> row = new HashMap<>(Map.of("id", 1L, "email", "test@example.com", "password_hash", "$2a$12$hash", "name", "Test User", "role", "student"));
        when(sql.query(contains("FROM users WHERE email = ?"), eq(List.of("test@example.com")))).thenReturn(QueryResult.of(List.of(row)));
        when(credentials.verifyPassword("password123", "$2a$12$hash")).thenReturn(true);
        when(credentials.createUserProfile(row)).thenReturn(PROFILE);

        AuthDtos.AuthResult result = authService.login(body("email", "Test@example.com", "password", "password123"));

        assertEquals("jwt-token", result.token());
        assertEquals(PROFILE, result.user());
    }

    @Test
    void unknownEmailAndWrongPasswordLookTheSame() {
        when(sql.query(anyString(), eq(List.of("nobody@example.com")))).thenReturn(QueryResult.of(List.of()));
        UnauthorizedException unknown = assertThrows(UnauthorizedException.class,
                () -> authService.login(body("email", "nobody@example.com", "password", "password123")));

        Map<String, Object> row = new HashMap<>(Map.of("id", 1L, "password_hash", "$2a$12$hash"));
        when(sql.query(anyString(), eq(List.of("test@example.com")))).thenReturn(QueryResult.of(List.of(row)));
        when(credentials.verifyPassword(anyString(), anyString())).thenReturn(false);
        UnauthorizedException wrong = assertThrows(UnauthorizedException.class,
                () -> authService.login(body("email", "test@example.com", "password", "wrongpassword")));

        assertEquals("INVALID_CREDENTIALS", unknown.getCode());
        assertEquals(unknown.getMessage(), wrong.getMessage());
        assertEquals("Invalid email or password", wrong.getMessage());
    }

    @Test
    void unknownEmailStillRunsPasswordCheck() {
        when(sql.query(anyString(), eq(List.of("ghost@example.com")))).thenReturn(QueryResult.of(List.of()));
        when(credentials.unknownUserHash()).thenReturn("$2a$12$unknown");

        assertThrows(UnauthorizedException.class,
                () -> authService.login(body("email", "ghost@example.com", "password", "password123")));

        verify(credentials).verifyPassword("password123", "$2a$12$unknown");
        verify(credentials, never()).createUserProfile(any());
    }

    @Test
    void loginRequiresEmailAndPassword() {
        ValidationException ex = assertThrows(ValidationException.class, () -> authService.login(body("email", "test@example.com")));
        assertEquals("Email and password are required", ex.getMessage());
    }

    @Test
    void meReturnsProfileOr404() {
        when(userService.findProfile(1L)).thenReturn(Optional.of(PROFILE));
        when(userService.findProfile(2L)).thenReturn(Optional.empty());

        assertEquals(PROFILE, authService.me(1L));
        assertThrows(NotFoundException.class, () -> authService.me(2L));
    }
}
