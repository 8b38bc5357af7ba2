package com.acme.learnlite.auth;

import com.acme.learnlite.common.NotFoundException;
import com.acme.learnlite.common.UnauthorizedException;
import com.acme.learnlite.common.ValidationException;
import com.acme.learnlite.db.Rows;
import com.acme.learnlite.db.SqlClient;
import com.acme.learnlite.user.UserDtos;
import com.acme.learnlite.user.UserProfile;
import com.acme.learnlite.user.UserService;
import com.acme.learnlite.validation.InputValues;
import com.acme.learnlite.validation.UserValidator;
import com.acme.learnlite.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;

@Service
public class AuthService {
    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final SqlClient sql;
    private final CredentialService credentials;
    private final UserService userService;

    public AuthService(SqlClient sql, CredentialService credentials, UserService userService) {
        this.sql = sql;
        this.credentials = credentials;
        this.userService = userService;
    }

    public AuthDtos.AuthResult register(Map<String, Object> body) {
        if (InputValues.isBlank(body.get("email")) || InputValues.isBlank(body.get("password")) || InputValues.isBlank(body.get("name"))) {
            throw new ValidationException("Email, password, and name are required");
        }
        ValidationResult result = UserValidator.validateCreateUser(body);
        if (!result.isValid()) {
            throw ValidationException.of(result);
        }
        UserProfile user = userService.createUser(UserDtos.CreateUserCommand.from(body));
        log.info("user registered id={}", user.id());
        return new AuthDtos.AuthResult(user, credentials.generateToken(user));
    }

    public AuthDtos.AuthResult login(Map<String, Object> body) {
        if (InputValues.isBlank(body.get("email")) || !(body.get("password") instanceof String password) || password.isEmpty()) {
            throw new ValidationException("Email and password are required");
        }
        String email = ((String) body.get("email")).trim().toLowerCase(Locale.ROOT);
        Map<String, Object> row = sql.query(
                        "SELECT id, email, password_hash, name, role, created_at FROM users WHERE email = ?",
                        List.of(email))
                .firstRow()
                .orElse(null);
        String hash = row == null ? credentials.unknownUserHash() : Rows.getString(row, "password_hash");
        boolean matches = credentials.verifyPassword(password, hash);
        if (row == null || !matches) {
            log.warn("login failed email={}", email);
            throw UnauthorizedException.invalidCredentials();
        }
        UserProfile user = credentials.createUserProfile(row);
        return new AuthDtos.AuthResult(user, credentials.generateToken(user));
    }

    public UserProfile me(long userId) {
        return userService.findProfile(userId).orElseThrow(NotFoundException::user);
    }
}
