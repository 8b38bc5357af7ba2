package com.acme.learnlite.user;

import com.acme.learnlite.common.PageInfo;
import com.acme.learnlite.common.Role;
import com.acme.learnlite.validation.InputValues;

import java.util.List;
import java.util.Locale;
import java.util.Map;

public class UserDtos {
    public record CreateUserCommand(String email, String password, String name, Role role) {
        public static CreateUserCommand from(Map<String, Object> body) {
            return new CreateUserCommand(
                    normalizeEmail(body.get("email")),
                    (String) body.get("password"),
                    InputValues.trimmed(body.get("name")),
                    Role.parse(body.get("role")).orElse(Role.STUDENT));
        }
    }

    /** Null fields are left unchanged. */
    public record UpdateUserCommand(String email, String password, String name, Role role) {
        public static UpdateUserCommand from(Map<String, Object> body) {
            return new UpdateUserCommand(
                    normalizeEmail(body.get("email")),
                    body.get("password") instanceof String p ? p : null,
                    InputValues.trimmed(body.get("name")),
                    Role.parse(body.get("role")).orElse(null));
        }

        public boolean isEmpty() {
            return email == null && password == null && name == null && role == null;
        }
    }

    public record UserPage(List<UserProfile> users, PageInfo pagination) {}

    static String normalizeEmail(Object raw) {
        String email = InputValues.trimmed(raw);
        return email == null ? null : email.toLowerCase(Locale.ROOT);
    }
}
