package com.acme.learnlite.validation;

import com.acme.learnlite.common.Role;

import java.util.Map;
import java.util.regex.Pattern;

public final class UserValidator {
    public static final int NAME_MAX = 255;
    public static final int PASSWORD_MIN = 6;
    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    private UserValidator() {}

    public static boolean isValidEmail(String email) {
        return email != null && EMAIL.matcher(email).matches();
    }

    public static ValidationResult validateCreateUser(Map<String, Object> data) {
        ValidationResult.Builder result = ValidationResult.builder();

        Object email = data.get("email");
        if (!(email instanceof String e) || e.isEmpty()) {
            result.add("email", "Email is required and must be a string");
        } else if (!isValidEmail(e.trim())) {
            result.add("email", "Invalid email format");
        }

        Object name = data.get("name");
        if (!(name instanceof String n) || n.isEmpty()) {
            result.add("name", "Name is required and must be a string");
        } else {
            checkName(n, result);
        }

        Object password = data.get("password");
        if (!(password instanceof String p) || p.isEmpty()) {
            result.add("password", "Password is required and must be a string");
        } else if (p.length() < PASSWORD_MIN) {
            result.add("password", "Password must be at least 6 characters long");
        }

        checkRole(data, result);
        return result.build();
    }

    public static ValidationResult validateUpdateUser(Map<String, Object> data) {
        ValidationResult.Builder result = ValidationResult.builder();

        if (data.containsKey("email")) {
            Object email = data.get("email");
            if (!(email instanceof String e) || !isValidEmail(e.trim())) {
                result.add("email", "Invalid email format");
            }
        }
        if (data.containsKey("name")) {
            Object name = data.get("name");
            if (!(name instanceof String n)) {
                result.add("name", "Name cannot be empty");
            } else {
                checkName(n, result);
            }
        }
        if (data.containsKey("password")) {
            Object password = data.get("password");
            if (!(password instanceof String p) || p.length() < PASSWORD_MIN) {
                result.add("password", "Password must be at least 6 characters long");
            }
        }
        checkRole(data, result);
        return result.build();
    }

    private static void checkName(String name, ValidationResult.Builder result) {
        if (name.trim().isEmpty()) {
            result.add("name", "Name cannot be empty");
        } else if (name.trim().length() > NAME_MAX) {
            result.add("name", "Name must be 255 characters or less");
        }
    }

    private static void checkRole(Map<String, Object> data, ValidationResult.Builder result) {
        Object role = data.get("role");
        if (role != null && Role.parse(role).isEmpty()) {
            result.add("role", "Role must be one of: admin, instructor, student");
        }
    }
}
