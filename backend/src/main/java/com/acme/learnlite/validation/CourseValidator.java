package com.acme.learnlite.validation;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

public final class CourseValidator {
    public static final int TITLE_MAX = 255;

    private CourseValidator() {}

    public static ValidationResult validateCreateCourse(Map<String, Object> data) {
        ValidationResult.Builder result = ValidationResult.builder();

        Object title = data.get("title");
        if (!(title instanceof String t) || t.isEmpty()) {
            result.add("title", "Title is required and must be a string");
        } else {
            checkTitle(t, result);
        }

        checkDescription(data, result);

        if (data.get("price_cents") == null) {
            result.add("price_cents", "Price is required");
        } else {
            checkPrice(data.get("price_cents"), result);
        }

        checkInstructorId(data, result);
        return result.build();
    }

    public static ValidationResult validateUpdateCourse(Map<String, Object> data) {
        ValidationResult.Builder result = ValidationResult.builder();

        if (data.containsKey("title")) {
            Object title = data.get("title");
            if (!(title instanceof String t)) {
                result.add("title", "Title cannot be empty");
            } else {
                checkTitle(t, result);
            }
        }
        checkDescription(data, result);
        if (data.containsKey("price_cents")) {
            checkPrice(data.get("price_cents"), result);
        }
        checkInstructorId(data, result);
        return result.build();
    }

    /**
     * Whole amounts are taken as cents already; fractional amounts are a
     * currency value and are converted to cents with half-up rounding.
     */
    public static Integer normalizePrice(Object value) {
        BigDecimal amount = InputValues.toDecimal(value);
        if (amount == null) return null;
        BigDecimal cents = amount.stripTrailingZeros().scale() <= 0
                ? amount
                : amount.movePointRight(2).setScale(0, RoundingMode.HALF_UP);
        try {
            return cents.intValueExact();
        } catch (ArithmeticException e) {
            return null;
        }
    }

    private static void checkTitle(String title, ValidationResult.Builder result) {
        if (title.trim().isEmpty()) {
            result.add("title", "Title cannot be empty");
        } else if (title.trim().length() > TITLE_MAX) {
            result.add("title", "Title must be 255 characters or less");
        }
    }

    private static void checkDescription(Map<String, Object> data, ValidationResult.Builder result) {
        Object description = data.get("description");
        if (description != null && !(description instanceof String)) {
            result.add("description", "Description must be a string");
        }
    }

    private static void checkPrice(Object raw, ValidationResult.Builder result) {
        Integer cents = normalizePrice(raw);
        if (cents == null) {
            result.add("price_cents", "Price must be a valid number");
        } else if (cents < 0) {
            result.add("price_cents", "Price cannot be negative");
        }
    }

    private static void checkInstructorId(Map<String, Object> data, ValidationResult.Builder result) {
        Object instructorId = data.get("instructor_id");
        if (instructorId != null && InputValues.toPositiveLong(instructorId) == null) {
            result.add("instructor_id", "Instructor ID must be a positive integer");
        }
    }
}
