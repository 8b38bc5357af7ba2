package com.acme.learnlite.validation;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CourseValidatorTest {

    private static Map<String, Object> body(Object... kv) {
        Map<String, Object> map = new HashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            map.put((String) kv[i], kv[i + 1]);
        }
        return map;
    }

    @Test
    void validCourseDataPasses() {
        ValidationResult result = CourseValidator.validateCreateCourse(body("title", "Java 101", "description", "Intro", "price_cents", 4999));
        assertTrue(result.isValid());
        assertTrue(result.errors().isEmpty());
    }

    @Test
    void missingTitleAndPriceAreBothReported() {
        ValidationResult result = CourseValidator.validateCreateCourse(body("description", "x"));
        assertFalse(result.isValid());
        assertEquals(2, result.errors().size());
        assertTrue(result.messages().contains("Title is required and must be a string"));
        assertTrue(result.messages().contains("Price is required"));
    }

    @Test
    void titleLongerThan255IsRejected() {
        ValidationResult result = CourseValidator.validateCreateCourse(body("title", "a".repeat(256), "price_cents", 100));
        assertEquals("Title must be 255 characters or less", result.errors().get(0).message());
        assertTrue(CourseValidator.validateCreateCourse(body("title", "a".repeat(255), "price_cents", 100)).isValid());
    }

    @Test
    void negativeAndNonNumericPricesAreRejected() {
        assertEquals("Price cannot be negative",
                CourseValidator.validateCreateCourse(body("title", "T", "price_cents", -100)).errors().get(0).message());
        assertEquals("Price must be a valid number",
                CourseValidator.validateCreateCourse(body("title", "T", "price_cents", "abc")).errors().get(0).message());
    }

    @Test
    void nonStringDescriptionIsRejected() {
        ValidationResult result = CourseValidator.validateCreateCourse(body("title", "T", "price_cents", 1, "description", 42));
        assertEquals("Description must be a string", result.errors().get(0).message());
    }

    @Test
    void invalidInstructorIdIsRejected() {
        for (Object bad : new Object[]{"invalid", 0, -3, 1.5}) {
            ValidationResult result = CourseValidator.validateCreateCourse(body("title", "T", "price_cents", 1, "instructor_id", bad));
            assertEquals("Instructor ID must be a positive integer", result.errors().get(0).message(), "value " + bad);
        }
        assertTrue(CourseValidator.validateCreateCourse(body("title", "T", "price_cents", 1, "instructor_id", "7")).isValid());
    }

    @Test
    void updateAcceptsPartialData() {
        assertTrue(CourseValidator.validateUpdateCourse(body("title", "New title")).isValid());
        assertTrue(CourseValidator.validateUpdateCourse(body()).isValid());
    }

    @Test
    void updateRejectsEmptyTitle() {
        ValidationResult result = CourseValidator.validateUpdateCourse(body("title", "   "));
        assertEquals("Title cannot be empty", result.errors().get(0).message());
    }

    @Test
    void updateRejectsNegativePrice() {
        assertEquals("Price cannot be negative", CourseValidator.validateUpdateCourse(body("price_cents", -1)).errors().get(0).message());
    }

    @Test
    void normalizePriceTreatsWholeValuesAsCents() {
        assertEquals(4999, CourseValidator.normalizePrice(4999));
        assertEquals(4999, CourseValidator.normalizePrice("4999"));
        assertEquals(4999, CourseValidator.normalizePrice(4999.0));
        assertEquals(0, CourseValidator.normalizePrice(0));
    }

    @Test
    void normalizePriceConvertsFractionalCurrencyToCents() {
        assertEquals(4999, CourseValidator.normalizePrice(49.99));
        assertEquals(4999, CourseValidator.normalizePrice("49.99"));
        assertEquals(5000, CourseValidator.normalizePrice(49.995));
        assertEquals(1, CourseValidator.normalizePrice(0.01));
        assertEquals(1050, CourseValidator.normalizePrice("10.5"));
    }

    @Test
    void normalizePriceReturnsNullForGarbage() {
        assertNull(CourseValidator.normalizePrice(null));
        assertNull(CourseValidator.normalizePrice(Double.NaN));
        assertNull(CourseValidator.normalizePrice(Double.POSITIVE_INFINITY));
        assertNull(CourseValidator.normalizePrice(""));
        assertNull(CourseValidator.normalizePrice("abc"));
        assertNull(CourseValidator.normalizePrice(Map.of()));
    }

    @Test
    void normalizePriceKeepsNegativeValues() {
        assertEquals(-100, CourseValidator.normalizePrice(-100));
    }
}
