package com.acme.learnlite.validation;

public record FieldViolation(String field, String message) {
}
