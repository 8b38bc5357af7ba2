package com.acme.learnlite.validation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

public record ValidationResult(List<FieldViolation> errors) {
    public ValidationResult {
        errors = List.copyOf(errors);
    }

    @JsonProperty("isValid")
    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> messages() {
        return errors.stream().map(FieldViolation::message).toList();
    }

    static Builder builder() {
        return new Builder();
    }

    static final class Builder {
        private final List<FieldViolation> errors = new ArrayList<>();

        Builder add(String field, String message) {
            errors.add(new FieldViolation(field, message));
            return this;
        }

        ValidationResult build() {
            return new ValidationResult(errors);
        }
    }
}
