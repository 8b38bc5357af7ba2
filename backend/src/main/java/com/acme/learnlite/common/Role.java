package com.acme.learnlite.common;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum Role {
    ADMIN,
    INSTRUCTOR,
    STUDENT;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Role> parse(Object raw) {
        if (!(raw instanceof String s)) return Optional.empty();
        for (Role role : values()) {
            if (role.value().equals(s)) return Optional.of(role);
        }
        return Optional.empty();
    }

    public static Role fromValue(String raw) {
        return parse(raw).orElseThrow(() -> new IllegalArgumentException("Unknown role: " + raw));
    }
}
