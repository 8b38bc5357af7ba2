package com.acme.learnlite.user;

import com.acme.learnlite.common.Role;
import com.acme.learnlite.db.Rows;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Public projection of a user row. The password hash never makes it into this type.
 */
public record UserProfile(long id, String email, String name, Role role, @JsonProperty("created_at") Instant createdAt) {
    public static UserProfile fromRow(Map<String, Object> row) {
        return new UserProfile(
                Rows.getLongOrZero(row, "id"),
                Rows.getString(row, "email"),
                Rows.getString(row, "name"),
                Role.fromValue(Rows.getString(row, "role")),
                Rows.getInstant(row, "created_at"));
    }
}
