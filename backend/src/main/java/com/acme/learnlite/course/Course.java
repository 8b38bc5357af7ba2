package com.acme.learnlite.course;

import com.acme.learnlite.db.Rows;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Course(
        long id,
        String title,
        @JsonInclude(JsonInclude.Include.ALWAYS) String description,
        @JsonProperty("price_cents") int priceCents,
        boolean published,
        @JsonProperty("instructor_id") long instructorId,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt,
        Instructor instructor) {

    public record Instructor(long id, String name) {}

    public static Course fromRow(Map<String, Object> row) {
        long instructorId = Rows.getLongOrZero(row, "instructor_id");
        Instructor instructor = row.containsKey("instructor_name")
                ? new Instructor(instructorId, Rows.getString(row, "instructor_name"))
                : null;
        Integer price = Rows.getInt(row, "price_cents");
        return new Course(
                Rows.getLongOrZero(row, "id"),
                Rows.getString(row, "title"),
                Rows.getString(row, "description"),
                price == null ? 0 : price,
                Rows.getBoolean(row, "published"),
                instructorId,
                Rows.getInstant(row, "created_at"),
                Rows.getInstant(row, "updated_at"),
                instructor);
    }
}
