package com.acme.learnlite.enrollment;

import com.acme.learnlite.db.Rows;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Enrollment(
        long id,
        @JsonProperty("user_id") long userId,
        @JsonProperty("course_id") long courseId,
        String status,
        @JsonProperty("enrolled_at") Instant enrolledAt,
        @JsonProperty("course_title") String courseTitle) {

    public static Enrollment fromRow(Map<String, Object> row) {
        return new Enrollment(
                Rows.getLongOrZero(row, "id"),
                Rows.getLongOrZero(row, "user_id"),
                Rows.getLongOrZero(row, "course_id"),
                Rows.getString(row, "status"),
                Rows.getInstant(row, "enrolled_at"),
                Rows.getString(row, "course_title"));
    }
}
