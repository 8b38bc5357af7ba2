package com.acme.learnlite.lesson;

import com.acme.learnlite.db.Rows;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

public record Lesson(
        long id,
        @JsonProperty("course_id") long courseId,
        String title,
        @JsonProperty("content_md") String contentMd,
        @JsonProperty("video_url") String videoUrl,
        int position,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt) {

    public static Lesson fromRow(Map<String, Object> row) {
        Integer position = Rows.getInt(row, "position");
        return new Lesson(
                Rows.getLongOrZero(row, "id"),
                Rows.getLongOrZero(row, "course_id"),
                Rows.getString(row, "title"),
                Rows.getString(row, "content_md"),
                Rows.getString(row, "video_url"),
                position == null ? 0 : position,
                Rows.getInstant(row, "created_at"),
                Rows.getInstant(row, "updated_at"));
    }
}
