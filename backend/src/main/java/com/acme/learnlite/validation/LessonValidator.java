package com.acme.learnlite.validation;

import java.util.Map;

public final class LessonValidator {
    public static final int TITLE_MAX = 255;
    public static final int VIDEO_URL_MAX = 500;

    private LessonValidator() {}

    public static ValidationResult validateCreateLesson(Map<String, Object> data) {
        ValidationResult.Builder result = ValidationResult.builder();
        Object title = data.get("title");
        if (!(title instanceof String t) || t.isEmpty()) {
            result.add("title", "Title is required and must be a string");
        } else {
            checkTitle(t, result);
        }
        checkOptional(data, result);
        return result.build();
    }

    public static ValidationResult validateUpdateLesson(Map<String, Object> data) {
        ValidationResult.Builder result = ValidationResult.builder();
        if (data.containsKey("title")) {
            Object title = data.get("title");
            if (!(title instanceof String t)) {
                result.add("title", "Title cannot be empty");
            } else {
                checkTitle(t, result);
            }
        }
        checkOptional(data, result);
        return result.build();
    }

    private static void checkTitle(String title, ValidationResult.Builder result) {
        if (title.trim().isEmpty()) {
            result.add("title", "Title cannot be empty");
        } else if (title.trim().length() > TITLE_MAX) {
            result.add("title", "Title must be 255 characters or less");
        }
    }

    private static void checkOptional(Map<String, Object> data, ValidationResult.Builder result) {
        Object content = data.get("content_md");
        if (content != null && !(content instanceof String)) {
            result.add("content_md", "Content must be a string");
        }
        Object videoUrl = data.get("video_url");
        if (videoUrl != null) {
            if (!(videoUrl instanceof String url)) {
                result.add("video_url", "Video URL must be a string");
            } else if (url.trim().length() > VIDEO_URL_MAX) {
                result.add("video_url", "Video URL must be 500 characters or less");
            }
        }
        Object position = data.get("position");
        if (position != null && !isPosition(position)) {
            result.add("position", "Position must be a positive integer");
        }
    }

    private static boolean isPosition(Object value) {
        Long position = InputValues.toPositiveLong(value);
        return position != null && position <= Integer.MAX_VALUE;
    }
}
