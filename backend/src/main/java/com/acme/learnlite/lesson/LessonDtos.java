package com.acme.learnlite.lesson;

import com.acme.learnlite.validation.InputValues;

import java.util.Map;

public class LessonDtos {
    public record CreateLessonCommand(String title, String contentMd, String videoUrl, Integer position) {
        public static CreateLessonCommand from(Map<String, Object> body) {
            return new CreateLessonCommand(
                    InputValues.trimmed(body.get("title")),
                    InputValues.trimmedOrNull(body.get("content_md")),
                    InputValues.trimmedOrNull(body.get("video_url")),
                    parsePosition(body));
        }
    }

    public record LessonUpdate(String title, String contentMd, boolean contentSet, String videoUrl, boolean videoSet, Integer position) {
        public static LessonUpdate from(Map<String, Object> body) {
            return new LessonUpdate(
                    InputValues.trimmed(body.get("title")),
                    InputValues.trimmedOrNull(body.get("content_md")),
                    body.containsKey("content_md"),
                    InputValues.trimmedOrNull(body.get("video_url")),
                    body.containsKey("video_url"),
                    parsePosition(body));
        }

        public boolean isEmpty() {
            return title == null && !contentSet && !videoSet && position == null;
        }
    }

    private static Integer parsePosition(Map<String, Object> body) {
        Long position = InputValues.toPositiveLong(body.get("position"));
        return position == null || position > Integer.MAX_VALUE ? null : position.intValue();
    }
}
