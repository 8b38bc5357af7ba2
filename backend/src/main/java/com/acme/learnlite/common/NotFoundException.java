package com.acme.learnlite.common;

import org.springframework.http.HttpStatus;

public class NotFoundException extends ApiException {
    public NotFoundException(String code, String message) {
        super(code, message, HttpStatus.NOT_FOUND);
    }

    public static NotFoundException course() {
        return new NotFoundException("COURSE_NOT_FOUND", "Course not found");
    }

    public static NotFoundException user() {
        return new NotFoundException("USER_NOT_FOUND", "User not found");
    }

    public static NotFoundException lesson() {
        return new NotFoundException("LESSON_NOT_FOUND", "Lesson not found");
    }
}
