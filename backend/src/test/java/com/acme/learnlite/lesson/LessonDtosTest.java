package com.acme.learnlite.lesson;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LessonDtosTest {

    @Test
    void createCommandReadsPosition() {
        LessonDtos.CreateLessonCommand command = LessonDtos.CreateLessonCommand.from(Map.of("title", " Intro ", "position", "7"));
        assertEquals("Intro", command.title());
        assertEquals(7, command.position());
        assertNull(LessonDtos.CreateLessonCommand.from(Map.of("title", "Intro")).position());
    }

    @Test
    void updateReadsPositionAndTracksClearedFields() {
        LessonDtos.LessonUpdate update = LessonDtos.LessonUpdate.from(Map.of("position", 3, "video_url", "  "));
        assertEquals(3, update.position());
        assertTrue(update.videoSet());
        assertNull(update.videoUrl());
        assertFalse(update.isEmpty());
    }

    @Test
    void positionBeyondIntRangeIsDropped() {
        assertNull(LessonDtos.LessonUpdate.from(Map.of("position", 3_000_000_000L)).position());
    }
}
