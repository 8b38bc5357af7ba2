package com.acme.learnlite.lesson;

import com.acme.learnlite.db.SqlClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

@Service
public class LessonService {
    private static final Logger log = LoggerFactory.getLogger(LessonService.class);
    static final String COLUMNS = "id, course_id, title, content_md, video_url, position, created_at, updated_at";

    private final SqlClient sql;

    public LessonService(SqlClient sql) {
        this.sql = sql;
    }

    public List<Lesson> listLessons(long courseId) {
        return sql.query("SELECT " + COLUMNS + " FROM lessons WHERE course_id = ? ORDER BY position ASC, id ASC", List.of(courseId))
                .rows().stream()
                .map(Lesson::fromRow)
                .toList();
    }

    /**
     * Appends after the current last lesson when no position is given.
     */
    public Lesson createLesson(long courseId, LessonDtos.CreateLessonCommand command) {
        String positionSql;
        Object positionParam;
        if (command.position() != null) {
            positionSql = "?";
            positionParam = command.position();
        } else {
            positionSql = "(SELECT COALESCE(MAX(position), 0) + 1 FROM lessons WHERE course_id = ?)";
            positionParam = courseId;
        }
        Lesson lesson = sql.query(
                        "INSERT INTO lessons (course_id, title, content_md, video_url, position) VALUES (?, ?, ?, ?, " + positionSql + ") RETURNING " + COLUMNS,
                        Arrays.asList(courseId, command.title(), command.contentMd(), command.videoUrl(), positionParam))
                .firstRow()
                .map(Lesson::fromRow)
                .orElseThrow(() -> new IllegalStateException("insert returned no row"));
        log.info("lesson created id={} course={}", lesson.id(), courseId);
        return lesson;
    }

    public Optional<Lesson> updateLesson(long courseId, long lessonId, LessonDtos.LessonUpdate update) {
        if (update.isEmpty()) {
            return sql.query("SELECT " + COLUMNS + " FROM lessons WHERE id = ? AND course_id = ?", List.of(lessonId, courseId))
                    .firstRow()
                    .map(Lesson::fromRow);
        }
        List<String> sets = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        if (update.title() != null) {
            sets.add("title = ?");
            params.add(update.title());
        }
        if (update.contentSet()) {
            sets.add("content_md = ?");
            params.add(update.contentMd());
        }
        if (update.videoSet()) {
            sets.add("video_url = ?");
            params.add(update.videoUrl());
        }
        if (update.position() != null) {
            sets.add("position = ?");
            params.add(update.position());
        }
        sets.add("updated_at = NOW()");
        params.add(lessonId);
        params.add(courseId);
        return sql.query("UPDATE lessons SET " + String.join(", ", sets) + " WHERE id = ? AND course_id = ? RETURNING " + COLUMNS, params)
                .firstRow()
                .map(Lesson::fromRow);
    }

    public boolean deleteLesson(long courseId, long lessonId) {
        Integer deleted = sql.query("DELETE FROM lessons WHERE id = ? AND course_id = ?", List.of(lessonId, courseId)).rowCount();
        return deleted != null && deleted >= 1;
    }
}
