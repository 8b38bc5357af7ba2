package com.acme.learnlite.lesson;

import com.acme.learnlite.common.ApiResponse;
import com.acme.learnlite.common.ForbiddenException;
import com.acme.learnlite.common.NotFoundException;
import com.acme.learnlite.common.ValidationException;
import com.acme.learnlite.course.Course;
import com.acme.learnlite.course.CoursePolicy;
import com.acme.learnlite.course.CourseService;
import com.acme.learnlite.security.AuthPrincipal;
import com.acme.learnlite.security.SecurityUtils;
import com.acme.learnlite.validation.InputValues;
import com.acme.learnlite.validation.LessonValidator;
import com.acme.learnlite.validation.ValidationResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/courses/{courseId}/lessons")
public class LessonController {
    private final LessonService lessonService;
    private final CourseService courseService;

    public LessonController(LessonService lessonService, CourseService courseService) {
        this.lessonService = lessonService;
        this.courseService = courseService;
    }

    @GetMapping
    public ApiResponse list(@AuthenticationPrincipal AuthPrincipal principal, @PathVariable String courseId) {
        long id = parseId(courseId, "course");
        Course course = courseService.getCourseById(id, false).orElseThrow(NotFoundException::course);
        if (!CoursePolicy.canView(principal, course)) {
            throw NotFoundException.course();
        }
        return ApiResponse.data(lessonService.listLessons(id));
    }

    @PostMapping
    public ResponseEntity<ApiResponse> create(@AuthenticationPrincipal AuthPrincipal principal, @PathVariable String courseId, @RequestBody Map<String, Object> body) {
        long id = requireModify(principal, courseId);
        ValidationResult result = LessonValidator.validateCreateLesson(body);
        if (!result.isValid()) {
            throw ValidationException.of(result);
        }
        Lesson lesson = lessonService.createLesson(id, LessonDtos.CreateLessonCommand.from(body));
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.data(lesson));
    }

    @PutMapping("/{lessonId}")
    public ApiResponse update(@AuthenticationPrincipal AuthPrincipal principal, @PathVariable String courseId, @PathVariable String lessonId, @RequestBody Map<String, Object> body) {
        long id = requireModify(principal, courseId);
        long lesson = parseId(lessonId, "lesson");
        ValidationResult result = LessonValidator.validateUpdateLesson(body);
        if (!result.isValid()) {
            throw ValidationException.of(result);
        }
        return ApiResponse.data(lessonService.updateLesson(id, lesson, LessonDtos.LessonUpdate.from(body)).orElseThrow(NotFoundException::lesson));
    }

    @DeleteMapping("/{lessonId}")
    public ApiResponse delete(@AuthenticationPrincipal AuthPrincipal principal, @PathVariable String courseId, @PathVariable String lessonId) {
        long id = requireModify(principal, courseId);
        if (!lessonService.deleteLesson(id, parseId(lessonId, "lesson"))) {
            throw NotFoundException.lesson();
        }
        return ApiResponse.message("Lesson deleted successfully");
    }

    private long requireModify(AuthPrincipal principal, String rawCourseId) {
        AuthPrincipal actor = SecurityUtils.require(principal);
        long id = parseId(rawCourseId, "course");
        if (!courseService.canModifyCourse(id, actor.userId(), actor.role())) {
            throw new ForbiddenException("You do not have permission to modify this course");
        }
        return id;
    }

    private static long parseId(String raw, String what) {
        Long id = InputValues.toPositiveLong(raw);
        if (id == null) {
            throw ValidationException.invalidId(what);
        }
        return id;
    }
}
