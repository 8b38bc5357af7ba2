package com.acme.learnlite.course;

import com.acme.learnlite.common.PageInfo;
import com.acme.learnlite.validation.CourseValidator;
import com.acme.learnlite.validation.InputValues;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public class CourseDtos {
    /** Built from a body that already passed {@code validateCreateCourse}. */
    public record CreateCourseCommand(String title, String description, int priceCents, Long instructorId) {
        public static CreateCourseCommand from(Map<String, Object> body) {
            return new CreateCourseCommand(
                    InputValues.trimmed(body.get("title")),
                    InputValues.trimmedOrNull(body.get("description")),
                    CourseValidator.normalizePrice(body.get("price_cents")),
                    InputValues.toPositiveLong(body.get("instructor_id")));
        }
    }

    /**
     * Partial update. Null means "leave unchanged", except for description where
     * {@code descriptionSet} tells an explicit clear apart from an absent key.
     */
    public record CourseUpdate(String title, String description, boolean descriptionSet, Integer priceCents, Long instructorId) {
        public static CourseUpdate from(Map<String, Object> body) {
            return new CourseUpdate(
                    InputValues.trimmed(body.get("title")),
                    InputValues.trimmedOrNull(body.get("description")),
                    body.containsKey("description"),
                    body.containsKey("price_cents") ? CourseValidator.normalizePrice(body.get("price_cents")) : null,
                    InputValues.toPositiveLong(body.get("instructor_id")));
        }

        public boolean isEmpty() {
            return title == null && !descriptionSet && priceCents == null && instructorId == null;
        }
    }

    public record CourseFilters(int page, int limit, String search, boolean publishedOnly, Long instructorId) {
        public long offset() {
            return (long) (page - 1) * limit;
        }
    }

    public record CoursePage(List<Course> courses, PageInfo pagination) {}

    public record ListScope(boolean publishedOnly, Long instructorId) {
        public static final ListScope ALL = new ListScope(false, null);
        public static final ListScope PUBLISHED_ONLY = new ListScope(true, null);

        public static ListScope ownedBy(long instructorId) {
            return new ListScope(false, instructorId);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CourseOverview(
            long id,
            String title,
            boolean published,
            Course.Instructor instructor,
            Instant createdAt,
            long totalLessons,
            EnrollmentStats enrollments,
            long averageProgress,
            QuizStats quizzes,
            long certificatesIssued) {
    }

    public record EnrollmentStats(long active, long completed) {}

    public record QuizStats(long total, long totalQuestions) {}
}
