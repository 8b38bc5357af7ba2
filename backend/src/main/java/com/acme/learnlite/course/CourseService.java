package com.acme.learnlite.course;

import com.acme.learnlite.common.ForbiddenException;
import com.acme.learnlite.common.PageInfo;
import com.acme.learnlite.common.Pagination;
import com.acme.learnlite.common.Role;
import com.acme.learnlite.common.ValidationException;
import com.acme.learnlite.db.Rows;
import com.acme.learnlite.db.SqlClient;
import com.acme.learnlite.validation.FieldViolation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

@Service
public class CourseService {
    private static final Logger log = LoggerFactory.getLogger(CourseService.class);

    static final String COLUMNS = "id, title, description, price_cents, published, instructor_id, created_at, updated_at";
    static final String JOINED_COLUMNS = "c.id, c.title, c.description, c.price_cents, c.published, c.instructor_id, c.created_at, c.updated_at, u.name AS instructor_name";
    private static final String UNKNOWN_INSTRUCTOR = "Unknown";

    private final SqlClient sql;
    private final Executor overviewExecutor;

    public CourseService(SqlClient sql, @Qualifier("overviewExecutor") Executor overviewExecutor) {
        this.sql = sql;
        this.overviewExecutor = overviewExecutor;
    }

    public Course createCourse(CourseDtos.CreateCourseCommand data, long actorId, Role actorRole) {
        if (!CoursePolicy.canCreate(actorRole)) {
            log.warn("course creation denied actor={} role={}", actorId, actorRole.value());
            throw new ForbiddenException("Insufficient permissions to create course");
        }
        long instructorId = actorId;
        if (CoursePolicy.canAssignInstructor(actorRole) && data.instructorId() != null) {
            requireInstructor(data.instructorId());
            instructorId = data.instructorId();
        }
        Course course = sql.query(
                        "INSERT INTO courses (title, description, price_cents, instructor_id) VALUES (?, ?, ?, ?) RETURNING " + COLUMNS,
                        Arrays.asList(data.title(), data.description(), data.priceCents(), instructorId))
                .firstRow()
                .map(Course::fromRow)
                .orElseThrow(() -> new IllegalStateException("insert returned no row"));
        log.info("course created id={} instructor={}", course.id(), course.instructorId());
        return course;
    }

    public Optional<Course> getCourseById(long id, boolean withInstructor) {
        String query = withInstructor
                ? "SELECT " + JOINED_COLUMNS + " FROM courses c LEFT JOIN users u ON u.id = c.instructor_id WHERE c.id = ?"
                : "SELECT " + COLUMNS + " FROM courses WHERE id = ?";
        return sql.query(query, List.of(id)).firstRow().map(Course::fromRow);
    }

    public Optional<Course> updateCourse(long id, CourseDtos.CourseUpdate updates) {
        if (updates.isEmpty()) {
            return getCourseById(id, false);
        }
        if (updates.instructorId() != null) {
            requireInstructor(updates.instructorId());
        }

        List<String> sets = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        if (updates.title() != null) {
            sets.add("title = ?");
            params.add(updates.title());
        }
        if (updates.descriptionSet()) {
            sets.add("description = ?");
            params.add(updates.description());
        }
        if (updates.priceCents() != null) {
            sets.add("price_cents = ?");
            params.add(updates.priceCents());
        }
        if (updates.instructorId() != null) {
            sets.add("instructor_id = ?");
            params.add(updates.instructorId());
        }
        sets.add("updated_at = NOW()");
        params.add(id);

        Optional<Course> updated = sql.query("UPDATE courses SET " + String.join(", ", sets) + " WHERE id = ? RETURNING " + COLUMNS, params)
                .firstRow()
                .map(Course::fromRow);
        updated.ifPresent(c -> log.info("course updated id={}", c.id()));
        return updated;
    }

    public Optional<Course> togglePublished(long id, boolean publish) {
        Optional<Course> course = sql.query(
                        "UPDATE courses SET published = ?, updated_at = NOW() WHERE id = ? RETURNING " + COLUMNS,
                        List.of(publish, id))
                .firstRow()
                .map(Course::fromRow);
        course.ifPresent(c -> log.info("course {} id={}", publish ? "published" : "unpublished", c.id()));
        return course;
    }

    public CourseDtos.CoursePage listCourses(CourseDtos.CourseFilters filters) {
        List<String> conditions = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        if (filters.search() != null) {
            conditions.add("c.title ILIKE ?");
            params.add("%" + filters.search() + "%");
        }
        if (filters.publishedOnly()) {
            conditions.add("c.published = true");
        }
        if (filters.instructorId() != null) {
            conditions.add("c.instructor_id = ?");
            params.add(filters.instructorId());
        }
        String where = conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);

        long total = sql.query("SELECT COUNT(*) AS total FROM courses c" + where, params)
                .firstRow()
                .map(row -> Rows.getLongOrZero(row, "total"))
                .orElse(0L);

        List<Object> pageParams = new ArrayList<>(params);
        pageParams.add(filters.limit());
        pageParams.add(filters.offset());
        List<Course> courses = sql.query(
                        "SELECT " + JOINED_COLUMNS + " FROM courses c LEFT JOIN users u ON u.id = c.instructor_id"
                                + where + " ORDER BY c.created_at DESC LIMIT ? OFFSET ?",
                        pageParams)
                .rows().stream()
                .map(Course::fromRow)
                .toList();

        return new CourseDtos.CoursePage(courses, PageInfo.of(new Pagination(filters.page(), filters.limit()), total));
    }

    public boolean deleteCourse(long id) {
        Integer deleted = sql.query("DELETE FROM courses WHERE id = ?", List.of(id)).rowCount();
        boolean removed = deleted != null && deleted >= 1;
        if (removed) {
            log.info("course deleted id={}", id);
        }
        return removed;
    }

    public boolean canModifyCourse(long courseId, long actorId, Role role) {
        return sql.query("SELECT id, instructor_id FROM courses WHERE id = ?", List.of(courseId))
                .firstRow()
                .map(row -> CoursePolicy.canModify(role, actorId, Rows.getLongOrZero(row, "instructor_id")))
                .orElse(false);
    }

    public Optional<CourseDtos.CourseOverview> getCourseOverview(long id) {
        Optional<Map<String, Object>> courseRow = sql.query(
                        "SELECT c.id, c.title, c.published, c.instructor_id, c.created_at, u.name AS instructor_name "
                                + "FROM courses c LEFT JOIN users u ON u.id = c.instructor_id WHERE c.id = ?",
                        List.of(id))
                .firstRow();
        if (courseRow.isEmpty()) {
            return Optional.empty();
        }

        CompletableFuture<Map<String, Object>> lessons = aggregate(
                "SELECT COUNT(*) AS total FROM lessons WHERE course_id = ?", id);
        CompletableFuture<Map<String, Object>> enrollments = aggregate(
                "SELECT COUNT(*) FILTER (WHERE status = 'active') AS active, "
                        + "COUNT(*) FILTER (WHERE status = 'completed') AS completed "
                        + "FROM enrollments WHERE course_id = ?", id);
        CompletableFuture<Map<String, Object>> progress = aggregate(
                "SELECT AVG(p.pct) AS average_progress FROM ("
                        + "SELECT e.id, 100.0 * COUNT(lp.id) FILTER (WHERE lp.completed) "
                        + "/ NULLIF((SELECT COUNT(*) FROM lessons l WHERE l.course_id = e.course_id), 0) AS pct "
                        + "FROM enrollments e LEFT JOIN lesson_progress lp ON lp.enrollment_id = e.id "
                        + "WHERE e.course_id = ? GROUP BY e.id, e.course_id) p", id);
        CompletableFuture<Map<String, Object>> quizzes = aggregate(
                "SELECT COUNT(DISTINCT q.id) AS total_quizzes, COUNT(qq.id) AS total_questions "
                        + "FROM quizzes q LEFT JOIN quiz_questions qq ON qq.quiz_id = q.id WHERE q.course_id = ?", id);
        CompletableFuture<Map<String, Object>> certificates = aggregate(
                "SELECT COUNT(*) AS total FROM certificates WHERE course_id = ?", id);

        try {
            CompletableFuture.allOf(lessons, enrollments, progress, quizzes, certificates).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }

        Map<String, Object> course = courseRow.get();
        String instructorName = Rows.getString(course, "instructor_name");
        return Optional.of(new CourseDtos.CourseOverview(
                Rows.getLongOrZero(course, "id"),
                Rows.getString(course, "title"),
                Rows.getBoolean(course, "published"),
                new Course.Instructor(Rows.getLongOrZero(course, "instructor_id"), instructorName == null ? UNKNOWN_INSTRUCTOR : instructorName),
                Rows.getInstant(course, "created_at"),
                Rows.getLongOrZero(lessons.join(), "total"),
                new CourseDtos.EnrollmentStats(Rows.getLongOrZero(enrollments.join(), "active"), Rows.getLongOrZero(enrollments.join(), "completed")),
                Rows.roundedOrZero(progress.join(), "average_progress"),
                new CourseDtos.QuizStats(Rows.getLongOrZero(quizzes.join(), "total_quizzes"), Rows.getLongOrZero(quizzes.join(), "total_questions")),
                Rows.getLongOrZero(certificates.join(), "total")));
    }

    private CompletableFuture<Map<String, Object>> aggregate(String query, long courseId) {
        return CompletableFuture.supplyAsync(
                () -> sql.query(query, List.of(courseId)).firstRow().orElse(Collections.emptyMap()),
                overviewExecutor);
    }

    private void requireInstructor(long userId) {
        Optional<Role> role = sql.query("SELECT role FROM users WHERE id = ?", List.of(userId))
                .firstRow()
                .flatMap(row -> Role.parse(Rows.getString(row, "role")));
        if (role.isEmpty() || role.get() == Role.STUDENT) {
            throw new ValidationException("VALIDATION_ERROR", "Instructor must be an existing instructor or admin",
                    List.of(new FieldViolation("instructor_id", "Instructor must be an existing instructor or admin")));
        }
    }
}
