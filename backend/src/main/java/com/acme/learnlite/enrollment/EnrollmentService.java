package com.acme.learnlite.enrollment;

import com.acme.learnlite.common.ConflictException;
import com.acme.learnlite.common.NotFoundException;
import com.acme.learnlite.course.CoursePolicy;
import com.acme.learnlite.db.Rows;
import com.acme.learnlite.db.SqlClient;
import com.acme.learnlite.outbox.OutboxWriter;
import com.acme.learnlite.security.AuthPrincipal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class EnrollmentService {
    private static final Logger log = LoggerFactory.getLogger(EnrollmentService.class);
    public static final String ENROLLMENT_CREATED = "enrollment.created";

    private final SqlClient sql;
    private final OutboxWriter outbox;

    public EnrollmentService(SqlClient sql, OutboxWriter outbox) {
        this.sql = sql;
        this.outbox = outbox;
    }

    @Transactional
    public Enrollment enroll(long courseId, AuthPrincipal actor) {
        Map<String, Object> course = sql.query("SELECT id, title, published, instructor_id FROM courses WHERE id = ?", List.of(courseId))
                .firstRow()
                .orElseThrow(NotFoundException::course);
        if (!CoursePolicy.canView(actor, Rows.getBoolean(course, "published"), Rows.getLongOrZero(course, "instructor_id"))) {
            throw NotFoundException.course();
        }

        Enrollment enrollment = sql.query(
                        "INSERT INTO enrollments (user_id, course_id) VALUES (?, ?) ON CONFLICT (user_id, course_id) DO NOTHING "
                                + "RETURNING id, user_id, course_id, status, enrolled_at",
                        List.of(actor.userId(), courseId))
                .firstRow()
                .map(Enrollment::fromRow)
                .orElseThrow(ConflictException::alreadyEnrolled);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("enrollmentId", enrollment.id());
        payload.put("userId", actor.userId());
        payload.put("courseId", courseId);
        payload.put("courseTitle", Rows.getString(course, "title"));
        outbox.write(ENROLLMENT_CREATED, payload);

        log.info("enrollment created id={} user={} course={}", enrollment.id(), actor.userId(), courseId);
        return enrollment;
    }

    public List<Enrollment> listForUser(long userId) {
        return sql.query(
                        "SELECT e.id, e.user_id, e.course_id, e.status, e.enrolled_at, c.title AS course_title "
                                + "FROM enrollments e JOIN courses c ON c.id = e.course_id "
                                + "WHERE e.user_id = ? ORDER BY e.enrolled_at DESC",
                        List.of(userId))
                .rows().stream()
                .map(Enrollment::fromRow)
                .toList();
    }
}
