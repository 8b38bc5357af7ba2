package com.acme.learnlite.course;

import com.acme.learnlite.common.Role;
import com.acme.learnlite.security.AuthPrincipal;

/**
 * Role-based decisions about courses. Every method is a pure function of its arguments.
 */
public final class CoursePolicy {
    private CoursePolicy() {}

    public static boolean canView(AuthPrincipal actor, boolean published, long instructorId) {
        if (published) return true;
        if (actor == null) return false;
        return actor.isAdmin() || actor.userId() == instructorId;
    }

    public static boolean canView(AuthPrincipal actor, Course course) {
        return canView(actor, course.published(), course.instructorId());
    }

    public static boolean canModify(Role role, long actorId, long instructorId) {
        return switch (role) {
            case ADMIN -> true;
            case INSTRUCTOR -> actorId == instructorId;
            case STUDENT -> false;
        };
    }

    public static boolean canCreate(Role role) {
        return role == Role.ADMIN || role == Role.INSTRUCTOR;
    }

    public static boolean canDelete(AuthPrincipal actor) {
        return actor != null && actor.isAdmin();
    }

    public static boolean canAssignInstructor(Role role) {
        return role == Role.ADMIN;
    }

    public static CourseDtos.ListScope listScope(AuthPrincipal actor) {
        if (actor == null) return CourseDtos.ListScope.PUBLISHED_ONLY;
        return switch (actor.role()) {
            case ADMIN -> CourseDtos.ListScope.ALL;
            case INSTRUCTOR -> CourseDtos.ListScope.ownedBy(actor.userId());
            case STUDENT -> CourseDtos.ListScope.PUBLISHED_ONLY;
        };
    }
}
