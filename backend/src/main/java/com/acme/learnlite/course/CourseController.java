package com.acme.learnlite.course;

import com.acme.learnlite.common.ApiResponse;
import com.acme.learnlite.common.ForbiddenException;
import com.acme.learnlite.common.NotFoundException;
import com.acme.learnlite.common.Pagination;
import com.acme.learnlite.common.ValidationException;
import com.acme.learnlite.security.AuthPrincipal;
import com.acme.learnlite.security.SecurityUtils;
import com.acme.learnlite.validation.CourseValidator;
import com.acme.learnlite.validation.InputValues;
import com.acme.learnlite.validation.QueryParams;
import com.acme.learnlite.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/courses")
public class CourseController {
    private static final Logger log = LoggerFactory.getLogger(CourseController.class);

    private final CourseService courseService;

    public CourseController(CourseService courseService) {
        this.courseService = courseService;
    }

    @GetMapping
    public ApiResponse index(@AuthenticationPrincipal AuthPrincipal principal, @RequestParam Map<String, String> params) {
        Pagination pagination = QueryParams.validatePagination(params);
        String search = QueryParams.sanitizeSearch(params.get("q"));
        CourseDtos.ListScope scope = CoursePolicy.listScope(principal);
        var page = courseService.listCourses(new CourseDtos.CourseFilters(
                pagination.page(), pagination.limit(), search, scope.publishedOnly(), scope.instructorId()));
        return ApiResponse.page(page.courses(), page.pagination());
    }

    @PostMapping
    public ResponseEntity<ApiResponse> create(@AuthenticationPrincipal AuthPrincipal principal, @RequestBody Map<String, Object> body) {
        AuthPrincipal actor = SecurityUtils.require(principal);
        ValidationResult result = CourseValidator.validateCreateCourse(body);
        if (!result.isValid()) {
            throw ValidationException.of(result);
        }
        Course course = courseService.createCourse(CourseDtos.CreateCourseCommand.from(body), actor.userId(), actor.role());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.data(course));
    }

    @GetMapping("/{id}")
    public ApiResponse show(@AuthenticationPrincipal AuthPrincipal principal, @PathVariable String id) {
        Course course = courseService.getCourseById(parseId(id), true).orElseThrow(NotFoundException::course);
        if (!CoursePolicy.canView(principal, course)) {
            throw NotFoundException.course();
        }
        return ApiResponse.data(course);
    }

    @PutMapping("/{id}")
    public ApiResponse update(@AuthenticationPrincipal AuthPrincipal principal, @PathVariable String id, @RequestBody Map<String, Object> body) {
        AuthPrincipal actor = SecurityUtils.require(principal);
        long courseId = parseId(id);
        requireModify(courseId, actor);
        Map<String, Object> input = body;
        if (!CoursePolicy.canAssignInstructor(actor.role()) && body.containsKey("instructor_id")) {
            // ignored for non-admins, whatever its value
            input = new HashMap<>(body);
            input.remove("instructor_id");
        }
        ValidationResult result = CourseValidator.validateUpdateCourse(input);
        if (!result.isValid()) {
            throw ValidationException.of(result);
        }
        CourseDtos.CourseUpdate update = CourseDtos.CourseUpdate.from(input);
        return ApiResponse.data(courseService.updateCourse(courseId, update).orElseThrow(NotFoundException::course));
    }

    @DeleteMapping("/{id}")
    public ApiResponse delete(@AuthenticationPrincipal AuthPrincipal principal, @PathVariable String id) {
        if (!CoursePolicy.canDelete(principal)) {
            log.warn("course delete denied actor={}", principal == null ? "anonymous" : principal.userId());
            throw new ForbiddenException("Only admins can delete courses");
        }
        if (!courseService.deleteCourse(parseId(id))) {
            throw NotFoundException.course();
        }
        return ApiResponse.message("Course deleted successfully");
    }

    @PostMapping("/{id}/publish")
    public ApiResponse publish(@AuthenticationPrincipal AuthPrincipal principal, @PathVariable String id) {
        return toggle(principal, id, true);
    }

    @PostMapping("/{id}/unpublish")
    public ApiResponse unpublish(@AuthenticationPrincipal AuthPrincipal principal, @PathVariable String id) {
        return toggle(principal, id, false);
    }

    @GetMapping("/{id}/overview")
    public ApiResponse overview(@AuthenticationPrincipal AuthPrincipal principal, @PathVariable String id) {
        CourseDtos.CourseOverview overview = courseService.getCourseOverview(parseId(id)).orElseThrow(NotFoundException::course);
        if (!CoursePolicy.canView(principal, overview.published(), overview.instructor().id())) {
            throw NotFoundException.course();
        }
        return ApiResponse.data(overview);
    }

    private ApiResponse toggle(AuthPrincipal principal, String id, boolean publish) {
        AuthPrincipal actor = SecurityUtils.require(principal);
        long courseId = parseId(id);
        requireModify(courseId, actor);
        return ApiResponse.data(courseService.togglePublished(courseId, publish).orElseThrow(NotFoundException::course));
    }

    private void requireModify(long courseId, AuthPrincipal actor) {
        if (!courseService.canModifyCourse(courseId, actor.userId(), actor.role())) {
            log.warn("course modify denied course={} actor={}", courseId, actor.userId());
            throw new ForbiddenException("You do not have permission to modify this course");
        }
    }

    static long parseId(String raw) {
        Long id = InputValues.toPositiveLong(raw);
        if (id == null) {
            throw ValidationException.invalidId("course");
        }
        return id;
    }
}
