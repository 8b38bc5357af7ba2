package com.acme.learnlite.enrollment;

import com.acme.learnlite.common.ApiResponse;
import com.acme.learnlite.common.ValidationException;
import com.acme.learnlite.security.AuthPrincipal;
import com.acme.learnlite.security.SecurityUtils;
import com.acme.learnlite.validation.InputValues;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class EnrollmentController {
    private final EnrollmentService enrollmentService;

    public EnrollmentController(EnrollmentService enrollmentService) {
        this.enrollmentService = enrollmentService;
    }

    @PostMapping("/courses/{courseId}/enroll")
    public ResponseEntity<ApiResponse> enroll(@AuthenticationPrincipal AuthPrincipal principal, @PathVariable String courseId) {
        AuthPrincipal actor = SecurityUtils.require(principal);
        Long id = InputValues.toPositiveLong(courseId);
        if (id == null) {
            throw ValidationException.invalidId("course");
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.data(enrollmentService.enroll(id, actor)));
    }

    @GetMapping("/enrollments/me")
    public ApiResponse mine(@AuthenticationPrincipal AuthPrincipal principal) {
        AuthPrincipal actor = SecurityUtils.require(principal);
        return ApiResponse.data(enrollmentService.listForUser(actor.userId()));
    }
}
