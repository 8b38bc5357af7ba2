package com.acme.learnlite.auth;

import com.acme.learnlite.common.ApiResponse;
import com.acme.learnlite.security.AuthPrincipal;
import com.acme.learnlite.security.SecurityUtils;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.Map;

@RestController
@RequestMapping("/api/auth")
public class AuthController {
    private static final Duration RATE_WINDOW = Duration.ofMinutes(1);

    private final AuthService authService;
    private final LoginAttemptRateLimiter limiter;

    @Value("${app.version:v1.0}")
    private String version;

    @Value("${app.auth.rate-limit.login-per-minute:20}")
    private int loginPerMinute;

    @Value("${app.auth.rate-limit.register-per-minute:10}")
    private int registerPerMinute;

    public AuthController(AuthService authService, LoginAttemptRateLimiter limiter) {
        this.authService = authService;
        this.limiter = limiter;
    }

    @PostMapping("/register")
    public ResponseEntity<ApiResponse> register(@RequestBody Map<String, Object> body, HttpServletRequest request) {
        limiter.check("register:" + request.getRemoteAddr(), registerPerMinute, RATE_WINDOW);
        var result = authService.register(body);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.message("User registered successfully")
                .withUser(result.user())
                .withToken(result.token())
                .withVersion(version));
    }

    @PostMapping("/login")
    public ApiResponse login(@RequestBody Map<String, Object> body, HttpServletRequest request) {
        limiter.check("login:" + request.getRemoteAddr(), loginPerMinute, RATE_WINDOW);
        var result = authService.login(body);
        return ApiResponse.message("Login successful")
                .withToken(result.token())
                .withUser(result.user())
                .withVersion(version);
    }

    @GetMapping("/me")
    public ApiResponse me(@AuthenticationPrincipal AuthPrincipal principal) {
        AuthPrincipal p = principal != null ? principal : SecurityUtils.principal();
        return ApiResponse.success().withUser(authService.me(p.userId())).withVersion(version);
    }
}
