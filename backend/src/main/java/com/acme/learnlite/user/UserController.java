package com.acme.learnlite.user;

import com.acme.learnlite.common.ApiResponse;
import com.acme.learnlite.common.ValidationException;
import com.acme.learnlite.security.AuthPrincipal;
import com.acme.learnlite.security.SecurityUtils;
import com.acme.learnlite.validation.InputValues;
import com.acme.learnlite.validation.QueryParams;
import com.acme.learnlite.validation.UserValidator;
import com.acme.learnlite.validation.ValidationResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/users")
public class UserController {
    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    @GetMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ApiResponse list(@RequestParam Map<String, String> params) {
        var page = userService.listUsers(QueryParams.validatePagination(params));
        return ApiResponse.page(page.users(), page.pagination());
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse> create(@RequestBody Map<String, Object> body) {
        ValidationResult result = UserValidator.validateCreateUser(body);
        if (!result.isValid()) {
            throw ValidationException.of(result);
        }
        UserProfile created = userService.createUser(UserDtos.CreateUserCommand.from(body));
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.data(created));
    }

    @GetMapping("/{id}")
    public ApiResponse show(@AuthenticationPrincipal AuthPrincipal principal, @PathVariable String id) {
        AuthPrincipal actor = SecurityUtils.require(principal);
        return ApiResponse.data(userService.getUser(parseId(id), actor));
    }

    @PutMapping("/{id}")
    public ApiResponse update(@AuthenticationPrincipal AuthPrincipal principal, @PathVariable String id, @RequestBody Map<String, Object> body) {
        AuthPrincipal actor = SecurityUtils.require(principal);
        long userId = parseId(id);
        ValidationResult result = UserValidator.validateUpdateUser(body);
        if (!result.isValid()) {
            throw ValidationException.of(result);
        }
        return ApiResponse.data(userService.updateUser(userId, UserDtos.UpdateUserCommand.from(body), actor));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ApiResponse delete(@AuthenticationPrincipal AuthPrincipal principal, @PathVariable String id) {
        AuthPrincipal actor = SecurityUtils.require(principal);
        userService.deleteUser(parseId(id), actor);
        return ApiResponse.message("User deleted successfully");
    }

    private static long parseId(String raw) {
        Long id = InputValues.toPositiveLong(raw);
        if (id == null) {
            throw ValidationException.invalidId("user");
        }
        return id;
    }
}
