package com.acme.learnlite.security;

import com.acme.learnlite.common.UnauthorizedException;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.Optional;

public final class SecurityUtils {
    private SecurityUtils() {}

    public static Optional<AuthPrincipal> currentPrincipal() {
        var auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth == null || !(auth.getPrincipal() instanceof AuthPrincipal p)) {
            return Optional.empty();
        }
        return Optional.of(p);
    }

    public static AuthPrincipal principal() {
        return currentPrincipal().orElseThrow(UnauthorizedException::authenticationRequired);
    }

    public static AuthPrincipal require(AuthPrincipal principal) {
        if (principal == null) {
            throw UnauthorizedException.authenticationRequired();
        }
        return principal;
    }
}
