package com.acme.learnlite.security;

import com.acme.learnlite.common.Role;

public record AuthPrincipal(long userId, String email, Role role) {
    public boolean isAdmin() {
        return role == Role.ADMIN;
    }
}
