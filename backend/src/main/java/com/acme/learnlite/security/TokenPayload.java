package com.acme.learnlite.security;

import com.acme.learnlite.common.Role;

public record TokenPayload(long sub, String email, Role role, long iat, long exp) {
}
