package com.acme.learnlite.auth;

import com.acme.learnlite.user.UserProfile;

public class AuthDtos {
    public record AuthResult(UserProfile user, String token) {}
}
