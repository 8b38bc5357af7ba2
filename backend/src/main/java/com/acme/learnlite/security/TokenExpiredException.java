package com.acme.learnlite.security;

public class TokenExpiredException extends InvalidTokenException {
    public TokenExpiredException() {
        super("TOKEN_EXPIRED", "Token has expired");
    }
}
