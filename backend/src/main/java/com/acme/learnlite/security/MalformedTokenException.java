package com.acme.learnlite.security;

public class MalformedTokenException extends InvalidTokenException {
    public MalformedTokenException() {
        super("UNAUTHORIZED", "Invalid token");
    }
}
