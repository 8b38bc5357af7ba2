package com.acme.learnlite.security;

public class TokenSignatureException extends InvalidTokenException {
    public TokenSignatureException() {
        super("UNAUTHORIZED", "Invalid token signature");
    }
}
