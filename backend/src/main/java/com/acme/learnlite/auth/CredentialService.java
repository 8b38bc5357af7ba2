package com.acme.learnlite.auth;

import com.acme.learnlite.security.JwtService;
import com.acme.learnlite.security.TokenPayload;
import com.acme.learnlite.user.UserProfile;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;

/**
 * Password hashing, token issuance and the public user projection.
 */
@Service
public class CredentialService {
    private final PasswordEncoder passwordEncoder;
    private final JwtService jwtService;
    private final String unknownUserHash;

    public CredentialService(PasswordEncoder passwordEncoder, JwtService jwtService) {
        this.passwordEncoder = passwordEncoder;
        this.jwtService = jwtService;
        this.unknownUserHash = passwordEncoder.encode(UUID.randomUUID().toString());
    }

    public String hashPassword(String plain) {
        return passwordEncoder.encode(plain);
    }

    public boolean verifyPassword(String plain, String hash) {
        if (plain == null || hash == null || hash.isEmpty()) {
            return false;
        }
        return passwordEncoder.matches(plain, hash);
    }

    /**
     * A hash no password matches, compared against when the email is unknown
     * so that login costs the same whether or not the account exists.
     */
    public String unknownUserHash() {
        return unknownUserHash;
    }

    public String generateToken(UserProfile user) {
        return jwtService.createToken(user.id(), user.email(), user.role());
    }

    public TokenPayload verifyToken(String token) {
        return jwtService.verify(token);
    }

    public UserProfile createUserProfile(Map<String, Object> userRow) {
        return UserProfile.fromRow(userRow);
    }
}
