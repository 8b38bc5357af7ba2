package com.acme.learnlite.security;

import com.acme.learnlite.common.Role;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SecurityException;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Map;

@Service
public class JwtService {
    private final JwtProperties props;
    private final Clock clock;
    private final SecretKey key;

    public JwtService(JwtProperties props, Clock clock) {
        this.props = props;
        this.clock = clock;
        this.key = Keys.hmacShaKeyFor(props.secret().getBytes(StandardCharsets.UTF_8));
    }

    public String createToken(long userId, String email, Role role) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        return Jwts.builder()
                .claims(Map.of("email", email, "role", role.value()))
                .subject(Long.toString(userId))
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plusSeconds(props.expirationSeconds())))
                .signWith(key, Jwts.SIG.HS256)
                .compact();
    }

    public TokenPayload verify(String token) {
        Claims claims = parse(token);
        try {
            long sub = Long.parseLong(claims.getSubject());
            String email = claims.get("email", String.class);
            String role = claims.get("role", String.class);
            Date iat = claims.getIssuedAt();
            Date exp = claims.getExpiration();
            if (email == null || role == null || iat == null || exp == null) {
                throw new MalformedTokenException();
            }
            return new TokenPayload(sub, email, Role.fromValue(role), iat.toInstant().getEpochSecond(), exp.toInstant().getEpochSecond());
        } catch (IllegalArgumentException | JwtException e) {
            throw new MalformedTokenException();
        }
    }

    private Claims parse(String token) {
        Jws<Claims> jws;
        try {
            jws = Jwts.parser()
                    .verifyWith(key)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token);
        } catch (ExpiredJwtException e) {
            throw new TokenExpiredException();
        } catch (SecurityException e) {
            throw new TokenSignatureException();
        } catch (JwtException | IllegalArgumentException e) {
            throw new MalformedTokenException();
        }
        // only the algorithm we sign with is accepted
        if (!Jwts.SIG.HS256.getId().equals(jws.getHeader().getAlgorithm())) {
            throw new TokenSignatureException();
        }
        return jws.getPayload();
    }
}
