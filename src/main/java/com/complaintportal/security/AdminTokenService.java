package com.complaintportal.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * Issues and verifies the stateless admin bearer token (HS256 JWT carrying {@code role=admin}).
 */
@Service
public class AdminTokenService {

    public static final String ADMIN_ROLE = "admin";
    public static final String ROLE_CLAIM = "role";

    private final SecretKey signingKey;
    private final Duration ttl;
    private final Clock clock;

    public AdminTokenService(@Value("${app.jwt.secret}") String secret,
                             @Value("${app.jwt.ttl:8h}") Duration ttl,
                             Clock clock) {
        this.signingKey = deriveKey(secret);
        this.ttl = ttl;
        this.clock = clock;
    }

    public String issueAdminToken() {
        Instant now = clock.instant();
        return Jwts.builder()
                .setSubject(ADMIN_ROLE)
                .claim(ROLE_CLAIM, ADMIN_ROLE)
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plus(ttl)))
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .compact();
    }

    /**
     * Checks signature and expiry. The role is returned as-is; callers decide what a non-admin
     * token may do.
     *
     * @throws InvalidAdminTokenException if the token is malformed, expired or signed with another key
     */
    public AdminTokenClaims verify(String token) {
        try {
            Claims claims = Jwts.parserBuilder()
                    .setSigningKey(signingKey)
                    .setClock(() -> Date.from(clock.instant()))
                    .build()
                    .parseClaimsJws(token)
                    .getBody();
            return new AdminTokenClaims(
                    claims.getSubject(),
                    claims.get(ROLE_CLAIM, String.class),
                    claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : null,
                    claims.getExpiration() != null ? claims.getExpiration().toInstant() : null);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidAdminTokenException("Invalid token", e);
        }
    }

    /** HMAC key from any secret length: the SHA-256 digest of its UTF-8 bytes. */
    public static SecretKey deriveKey(String secret) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(secret.getBytes(StandardCharsets.UTF_8));
            return Keys.hmacShaKeyFor(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
