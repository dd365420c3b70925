package com.volunteermedia.security;

import com.volunteermedia.exception.UnauthorizedException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * Issues and verifies HS256 bearer tokens.
 *
 * Claims: {@code user_id}, {@code is_admin}, subject = user id, issued-at and expiry.
 */
@Service
@Slf4j
public class JwtService {

    static final String CLAIM_USER_ID = "user_id";
    static final String CLAIM_IS_ADMIN = "is_admin";

    private final SecretKey signingKey;
    private final Duration expiration;

    public JwtService(@Value("${app.jwt.secret}") String secret,
                      @Value("${app.jwt.expiration:24h}") Duration expiration) {
        JwtSecretValidator.validate(secret);
        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.expiration = expiration;
        log.info("JWT signing configured (token lifetime: {})", expiration);
    }

    public String generateToken(Long userId, boolean admin) {
        Instant now = Instant.now();
        return Jwts.builder()
                .subject(String.valueOf(userId))
                .claim(CLAIM_USER_ID, userId)
                .claim(CLAIM_IS_ADMIN, admin)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(expiration)))
                .signWith(signingKey, Jwts.SIG.HS256)
                .compact();
    }

    /**
     * Verify signature and expiry and extract the caller's identity.
     *
     * @throws UnauthorizedException for any malformed, tampered or expired token
     */
    public AuthenticatedUser parseToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(signingKey)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            Number userId = claims.get(CLAIM_USER_ID, Number.class);
            if (userId == null) {
                throw new UnauthorizedException("Invalid or expired token");
            }
            Boolean admin = claims.get(CLAIM_IS_ADMIN, Boolean.class);
            return new AuthenticatedUser(userId.longValue(), Boolean.TRUE.equals(admin));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected bearer token: {}", e.getMessage());
            throw new UnauthorizedException("Invalid or expired token");
        }
    }
}
