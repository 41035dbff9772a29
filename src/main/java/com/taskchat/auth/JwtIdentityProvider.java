package com.taskchat.auth;

import com.taskchat.AppLogger;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.util.Date;

/**
 * Bearer-token identity backed by HS256 JWTs. The owner is the {@code sub}
 * claim, or the {@code user_id} claim for tokens issued without a subject.
 */
public class JwtIdentityProvider implements IdentityProvider {
    private static final String BEARER_PREFIX = "Bearer ";
    private static final int MIN_SECRET_BYTES = 32;

    private final Key key;
    private final Clock clock;
    private final AppLogger logger;

    public JwtIdentityProvider(String secret) {
        this(secret, Clock.systemUTC());
    }

    public JwtIdentityProvider(String secret, Clock clock) {
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalArgumentException("JWT secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.clock = clock;
        this.logger = AppLogger.get();
    }

    @Override
    public String resolveOwner(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.regionMatches(true, 0, BEARER_PREFIX, 0,
            BEARER_PREFIX.length())) {
            throw new UnauthorizedException("Missing bearer token");
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        if (token.isEmpty()) {
            throw new UnauthorizedException("Missing bearer token");
        }
        Claims claims;
        try {
            claims = Jwts.parserBuilder()
                .setSigningKey(key)
                .setClock(() -> Date.from(clock.instant()))
                .build()
                .parseClaimsJws(token)
                .getBody();
        } catch (JwtException | IllegalArgumentException e) {
            logger.warn("[JwtIdentityProvider] Rejected token: " + e.getClass().getSimpleName());
            throw new UnauthorizedException("Invalid or expired token", e);
        }
        String owner = claims.getSubject();
        if (owner == null || owner.isBlank()) {
            Object userId = claims.get("user_id");
            owner = userId != null ? userId.toString() : null;
        }
        if (owner == null || owner.isBlank()) {
            throw new UnauthorizedException("Token does not identify a user");
        }
        return owner.trim();
    }

    /**
     * Signs a token for {@code owner}. Used by local tooling and tests.
     */
    public String issueToken(String owner, Duration ttl) {
        Date now = Date.from(clock.instant());
        return Jwts.builder()
            .setSubject(owner)
            .setIssuedAt(now)
            .setExpiration(Date.from(clock.instant().plus(ttl)))
            .signWith(key, SignatureAlgorithm.HS256)
            .compact();
    }
}
