package com.edurange.ctf.security;

import io.jsonwebtoken.*;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.UUID;

/**
 * Validates access tokens issued by the platform identity service. Both sides
 * share the HS256 secret; {@link #generateAccessToken} exists for service-to-service
 * callers (monitoring, the sweep job) that mint their own short-lived tokens.
 */
@Slf4j
@Component
public class JwtTokenProvider {

    private final SecretKey signingKey;
    private final long accessTokenExpiryMs;

    public JwtTokenProvider(
            @Value("${jwt.secret}") String secret,
            @Value("${jwt.access-token-expiry-ms}") long accessTokenExpiryMs) {
        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.accessTokenExpiryMs = accessTokenExpiryMs;
    }

    public String generateAccessToken(String userId, String email, String role) {
        Date now = new Date();
        Date expiry = new Date(now.getTime() + accessTokenExpiryMs);

        return Jwts.builder()
                .setId(UUID.randomUUID().toString())
                .setSubject(userId)
                .claim("email", email)
                .claim("role", role)
                .claim("type", "ACCESS")
                .setIssuedAt(now)
                .setExpiration(expiry)
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .compact();
    }

    public Claims extractAllClaims(String token) {
        return Jwts.parserBuilder()
                .setSigningKey(signingKey)
                .build()
                .parseClaimsJws(token)
                .getBody();
    }

    public boolean validateToken(String token) {
        try {
            extractAllClaims(token);
            return true;
        } catch (ExpiredJwtException e) {
            log.debug("JWT token expired: {}", e.getMessage());
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Invalid JWT token: {}", e.getMessage());
        }
        return false;
    }

    /**
     * Parses a token into the acting user, or returns {@code null} when the token
     * is invalid, expired, not an access token or its subject is not a user id.
     */
    public AuthenticatedUser toAuthenticatedUser(String token) {
        if (!validateToken(token)) {
            return null;
        }
        Claims claims = extractAllClaims(token);
        String tokenType = claims.get("type", String.class);
        if (!"ACCESS".equals(tokenType)) {
            log.debug("Rejected non-ACCESS token: type={}", tokenType);
            return null;
        }
        if (!isUserId(claims.getSubject())) {
            log.debug("Rejected token with non-UUID subject: {}", claims.getSubject());
            return null;
        }
        return new AuthenticatedUser(claims.getSubject(), claims.get("email", String.class),
                claims.get("role", String.class));
    }

    private static boolean isUserId(String subject) {
        if (subject == null) {
            return false;
        }
        try {
            UUID.fromString(subject);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
