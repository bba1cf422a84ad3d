package com.edurange.ctf.security;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class JwtTokenProviderTest {

    private static final String SECRET = "test-secret-test-secret-test-secret-test-secret-0123";

    private final JwtTokenProvider provider = new JwtTokenProvider(SECRET, 60_000);

    @Test
    void test_toAuthenticatedUser_validAccessToken_returnsUser() {
        String userId = UUID.randomUUID().toString();
        String token = provider.generateAccessToken(userId, "ada@ctf.local", "INSTRUCTOR");

        AuthenticatedUser user = provider.toAuthenticatedUser(token);

        assertThat(user).isNotNull();
        assertThat(user.getUserId()).isEqualTo(UUID.fromString(userId));
        assertThat(user.getEmail()).isEqualTo("ada@ctf.local");
        assertThat(user.getRole()).isEqualTo("INSTRUCTOR");
        assertThat(user.isAdmin()).isFalse();
    }

    @Test
    void test_toAuthenticatedUser_tamperedToken_returnsNull() {
        String[] student = provider.generateAccessToken(UUID.randomUUID().toString(), "ada@ctf.local", "STUDENT")
                .split("\\.");
        String[] admin = provider.generateAccessToken(UUID.randomUUID().toString(), "ada@ctf.local", "ADMIN")
                .split("\\.");
        // admin claims under the student's signature
        String tampered = student[0] + "." + admin[1] + "." + student[2];

        assertThat(provider.toAuthenticatedUser(tampered)).isNull();
    }

    @Test
    void test_toAuthenticatedUser_otherSigningKey_returnsNull() {
        JwtTokenProvider other = new JwtTokenProvider("another-secret-another-secret-another-secret-42", 60_000);
        String token = other.generateAccessToken(UUID.randomUUID().toString(), "eve@ctf.local", "ADMIN");

        assertThat(provider.toAuthenticatedUser(token)).isNull();
    }

    @Test
    void test_toAuthenticatedUser_refreshToken_returnsNull() {
        String token = Jwts.builder()
                .setSubject(UUID.randomUUID().toString())
                .claim("type", "REFRESH")
                .setExpiration(new Date(System.currentTimeMillis() + 60_000))
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)), SignatureAlgorithm.HS256)
                .compact();

        assertThat(provider.toAuthenticatedUser(token)).isNull();
    }

    @Test
    void test_toAuthenticatedUser_nonUuidSubject_returnsNull() {
        String token = provider.generateAccessToken("ada.lovelace", "ada@ctf.local", "ADMIN");

        assertThat(provider.toAuthenticatedUser(token)).isNull();
    }

    @Test
    void test_toAuthenticatedUser_missingSubject_returnsNull() {
        String token = Jwts.builder()
                .claim("type", "ACCESS")
                .claim("role", "STUDENT")
                .setExpiration(new Date(System.currentTimeMillis() + 60_000))
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)), SignatureAlgorithm.HS256)
                .compact();

        assertThat(provider.toAuthenticatedUser(token)).isNull();
    }

    @Test
    void test_toAuthenticatedUser_expiredToken_returnsNull() {
        JwtTokenProvider expired = new JwtTokenProvider(SECRET, -1_000);
        String token = expired.generateAccessToken(UUID.randomUUID().toString(), "ada@ctf.local", "STUDENT");

        assertThat(provider.toAuthenticatedUser(token)).isNull();
    }
}
