package com.edurange.ctf.security;

import lombok.Getter;

import java.util.UUID;

/**
 * The acting user behind a request. Built from the validated bearer token and
 * handed explicitly to every lifecycle operation.
 */
@Getter
public class AuthenticatedUser {
    private final String id;
    private final String email;
    private final String role;

    public AuthenticatedUser(String id, String email, String role) {
        this.id = id;
        this.email = email;
        this.role = role;
    }

    public UUID getUserId() {
        return UUID.fromString(id);
    }

    public boolean isAdmin() {
        return "ADMIN".equals(role);
    }
}
