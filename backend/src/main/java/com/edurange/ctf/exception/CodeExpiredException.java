package com.edurange.ctf.exception;

import lombok.Getter;

import java.time.Instant;

@Getter
public class CodeExpiredException extends RuntimeException {

    private final Instant expiredAt;

    public CodeExpiredException(String code, Instant expiredAt) {
        super("Access code " + code + " expired at " + expiredAt);
        this.expiredAt = expiredAt;
    }
}
