package com.edurange.ctf.exception;

/**
 * The acting user lacks the role an operation requires (for example, a member
 * trying to reset another user's progress).
 */
public class UnauthorizedAccessException extends RuntimeException {

    public UnauthorizedAccessException(String message) {
        super(message);
    }
}
