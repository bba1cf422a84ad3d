package com.edurange.ctf.exception;

public class DuplicateCompletionException extends RuntimeException {

    public DuplicateCompletionException(String message) {
        super(message);
    }
}
