package com.edurange.ctf.exception;

public class CodeNotFoundException extends RuntimeException {

    public CodeNotFoundException(String code) {
        super("Access code not found: " + code);
    }
}
