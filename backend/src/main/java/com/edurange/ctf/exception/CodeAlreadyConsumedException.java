package com.edurange.ctf.exception;

public class CodeAlreadyConsumedException extends RuntimeException {

    public CodeAlreadyConsumedException(String code, int maxUses) {
        super("Access code " + code + " has reached its limit of " + maxUses
                + (maxUses == 1 ? " use" : " uses"));
    }
}
