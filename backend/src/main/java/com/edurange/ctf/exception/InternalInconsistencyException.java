package com.edurange.ctf.exception;

/**
 * Raised when persisted state breaks an invariant the storage layer is supposed
 * to guarantee. Never repaired automatically: the operation aborts.
 */
public class InternalInconsistencyException extends RuntimeException {

    public InternalInconsistencyException(String message) {
        super(message);
    }
}
