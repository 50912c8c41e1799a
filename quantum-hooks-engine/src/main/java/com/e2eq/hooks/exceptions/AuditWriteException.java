package com.e2eq.hooks.exceptions;

public final class AuditWriteException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public AuditWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
