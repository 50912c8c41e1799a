package com.e2eq.hooks.exceptions;

/**
 * No interpreter became available within the acquire timeout. Transient; callers
 * may retry. Never converted into a denial.
 */
public final class InterpreterPoolExhaustedException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public InterpreterPoolExhaustedException(String message) {
        super(message);
    }

    public InterpreterPoolExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }
}
