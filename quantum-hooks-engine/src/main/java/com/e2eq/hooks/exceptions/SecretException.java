package com.e2eq.hooks.exceptions;

/**
 * Secret store failures: bad names, duplicates, missing secrets, or cipher errors.
 */
public class SecretException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public SecretException(String message) {
        super(message);
    }

    public SecretException(String message, Throwable cause) {
        super(message, cause);
    }
}
