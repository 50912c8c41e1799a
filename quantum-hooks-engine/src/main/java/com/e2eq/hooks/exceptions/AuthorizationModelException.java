package com.e2eq.hooks.exceptions;

import java.util.List;

/**
 * An authorization model write was rejected. Carries every problem found so an
 * administrator can fix them in one pass.
 */
public class AuthorizationModelException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public AuthorizationModelException(String message) {
        super(message);
        this.errors = List.of(message);
    }

    public AuthorizationModelException(List<String> errors) {
        super(String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
