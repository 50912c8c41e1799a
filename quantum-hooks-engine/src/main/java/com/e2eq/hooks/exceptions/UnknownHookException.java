package com.e2eq.hooks.exceptions;

public final class UnknownHookException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String hookName;

    public UnknownHookException(String hookName) {
        super("Unknown hook: " + hookName);
        this.hookName = hookName;
    }

    public String getHookName() {
        return hookName;
    }
}
