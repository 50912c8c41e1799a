package com.e2eq.hooks.exceptions;

/**
 * A script failed inside the sandbox: it threw, timed out, exceeded a resource
 * budget, was too large to load, or returned a value of the wrong shape.
 */
public class SandboxException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public enum Kind {
        SCRIPT_ERROR,
        SYNTAX_ERROR,
        TIMEOUT,
        RESOURCE_EXHAUSTED,
        TOO_LARGE,
        MALFORMED_OUTPUT,
        INTERNAL
    }

    private final Kind kind;

    public SandboxException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SandboxException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public static SandboxException timeout(long millis) {
        return new SandboxException(Kind.TIMEOUT, "Script execution timeout after " + millis + "ms");
    }

    public static SandboxException malformed(String detail) {
        return new SandboxException(Kind.MALFORMED_OUTPUT, "Malformed script result: " + detail);
    }
}
