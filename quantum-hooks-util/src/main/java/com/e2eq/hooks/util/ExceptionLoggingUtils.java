package com.e2eq.hooks.util;

import io.quarkus.logging.Log;
import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Consistent exception logging for the hook engine. Script and persistence
 * failures are logged through here so stack traces land in the log instead of stderr.
 */
public final class ExceptionLoggingUtils {

    private ExceptionLoggingUtils() {
    }

    /**
     * Log exception with full stack trace at ERROR level
     *
     * @param exception the exception to log
     * @param message the message format string
     * @param args optional arguments for message formatting
     */
    public static void logError(Throwable exception, String message, Object... args) {
        String formatted = format(message, args);
        if (exception == null) {
            Log.error(formatted);
            return;
        }
        Log.errorf("%s: %s%n%s", formatted, describe(exception), getStackTrace(exception));
    }

    /**
     * Log exception with full stack trace at WARN level
     *
     * @param exception the exception to log
     * @param message the message format string
     * @param args optional arguments for message formatting
     */
    public static void logWarn(Throwable exception, String message, Object... args) {
        String formatted = format(message, args);
        if (exception == null) {
            Log.warn(formatted);
            return;
        }
        Log.warnf("%s: %s%n%s", formatted, describe(exception), getStackTrace(exception));
    }

    /**
     * Log at WARN level with only the exception message; the stack trace goes to DEBUG.
     * Used for best-effort writes where failures are expected and must stay quiet.
     */
    public static void logBestEffortFailure(Throwable exception, String message, Object... args) {
        String formatted = format(message, args);
        Log.warnf("%s: %s", formatted, describe(exception));
        if (exception != null && Log.isDebugEnabled()) {
            Log.debugf("%s%n%s", formatted, getStackTrace(exception));
        }
    }

    /**
     * The innermost non-null message in the cause chain, or the class name when none carries one.
     */
    public static String rootMessage(Throwable exception) {
        if (exception == null) {
            return null;
        }
        Throwable current = exception;
        String message = current.getMessage();
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
            if (current.getMessage() != null) {
                message = current.getMessage();
            }
        }
        return message != null ? message : exception.getClass().getName();
    }

    public static String getStackTrace(Throwable exception) {
        if (exception == null) {
            return "";
        }
        StringWriter sw = new StringWriter();
        try (PrintWriter pw = new PrintWriter(sw)) {
            exception.printStackTrace(pw);
        }
        return sw.toString();
    }

    private static String describe(Throwable exception) {
        if (exception == null) {
            return "";
        }
        return exception.getMessage() != null ? exception.getMessage() : exception.getClass().getName();
    }

    private static String format(String message, Object... args) {
        if (args == null || args.length == 0) {
            return message;
        }
        return String.format(message, args);
    }
}
