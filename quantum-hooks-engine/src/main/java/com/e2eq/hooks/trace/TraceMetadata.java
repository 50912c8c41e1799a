package com.e2eq.hooks.trace;

/**
 * Caller details recorded on a trace.
 */
public record TraceMetadata(String triggerEvent, String userId, String requestIp) {

    public static final TraceMetadata NONE = new TraceMetadata(null, null, null);

    public static TraceMetadata of(String triggerEvent) {
        return new TraceMetadata(triggerEvent, null, null);
    }
}
