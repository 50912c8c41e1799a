package com.e2eq.hooks.trace;

import com.e2eq.hooks.model.trace.SpanStatus;

import java.time.Instant;

/**
 * Outcome of one script execution, or of a span a script opened, as handed to
 * {@link TraceRecorder#recordSpan}.
 *
 * @param spanId id to store the span under; generated when null
 * @param parentSpanId enclosing span for spans opened by a script; null for script spans
 * @param attributes JSON text attached by the script; null for script spans
 */
public record SpanRecord(String traceId,
                         String scriptId,
                         String scriptName,
                         int ordinal,
                         SpanStatus status,
                         Instant startedAt,
                         Instant endedAt,
                         Object input,
                         Object output,
                         String error,
                         String spanId,
                         String parentSpanId,
                         String attributes) {

    public SpanRecord(String traceId, String scriptId, String scriptName, int ordinal, SpanStatus status,
                      Instant startedAt, Instant endedAt, Object input, Object output, String error) {
        this(traceId, scriptId, scriptName, ordinal, status, startedAt, endedAt, input, output, error,
                null, null, null);
    }
}
