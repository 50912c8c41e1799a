package com.e2eq.hooks.script;

import java.time.Instant;

/**
 * A span opened by a script through {@code helpers.trace}.
 *
 * @param parentSpanId the enclosing custom span, or the script's own span at the top level
 * @param attributes JSON text of the attributes object, truncated; null when none were given
 * @param error message of the exception that escaped the traced function; null on success
 */
public record CustomSpan(String id,
                         String parentSpanId,
                         String name,
                         Instant startedAt,
                         Instant endedAt,
                         String attributes,
                         String error) {

    public boolean failed() {
        return error != null;
    }
}
