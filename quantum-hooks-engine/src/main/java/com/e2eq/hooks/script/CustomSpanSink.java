package com.e2eq.hooks.script;

/**
 * Receives the spans a script opens with {@code helpers.trace}. Called on the
 * script's thread when the traced function returns or throws.
 */
@FunctionalInterface
public interface CustomSpanSink {

    void record(CustomSpan span);
}
