package com.e2eq.hooks.trace;

public record CleanupResult(long deletedSpans, long deletedTraces) {
}
