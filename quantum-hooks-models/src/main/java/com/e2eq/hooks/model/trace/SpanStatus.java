package com.e2eq.hooks.model.trace;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SpanStatus {
    SUCCESS("success"),
    BLOCKED("blocked"),
    ERROR("error"),
    /** The bound script no longer exists; the chain moved on. */
    SKIPPED("skipped");

    private final String wireName;

    SpanStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
