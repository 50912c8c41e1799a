package com.e2eq.hooks.model.trace;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TraceOutcome {
    RUNNING("running"),
    SUCCESS("success"),
    BLOCKED("blocked"),
    ERROR("error");

    private final String wireName;

    TraceOutcome(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
