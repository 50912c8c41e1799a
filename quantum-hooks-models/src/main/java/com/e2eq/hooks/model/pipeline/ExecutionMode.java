package com.e2eq.hooks.model.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the results of a hook's bound scripts are combined.
 */
public enum ExecutionMode {
    /** Sequential; the first denial short-circuits the chain. */
    BLOCKING("blocking"),
    /** Fire-and-forget; the caller never waits. */
    ASYNC("async"),
    /** Sequential; returned data is merged, any denial discards it. */
    ENRICHMENT("enrichment");

    private final String wireName;

    ExecutionMode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
