package com.e2eq.hooks.model.authz;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which policy decided an audited evaluation.
 */
public enum PolicySource {
    TUPLE("tuple"),
    PERMISSION("permission");

    private final String wireName;

    PolicySource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
