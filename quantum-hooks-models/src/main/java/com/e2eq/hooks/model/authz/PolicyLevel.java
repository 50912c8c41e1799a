package com.e2eq.hooks.model.authz;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PolicyLevel {
    PERMISSION("permission"),
    TUPLE("tuple");

    private final String wireName;

    PolicyLevel(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
