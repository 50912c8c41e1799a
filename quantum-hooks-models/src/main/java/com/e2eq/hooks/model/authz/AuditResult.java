package com.e2eq.hooks.model.authz;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AuditResult {
    ALLOWED("allowed"),
    DENIED("denied"),
    ERROR("error");

    private final String wireName;

    AuditResult(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
