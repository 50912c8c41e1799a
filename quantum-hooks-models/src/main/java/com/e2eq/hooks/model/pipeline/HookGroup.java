package com.e2eq.hooks.model.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HookGroup {
    AUTHENTICATION("authentication"),
    API_KEY("api_key"),
    OAUTH_CLIENT("oauth_client");

    private final String wireName;

    HookGroup(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
