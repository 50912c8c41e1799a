package com.e2eq.hooks.pipeline;

import java.util.Map;

/**
 * Result of a single script after its raw return value passed the output contract.
 *
 * @param allowed whether the script allowed the operation
 * @param error optional message supplied by the script on denial
 * @param data data the script returned; empty for async hooks
 */
public record ScriptOutcome(boolean allowed, String error, Map<String, Object> data) {

    public ScriptOutcome {
        data = data == null ? Map.of() : data;
    }

    public static ScriptOutcome allow() {
        return new ScriptOutcome(true, null, Map.of());
    }

    public static ScriptOutcome deny(String error) {
        return new ScriptOutcome(false, error, Map.of());
    }
}
