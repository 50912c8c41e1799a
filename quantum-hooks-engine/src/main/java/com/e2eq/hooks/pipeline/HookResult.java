package com.e2eq.hooks.pipeline;

import java.util.Map;

/**
 * Aggregate outcome of one dispatch.
 *
 * @param allowed false when a blocking or enrichment script denied or failed
 * @param error message of the denying script, may be null
 * @param data merged enrichment data; empty for other modes and on denial
 */
public record HookResult(boolean allowed, String error, Map<String, Object> data) {

    private static final HookResult NEUTRAL = new HookResult(true, null, Map.of());

    public HookResult {
        data = data == null ? Map.of() : data;
    }

    public static HookResult neutral() {
        return NEUTRAL;
    }

    public static HookResult allow(Map<String, Object> data) {
        return new HookResult(true, null, data);
    }

    public static HookResult deny(String error) {
        return new HookResult(false, error, Map.of());
    }
}
