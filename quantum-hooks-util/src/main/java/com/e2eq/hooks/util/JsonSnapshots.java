package com.e2eq.hooks.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.lang3.StringUtils;

/**
 * Serializes hook inputs, outputs and policy attributes into bounded JSON snapshots
 * for traces and audit entries. Oversized payloads are replaced by a marker object
 * carrying the original size and a short preview.
 */
public final class JsonSnapshots {

    public static final String TRUNCATED_FIELD = "__truncated";
    public static final String ORIGINAL_SIZE_FIELD = "__originalSize";
    public static final String PREVIEW_FIELD = "__preview";

    private static final int MAX_PREVIEW_CHARS = 1024;

    private JsonSnapshots() {
    }

    /**
     * Serialize {@code value} and bound the result to {@code maxChars}.
     * Serialization failures produce an error marker rather than an exception.
     */
    public static String snapshot(ObjectMapper mapper, Object value, int maxChars) {
        if (value == null) {
            return null;
        }
        String json;
        try {
            json = mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            ObjectNode node = mapper.createObjectNode();
            node.put("__unserializable", value.getClass().getName());
            node.put("__error", e.getOriginalMessage());
            return node.toString();
        }
        return truncate(mapper, json, maxChars);
    }

    /**
     * Return {@code json} unchanged when it fits, otherwise a marker object.
     */
    public static String truncate(ObjectMapper mapper, String json, int maxChars) {
        if (json == null || maxChars <= 0 || json.length() <= maxChars) {
            return json;
        }
        ObjectNode marker = mapper.createObjectNode();
        marker.put(TRUNCATED_FIELD, true);
        marker.put(ORIGINAL_SIZE_FIELD, json.length());
        marker.put(PREVIEW_FIELD, StringUtils.left(json, Math.min(MAX_PREVIEW_CHARS, maxChars / 4)));
        return marker.toString();
    }

    public static boolean isTruncated(ObjectMapper mapper, String json) {
        if (StringUtils.isBlank(json)) {
            return false;
        }
        try {
            return mapper.readTree(json).path(TRUNCATED_FIELD).asBoolean(false);
        } catch (JsonProcessingException e) {
            return false;
        }
    }
}
