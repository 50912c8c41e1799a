package com.e2eq.hooks.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class JsonSnapshotsTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void smallPayloadIsKeptVerbatim() {
        String json = JsonSnapshots.snapshot(mapper, Map.of("email", "a@b.com"), 100);
        assertEquals("{\"email\":\"a@b.com\"}", json);
        assertFalse(JsonSnapshots.isTruncated(mapper, json));
    }

    @Test
    void oversizedPayloadIsReplacedWithMarker() throws Exception {
        String big = "x".repeat(5000);
        String json = JsonSnapshots.snapshot(mapper, Map.of("blob", big), 1000);

        assertTrue(json.length() <= 1000, "marker must fit the bound");
        JsonNode node = mapper.readTree(json);
        assertTrue(node.get(JsonSnapshots.TRUNCATED_FIELD).asBoolean());
        assertEquals(5011, node.get(JsonSnapshots.ORIGINAL_SIZE_FIELD).asInt());
        assertTrue(node.get(JsonSnapshots.PREVIEW_FIELD).asText().startsWith("{\"blob\":\"xxx"));
        assertTrue(JsonSnapshots.isTruncated(mapper, json));
    }

    @Test
    void nullValueYieldsNull() {
        assertNull(JsonSnapshots.snapshot(mapper, null, 10));
    }

    @Test
    void nonPositiveBoundDisablesTruncation() {
        String json = "{\"a\":\"" + "y".repeat(50) + "\"}";
        assertEquals(json, JsonSnapshots.truncate(mapper, json, 0));
    }
}
