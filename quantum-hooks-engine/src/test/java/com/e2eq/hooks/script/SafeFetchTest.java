package com.e2eq.hooks.script;

import com.e2eq.hooks.support.TestHookEngineConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SafeFetchTest {

    ObjectMapper objectMapper = new ObjectMapper();
    SafeFetch fetch;

    @BeforeEach
    void init() {
        Map<String, byte[]> hosts = Map.of(
                "api.example.test", new byte[]{93, (byte) 184, (byte) 216, 34},
                "intranet.example.test", new byte[]{10, 0, 0, 5},
                "ula.example.test", new byte[]{(byte) 0xfd, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 1});
        fetch = new SafeFetch(new TestHookEngineConfig(), objectMapper, host -> {
            byte[] address = hosts.get(host);
            if (address == null) {
                throw new UnknownHostException(host);
            }
            return new InetAddress[]{InetAddress.getByAddress(host, address)};
        });
    }

    @Test
    void internal_and_plaintext_targets_are_refused() {
        List<String> refused = List.of(
                "http://api.example.test/",
                "https://127.0.0.1/admin",
                "https://localhost:8443/",
                "https://LOCALHOST/",
                "https://10.1.2.3/",
                "https://172.16.0.1/",
                "https://172.31.255.1/",
                "https://192.168.1.1/",
                "https://169.254.169.254/latest/meta-data/",
                "https://0.0.0.0/",
                "https://[::1]/",
                "https://[fe80::1]/",
                "file:///etc/passwd");
        for (String url : refused) {
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> fetch.checkUrl(url), url);
            assertTrue(e.getMessage().startsWith(SafeFetch.ERROR_PREFIX), e.getMessage());
        }
    }

    @Test
    void hosts_resolving_to_internal_addresses_are_refused() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> fetch.checkUrl("https://intranet.example.test/users"));
        assertEquals("SafeFetch failed: blocked host intranet.example.test", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> fetch.checkUrl("https://ula.example.test/"));
    }

    @Test
    void public_https_host_is_accepted() throws Exception {
        URI uri = fetch.checkUrl("https://api.example.test/v1/score?email=ada");
        assertEquals("api.example.test", uri.getHost());
        assertFalse(SafeFetch.isInternal(InetAddress.getByAddress(new byte[]{93, (byte) 184, (byte) 216, 34})));
        assertTrue(SafeFetch.isInternal(InetAddress.getByAddress(new byte[]{(byte) 172, 20, 0, 1})));
    }

    @Test
    void unknown_host_is_refused() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> fetch.checkUrl("https://nowhere.example.test/"));
        assertEquals("SafeFetch failed: unknown host nowhere.example.test", e.getMessage());
    }

    @Test
    void unsupported_method_is_refused_before_sending() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> fetch.fetch("https://api.example.test/", "TRACE", Map.of(), null));
        assertEquals("SafeFetch failed: method TRACE is not allowed", e.getMessage());
    }

    @Test
    void response_body_is_capped() throws Exception {
        byte[] small = "{\"ok\":true}".getBytes(StandardCharsets.UTF_8);
        assertEquals("{\"ok\":true}", SafeFetch.readLimited(new ByteArrayInputStream(small), 64));

        byte[] large = new byte[20_000];
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> SafeFetch.readLimited(new ByteArrayInputStream(large), 10_000));
        assertEquals("SafeFetch failed: response exceeds 10000 bytes", e.getMessage());
    }

    @Test
    void json_body_is_parsed_and_text_is_wrapped() throws Exception {
        JsonNode json = objectMapper.readTree(fetch.toResponseJson(200, "{\"score\":42}"));
        assertEquals(200, json.get("status").asInt());
        assertTrue(json.get("ok").asBoolean());
        assertEquals(42, json.get("body").get("score").asInt());

        JsonNode text = objectMapper.readTree(fetch.toResponseJson(503, "upstream busy"));
        assertFalse(text.get("ok").asBoolean());
        assertEquals("upstream busy", text.get("body").get("text").asText());
    }
}
