package com.e2eq.hooks.script;

import com.e2eq.hooks.config.HookEngineConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Outbound HTTPS for hook scripts ({@code helpers.fetch}).
 * <p>
 * Only https URLs are accepted. Hosts that name or resolve to loopback, private,
 * link-local or unique-local addresses are refused, redirects are not followed, and
 * responses are cut off at the configured size. The result handed back to the
 * script is the JSON text of {@code {status, ok, body}}, where {@code body} is the
 * parsed response or {@code {text}} when it is not JSON.
 */
@ApplicationScoped
public class SafeFetch {

    static final String ERROR_PREFIX = "SafeFetch failed: ";

    private static final List<Pattern> BLOCKED_HOSTS = List.of(
            Pattern.compile("^127\\."),
            Pattern.compile("^10\\."),
            Pattern.compile("^192\\.168\\."),
            Pattern.compile("^172\\.(1[6-9]|2\\d|3[01])\\."),
            Pattern.compile("^169\\.254\\."),
            Pattern.compile("^0\\."),
            Pattern.compile("^::1$"),
            Pattern.compile("^fc00:"),
            Pattern.compile("^fe80:"),
            Pattern.compile("^localhost$", Pattern.CASE_INSENSITIVE));

    private static final Set<String> ALLOWED_METHODS = Set.of("GET", "POST", "PUT", "PATCH", "DELETE", "HEAD");

    /** Host name lookup, replaceable in tests. */
    @FunctionalInterface
    public interface HostResolver {
        InetAddress[] resolve(String host) throws UnknownHostException;
    }

    private final ObjectMapper objectMapper;
    private final HostResolver resolver;
    private final Duration timeout;
    private final int maxResponseBytes;
    private final HttpClient client;

    @Inject
    public SafeFetch(HookEngineConfig config, ObjectMapper objectMapper) {
        this(config, objectMapper, InetAddress::getAllByName);
    }

    public SafeFetch(HookEngineConfig config, ObjectMapper objectMapper, HostResolver resolver) {
        this.objectMapper = objectMapper;
        this.resolver = resolver;
        this.timeout = config.fetch().timeout();
        this.maxResponseBytes = config.fetch().maxResponseBytes();
        this.client = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    /**
     * Perform the request and return the JSON text of {@code {status, ok, body}}.
     *
     * @throws IllegalArgumentException when the URL or method is not allowed
     * @throws IllegalStateException when the request fails, times out or the response is too large
     */
    public String fetch(String url, String method, Map<String, String> headers, String body) {
        URI uri = checkUrl(url);
        String verb = method == null ? "GET" : method.toUpperCase(Locale.ROOT);
        if (!ALLOWED_METHODS.contains(verb)) {
            throw new IllegalArgumentException(ERROR_PREFIX + "method " + method + " is not allowed");
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder().uri(uri).timeout(timeout);
        if (headers != null) {
            headers.forEach(builder::header);
        }
        if (body == null) {
            builder.method(verb, HttpRequest.BodyPublishers.noBody());
        } else {
            builder.method(verb, HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        }

        try {
            HttpResponse<InputStream> response = client.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
            long declared = response.headers().firstValueAsLong("Content-Length").orElse(-1L);
            try (InputStream in = response.body()) {
                if (declared > maxResponseBytes) {
                    throw new IllegalStateException(ERROR_PREFIX + "response exceeds " + maxResponseBytes + " bytes");
                }
                String text = readLimited(in, maxResponseBytes);
                return toResponseJson(response.statusCode(), text);
            }
        } catch (HttpTimeoutException e) {
            throw new IllegalStateException(ERROR_PREFIX + "timeout exceeded (" + timeout.toMillis() + "ms)", e);
        } catch (IOException e) {
            throw new IllegalStateException(ERROR_PREFIX + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(ERROR_PREFIX + "interrupted", e);
        } catch (IllegalArgumentException e) {
            // header names or values rejected by the client
            throw new IllegalArgumentException(ERROR_PREFIX + e.getMessage(), e);
        }
    }

    /**
     * @throws IllegalArgumentException when the URL is not https or targets an internal address
     */
    URI checkUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException(ERROR_PREFIX + "url is required");
        }
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException(ERROR_PREFIX + "invalid url", e);
        }
        if (!"https".equalsIgnoreCase(uri.getScheme())) {
            throw new IllegalArgumentException(ERROR_PREFIX + "only https URLs are allowed");
        }
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException(ERROR_PREFIX + "url has no host");
        }
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        for (Pattern blocked : BLOCKED_HOSTS) {
            if (blocked.matcher(host).find()) {
                throw new IllegalArgumentException(ERROR_PREFIX + "blocked host " + host);
            }
        }
        InetAddress[] addresses;
        try {
            addresses = resolver.resolve(host);
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException(ERROR_PREFIX + "unknown host " + host, e);
        }
        for (InetAddress address : addresses) {
            if (isInternal(address)) {
                Log.warnf("helpers.fetch refused %s: resolves to internal address %s", host, address.getHostAddress());
                throw new IllegalArgumentException(ERROR_PREFIX + "blocked host " + host);
            }
        }
        return uri;
    }

    static boolean isInternal(InetAddress address) {
        if (address.isLoopbackAddress() || address.isAnyLocalAddress() || address.isLinkLocalAddress()
                || address.isSiteLocalAddress() || address.isMulticastAddress()) {
            return true;
        }
        // fc00::/7 unique local
        return address instanceof Inet6Address && (address.getAddress()[0] & 0xfe) == 0xfc;
    }

    /**
     * Read at most {@code limit} bytes as UTF-8.
     *
     * @throws IllegalStateException when the stream holds more than {@code limit} bytes
     */
    static String readLimited(InputStream in, int limit) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[8192];
        int read;
        while ((read = in.read(buffer)) != -1) {
            if (out.size() + read > limit) {
                throw new IllegalStateException(ERROR_PREFIX + "response exceeds " + limit + " bytes");
            }
            out.write(buffer, 0, read);
        }
        return out.toString(StandardCharsets.UTF_8);
    }

    String toResponseJson(int status, String text) {
        ObjectNode result = objectMapper.createObjectNode();
        result.put("status", status);
        result.put("ok", status >= 200 && status < 300);
        JsonNode body;
        try {
            body = text == null || text.isBlank() ? null : objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            body = null;
        }
        if (body == null) {
            ObjectNode wrapped = objectMapper.createObjectNode();
            wrapped.put("text", text == null ? "" : text);
            body = wrapped;
        }
        result.set("body", body);
        return result.toString();
    }
}
