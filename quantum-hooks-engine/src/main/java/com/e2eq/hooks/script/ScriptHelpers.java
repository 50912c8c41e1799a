package com.e2eq.hooks.script;

import io.quarkus.logging.Log;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.Value;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * The {@code helpers} object handed to every script. Only members annotated with
 * {@link HostAccess.Export} are reachable from script code.
 */
public class ScriptHelpers {

    static final int MAX_PATTERN_LENGTH = 512;
    static final int MAX_MATCH_INPUT_LENGTH = 10_000;
    static final int MAX_LOG_LINES = 100;
    static final int MAX_SPAN_DEPTH = 2;
    static final int MAX_CUSTOM_SPANS = 100;
    static final int MAX_SPAN_ATTRIBUTES_CHARS = 1024;

    private final String label;
    private final Clock clock;
    private final Set<String> allowedEnv;
    private final UnaryOperator<String> envLookup;
    private final SecretResolver secretResolver;
    private final PermissionChecker permissionChecker;
    private final SafeFetch fetcher;
    private final String rootSpanId;
    private final CustomSpanSink spanSink;
    private final List<String> logLines = Collections.synchronizedList(new ArrayList<>());
    private final Deque<String> openSpans = new ArrayDeque<>();
    private int customSpans;

    public ScriptHelpers(String label,
                         Clock clock,
                         Set<String> allowedEnv,
                         UnaryOperator<String> envLookup,
                         SecretResolver secretResolver,
                         PermissionChecker permissionChecker) {
        this(label, clock, allowedEnv, envLookup, secretResolver, permissionChecker, null, null, null);
    }

    /**
     * @param fetcher outbound HTTPS for {@code fetch}; null disables it
     * @param rootSpanId span of the running script, parent of top-level custom spans
     * @param spanSink receiver of {@code trace} spans; null runs traced functions without spans
     */
    public ScriptHelpers(String label,
                         Clock clock,
                         Set<String> allowedEnv,
                         UnaryOperator<String> envLookup,
                         SecretResolver secretResolver,
                         PermissionChecker permissionChecker,
                         SafeFetch fetcher,
                         String rootSpanId,
                         CustomSpanSink spanSink) {
        this.label = label;
        this.clock = clock;
        this.allowedEnv = allowedEnv == null ? Set.of() : Set.copyOf(allowedEnv);
        this.envLookup = envLookup;
        this.secretResolver = secretResolver;
        this.permissionChecker = permissionChecker;
        this.fetcher = fetcher;
        this.rootSpanId = rootSpanId;
        this.spanSink = spanSink;
    }

    @HostAccess.Export
    public void log(Object message) {
        String line = String.valueOf(message);
        if (logLines.size() < MAX_LOG_LINES) {
            logLines.add(line);
        }
        Log.infof("[script:%s] %s", label, line);
    }

    @HostAccess.Export
    public long now() {
        return clock.millis();
    }

    /**
     * Hex digest of {@code text}. Supported algorithms: sha256 (default) and md5.
     */
    @HostAccess.Export
    public String hash(String text, String algorithm) {
        String algo = algorithm == null ? "sha256" : algorithm.toLowerCase(Locale.ROOT);
        String jcaName;
        switch (algo) {
            case "sha256":
                jcaName = "SHA-256";
                break;
            case "md5":
                jcaName = "MD5";
                break;
            default:
                throw new IllegalArgumentException("Unsupported hash algorithm: " + algorithm);
        }
        try {
            MessageDigest digest = MessageDigest.getInstance(jcaName);
            byte[] bytes = digest.digest(String.valueOf(text).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(jcaName + " not available", e);
        }
    }

    /**
     * Value of an allow-listed environment key, or null for anything else.
     */
    @HostAccess.Export
    public String env(String key) {
        if (key == null || !allowedEnv.contains(key)) {
            return null;
        }
        return envLookup == null ? null : envLookup.apply(key);
    }

    @HostAccess.Export
    public String secret(String name) {
        if (secretResolver == null) {
            throw new IllegalStateException("Secrets are not available to this script");
        }
        return secretResolver.resolve(name);
    }

    /**
     * True when {@code pattern} is found anywhere in {@code value}.
     */
    @HostAccess.Export
    public boolean matches(String value, String pattern) {
        if (value == null || pattern == null) {
            return false;
        }
        if (pattern.length() > MAX_PATTERN_LENGTH) {
            throw new IllegalArgumentException("Pattern longer than " + MAX_PATTERN_LENGTH + " characters");
        }
        if (value.length() > MAX_MATCH_INPUT_LENGTH) {
            throw new IllegalArgumentException("Input longer than " + MAX_MATCH_INPUT_LENGTH + " characters");
        }
        try {
            return Pattern.compile(pattern).matcher(value).find();
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid pattern: " + e.getDescription(), e);
        }
    }

    @HostAccess.Export
    public boolean checkPermission(String subjectType, String subjectId, String entityType, String entityId,
                                   String permission) {
        if (permissionChecker == null) {
            throw new IllegalStateException("checkPermission is not available in policy scripts");
        }
        return permissionChecker.check(subjectType, subjectId, entityType, entityId, permission);
    }

    @HostAccess.Export
    public Value fetch(String url) {
        return fetch(url, null);
    }

    /**
     * HTTPS request to a public host. {@code options} may carry {@code method},
     * {@code headers} and {@code body}; a non-string body is sent as JSON.
     * Returns {@code {status, ok, body}}.
     */
    @HostAccess.Export
    public Value fetch(String url, Value options) {
        if (fetcher == null) {
            throw new IllegalStateException("fetch is not available to this script");
        }
        String method = null;
        String body = null;
        Map<String, String> headers = new LinkedHashMap<>();
        if (options != null && options.hasMembers()) {
            Value m = member(options, "method");
            if (m != null && m.isString()) {
                method = m.asString();
            }
            Value h = member(options, "headers");
            if (h != null && h.hasMembers()) {
                for (String key : h.getMemberKeys()) {
                    Value v = h.getMember(key);
                    if (v != null && !v.isNull()) {
                        headers.put(key, v.isString() ? v.asString() : v.toString());
                    }
                }
            }
            Value b = member(options, "body");
            if (b != null) {
                body = b.isString() ? b.asString() : stringify(b);
            }
        }
        return jsGlobal("JSON").invokeMember("parse", fetcher.fetch(url, method, headers, body));
    }

    /**
     * Run {@code fn} inside a named child span: {@code trace(name, fn)} or
     * {@code trace(name, attributes, fn)}. Returns what {@code fn} returns and rethrows
     * what it throws. Past the nesting or count limit, or with malformed arguments,
     * {@code fn} still runs but no span is recorded.
     */
    @HostAccess.Export
    public Value trace(Value... args) {
        String name = null;
        Value attributes = null;
        Value fn = null;
        if (args.length == 2 && args[0].isString() && args[1].canExecute()) {
            name = args[0].asString();
            fn = args[1];
        } else if (args.length == 3 && args[0].isString() && args[2].canExecute()) {
            name = args[0].asString();
            attributes = args[1];
            fn = args[2];
        }
        if (fn == null) {
            Log.warnf("[script:%s] helpers.trace called with invalid arguments; running without a span", label);
            for (int i = 1; i < args.length; i++) {
                if (args[i].canExecute()) {
                    return args[i].execute();
                }
            }
            return null;
        }
        if (spanSink == null) {
            return fn.execute();
        }
        if (openSpans.size() >= MAX_SPAN_DEPTH || customSpans >= MAX_CUSTOM_SPANS) {
            Log.debugf("[script:%s] span limit reached; '%s' runs untraced", label, name);
            return fn.execute();
        }

        String attributesJson = null;
        if (attributes != null && !attributes.isNull()) {
            attributesJson = stringify(attributes);
            if (attributesJson != null && attributesJson.length() > MAX_SPAN_ATTRIBUTES_CHARS) {
                attributesJson = attributesJson.substring(0, MAX_SPAN_ATTRIBUTES_CHARS);
            }
        }
        String id = UUID.randomUUID().toString();
        String parent = openSpans.isEmpty() ? rootSpanId : openSpans.peek();
        customSpans++;
        openSpans.push(id);
        Instant started = clock.instant();
        try {
            Value result = fn.execute();
            spanSink.record(new CustomSpan(id, parent, name, started, clock.instant(), attributesJson, null));
            return result;
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            spanSink.record(new CustomSpan(id, parent, name, started, clock.instant(), attributesJson, message));
            throw e;
        } finally {
            openSpans.pop();
        }
    }

    public List<String> logLines() {
        synchronized (logLines) {
            return List.copyOf(logLines);
        }
    }

    public String label() {
        return label;
    }

    private static Value member(Value object, String key) {
        Value v = object.getMember(key);
        return v == null || v.isNull() ? null : v;
    }

    private static String stringify(Value value) {
        Value json = jsGlobal("JSON").invokeMember("stringify", value);
        return json == null || json.isNull() ? null : json.asString();
    }

    private static Value jsGlobal(String name) {
        return Context.getCurrent().getBindings("js").getMember(name);
    }
}
