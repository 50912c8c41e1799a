package com.e2eq.hooks.script;

import com.e2eq.hooks.exceptions.SandboxException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.logging.Log;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs one script inside a pooled interpreter.
 * <p>
 * The script body becomes a strict-mode function of {@code (context, helpers)}.
 * {@code context} is a deep-frozen copy of the input built from JSON, so the script
 * never holds a reference to host objects other than {@code helpers}. The return
 * value crosses back as JSON.
 * <p>
 * A script started from a helper of a running script (a policy evaluated through
 * {@code helpers.checkPermission}) runs in the interpreter its caller already holds
 * instead of borrowing a second one.
 */
@ApplicationScoped
public class SandboxBridge {

    private static final String WRAPPER_HEAD = String.join("\n",
            "(function (__contextJson, helpers) {",
            "  'use strict';",
            "  const __freeze = (o) => {",
            "    if (o !== null && typeof o === 'object' && !Object.isFrozen(o)) {",
            "      Object.freeze(o);",
            "      for (const k of Object.keys(o)) { __freeze(o[k]); }",
            "    }",
            "    return o;",
            "  };",
            "  const context = __freeze(JSON.parse(__contextJson));",
            "  const __result = (function (context, helpers) {",
            "'use strict';",
            "");
    private static final String WRAPPER_TAIL = String.join("\n",
            "",
            "  })(context, helpers);",
            "  return __result === undefined ? null : JSON.stringify(__result);",
            "})");

    private final ScriptInterpreterPool pool;
    private final ObjectMapper objectMapper;
    private final ScheduledExecutorService watchdog;
    private final AtomicLong sourceCounter = new AtomicLong();
    private final ThreadLocal<ScriptInterpreter> inUse = new ThreadLocal<>();

    @Inject
    public SandboxBridge(ScriptInterpreterPool pool, ObjectMapper objectMapper) {
        this.pool = pool;
        this.objectMapper = objectMapper;
        this.watchdog = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread th = new Thread(r, "script-watchdog");
            th.setDaemon(true);
            return th;
        });
    }

    /**
     * Execute {@code code} with the given context and helpers.
     *
     * @throws SandboxException when the script is too large, fails, times out or returns non-JSON data
     * @throws com.e2eq.hooks.exceptions.InterpreterPoolExhaustedException when no interpreter is free in time
     */
    public ScriptExecution execute(String code, Object context, ScriptHelpers helpers, ExecutionBudget budget) {
        checkSize(code, budget.maxScriptBytes());

        String contextJson;
        try {
            contextJson = objectMapper.writeValueAsString(context == null ? Map.of() : context);
        } catch (JsonProcessingException e) {
            throw new SandboxException(SandboxException.Kind.INTERNAL, "Script context is not serializable", e);
        }

        Source source = Source.newBuilder("js", WRAPPER_HEAD + code + WRAPPER_TAIL,
                        "script-" + sourceCounter.incrementAndGet() + ".js")
                .cached(false)
                .buildLiteral();

        long timeoutMs = Math.max(1L, budget.timeout().toMillis());
        ScriptInterpreter outer = inUse.get();
        ScriptInterpreter interpreter = outer != null ? outer : pool.acquire();
        if (outer == null) {
            inUse.set(interpreter);
        }
        long lease = interpreter.currentLease();
        long start = System.nanoTime();
        ScheduledFuture<?> guard = watchdog.schedule(() -> interpreter.cancel(lease), timeoutMs, TimeUnit.MILLISECONDS);
        try {
            Value fn = interpreter.evaluate(source);
            Value out = fn.execute(contextJson, helpers);
            long elapsed = elapsedMillis(start);
            Object result = (out == null || out.isNull()) ? null : objectMapper.readValue(out.asString(), Object.class);
            return new ScriptExecution(result, elapsed, helpers == null ? List.of() : helpers.logLines());
        } catch (PolyglotException e) {
            throw translate(e, interpreter, timeoutMs);
        } catch (IllegalStateException e) {
            // context closed underneath us by the watchdog
            interpreter.markBroken();
            if (interpreter.wasCancelled()) {
                throw SandboxException.timeout(timeoutMs);
            }
            throw new SandboxException(SandboxException.Kind.INTERNAL, "Script interpreter unavailable: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw SandboxException.malformed("result is not valid JSON");
        } finally {
            guard.cancel(false);
            if (outer == null) {
                inUse.remove();
                pool.release(interpreter);
            }
        }
    }

    /**
     * Parse {@code code} as a script body without running it.
     *
     * @throws SandboxException with kind SYNTAX_ERROR when it does not parse
     */
    public void checkSyntax(String code, int maxScriptBytes) {
        checkSize(code, maxScriptBytes);
        Source source = Source.newBuilder("js", "(function (context, helpers) {\n'use strict';\n" + code + "\n})",
                        "syntax-check.js")
                .cached(false)
                .buildLiteral();
        ScriptInterpreter interpreter = pool.acquire();
        try {
            // evaluating the function expression compiles the body without calling it
            interpreter.evaluate(source);
        } catch (PolyglotException e) {
            throw translate(e, interpreter, 0L);
        } finally {
            pool.release(interpreter);
        }
    }

    @PreDestroy
    public void shutdown() {
        watchdog.shutdownNow();
    }

    private static void checkSize(String code, int maxScriptBytes) {
        if (code == null || code.isBlank()) {
            throw new SandboxException(SandboxException.Kind.SCRIPT_ERROR, "Script is empty");
        }
        int size = code.getBytes(StandardCharsets.UTF_8).length;
        if (maxScriptBytes > 0 && size > maxScriptBytes) {
            throw new SandboxException(SandboxException.Kind.TOO_LARGE,
                    "Script exceeds maximum size of " + maxScriptBytes + " bytes (" + size + ")");
        }
    }

    private static SandboxException translate(PolyglotException e, ScriptInterpreter interpreter, long timeoutMs) {
        if (e.isResourceExhausted()) {
            interpreter.markBroken();
            return new SandboxException(SandboxException.Kind.RESOURCE_EXHAUSTED, "Script exceeded the statement limit", e);
        }
        if (e.isCancelled() || interpreter.wasCancelled()) {
            interpreter.markBroken();
            return SandboxException.timeout(timeoutMs);
        }
        if (e.isSyntaxError()) {
            return new SandboxException(SandboxException.Kind.SYNTAX_ERROR, "Script syntax error: " + e.getMessage(), e);
        }
        if (e.isInternalError() || e.isExit()) {
            interpreter.markBroken();
            Log.warnf("Script interpreter %d failed internally: %s", interpreter.id(), e.getMessage());
            return new SandboxException(SandboxException.Kind.INTERNAL, "Script engine failure", e);
        }
        if (e.isHostException()) {
            Throwable host = e.asHostException();
            String message = host.getMessage() != null ? host.getMessage() : host.getClass().getSimpleName();
            return new SandboxException(SandboxException.Kind.SCRIPT_ERROR, message, e);
        }
        return new SandboxException(SandboxException.Kind.SCRIPT_ERROR, e.getMessage(), e);
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
