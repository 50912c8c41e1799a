package com.e2eq.hooks.script;

import io.quarkus.logging.Log;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Engine;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.ResourceLimits;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A pooled, hardened JavaScript context. Only one thread uses an interpreter at a
 * time; the pool hands it out and takes it back.
 */
public final class ScriptInterpreter implements AutoCloseable {

    /*
     * Runs once per context. Removes shell builtins, freezes the intrinsics so one
     * script cannot change what the next one sees, pins the baseline globals and
     * returns the function that strips anything a script added to the global object.
     */
    private static final String PRELUDE = String.join("\n",
            "(function () {",
            "  'use strict';",
            "  for (const name of ['load', 'loadWithNewGlobal', 'print', 'printErr', 'quit', 'exit',",
            "                      'read', 'readline', 'readbuffer', 'console', 'Polyglot', 'Java', 'Graal']) {",
            "    try { delete globalThis[name]; } catch (e) { }",
            "  }",
            "  const intrinsics = [Object, Array, Function, String, Number, Boolean, Symbol, BigInt, Date, RegExp,",
            "      Error, TypeError, RangeError, SyntaxError, ReferenceError, EvalError, URIError,",
            "      Promise, Map, Set, WeakMap, WeakSet, JSON, Math, Reflect];",
            "  for (const c of intrinsics) {",
            "    if (c.prototype) { Object.freeze(c.prototype); }",
            "    Object.freeze(c);",
            "  }",
            "  for (const name of Object.getOwnPropertyNames(globalThis)) {",
            "    const d = Object.getOwnPropertyDescriptor(globalThis, name);",
            "    if (d && d.configurable && 'value' in d) {",
            "      try { Object.defineProperty(globalThis, name, { writable: false, configurable: false }); } catch (e) { }",
            "    }",
            "  }",
            "  const baseline = new Set(Object.getOwnPropertyNames(globalThis));",
            "  return function () {",
            "    for (const name of Object.getOwnPropertyNames(globalThis)) {",
            "      if (!baseline.has(name)) { delete globalThis[name]; }",
            "    }",
            "  };",
            "})()");

    private final long id;
    private final Context context;
    private final Value resetFunction;
    private final Instant createdAt;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private boolean leased;
    private long lease;
    private volatile boolean broken;
    private volatile Instant lastUsed;
    private int uses;

    ScriptInterpreter(long id, Engine engine, ResourceLimits limits, Instant now) {
        this.id = id;
        this.createdAt = now;
        this.lastUsed = now;
        this.context = Context.newBuilder("js")
                .engine(engine)
                .allowAllAccess(false)
                .allowHostAccess(HostAccess.newBuilder()
                        .allowPublicAccess(false)
                        .allowAccessAnnotatedBy(HostAccess.Export.class)
                        .allowArrayAccess(true)
                        .allowListAccess(true)
                        .build())
                .allowHostClassLookup(s -> false)
                .allowIO(false)
                .allowNativeAccess(false)
                .allowCreateThread(false)
                .allowCreateProcess(false)
                .resourceLimits(limits)
                .option("js.ecmascript-version", "2021")
                .build();
        try {
            this.resetFunction = context.eval(Source.newBuilder("js", PRELUDE, "prelude.js").buildLiteral());
            context.resetLimits();
        } catch (RuntimeException e) {
            context.close(true);
            throw e;
        }
    }

    public long id() {
        return id;
    }

    Instant createdAt() {
        return createdAt;
    }

    Instant lastUsed() {
        return lastUsed;
    }

    int uses() {
        return uses;
    }

    /**
     * Start a new lease.
     *
     * @return the lease number, which {@link #cancel(long)} must present
     */
    synchronized long beginUse() {
        leased = true;
        lease++;
        uses++;
        cancelled.set(false);
        context.resetLimits();
        return lease;
    }

    /**
     * @return false when the interpreter was not leased
     */
    synchronized boolean markReturned() {
        if (!leased) {
            return false;
        }
        leased = false;
        return true;
    }

    /**
     * Number of the current (or last) lease.
     */
    public synchronized long currentLease() {
        return lease;
    }

    void touch(Instant now) {
        lastUsed = now;
    }

    /**
     * Compile a script source in this context. The returned value is only valid
     * while the interpreter is leased.
     */
    public Value evaluate(Source source) {
        return context.eval(source);
    }

    /**
     * Strip globals added by the previous script and zero the statement counter.
     *
     * @return false when the context can no longer be reused
     */
    boolean reset() {
        if (broken) {
            return false;
        }
        try {
            resetFunction.executeVoid();
            context.resetLimits();
            return true;
        } catch (PolyglotException | IllegalStateException e) {
            Log.debugf("Interpreter %d failed to reset: %s", id, e.getMessage());
            broken = true;
            return false;
        }
    }

    /**
     * Abort the script running under lease {@code expectedLease}. Does nothing when
     * that lease has already ended, so a late watchdog cannot hit the next borrower.
     *
     * @return true when the context was cancelled
     */
    public synchronized boolean cancel(long expectedLease) {
        if (!leased || lease != expectedLease) {
            return false;
        }
        cancel();
        return true;
    }

    /**
     * Abort whatever is running from another thread. The context is unusable afterwards.
     */
    public synchronized void cancel() {
        cancelled.set(true);
        broken = true;
        try {
            context.close(true);
        } catch (IllegalStateException | PolyglotException e) {
            Log.debugf("Interpreter %d cancel raised %s", id, e.getMessage());
        }
    }

    public boolean wasCancelled() {
        return cancelled.get();
    }

    public void markBroken() {
        broken = true;
    }

    public boolean isBroken() {
        return broken;
    }

    @Override
    public void close() {
        broken = true;
        try {
            context.close(true);
        } catch (IllegalStateException | PolyglotException e) {
            Log.debugf("Interpreter %d close raised %s", id, e.getMessage());
        }
    }
}
