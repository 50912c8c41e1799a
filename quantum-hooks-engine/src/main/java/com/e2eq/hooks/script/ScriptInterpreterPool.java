package com.e2eq.hooks.script;

import com.e2eq.hooks.config.HookEngineConfig;
import com.e2eq.hooks.exceptions.InterpreterPoolExhaustedException;
import com.e2eq.hooks.metrics.HookMetrics;
import io.quarkus.logging.Log;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.graalvm.polyglot.Engine;
import org.graalvm.polyglot.ResourceLimits;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded pool of hardened interpreter contexts.
 * <p>
 * At most {@code maxSize} contexts exist at once. Callers beyond that wait in FIFO
 * order up to the acquire timeout, then fail with
 * {@link InterpreterPoolExhaustedException}. Contexts are reset on release and
 * discarded when broken, worn out, or idle longer than the idle TTL.
 */
@ApplicationScoped
public class ScriptInterpreterPool {

    private final int maxSize;
    private final Duration acquireTimeout;
    private final Duration idleTtl;
    private final int maxReuses;
    private final Clock clock;

    private final Engine engine;
    private final ResourceLimits limits;
    private final Semaphore permits;
    private final Deque<ScriptInterpreter> idle = new ConcurrentLinkedDeque<>();

    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger waiting = new AtomicInteger();
    private final AtomicInteger idleCount = new AtomicInteger();
    private final AtomicLong created = new AtomicLong();
    private final AtomicLong discarded = new AtomicLong();
    private volatile boolean closed;

    @Inject
    public ScriptInterpreterPool(HookEngineConfig config, HookMetrics metrics) {
        this(config, metrics, Clock.systemUTC());
    }

    public ScriptInterpreterPool(HookEngineConfig config, HookMetrics metrics, Clock clock) {
        this.maxSize = Math.max(1, config.pool().maxSize());
        this.acquireTimeout = config.pool().acquireTimeout();
        this.idleTtl = config.pool().idleTtl();
        this.maxReuses = Math.max(1, config.pool().maxReuses());
        this.clock = clock;
        this.permits = new Semaphore(maxSize, true);
        this.engine = Engine.newBuilder()
                .option("engine.WarnInterpreterOnly", "false")
                .build();
        this.limits = ResourceLimits.newBuilder()
                .statementLimit(config.sandbox().maxStatements(), null)
                .build();
        if (metrics != null) {
            metrics.bindPoolGauges(active, waiting, idleCount);
        }
        Log.infof("Script interpreter pool ready: maxSize=%d acquireTimeout=%s idleTtl=%s maxReuses=%d",
                maxSize, acquireTimeout, idleTtl, maxReuses);
    }

    /**
     * Borrow an interpreter, waiting up to the acquire timeout.
     *
     * @throws InterpreterPoolExhaustedException when none becomes available in time
     */
    public ScriptInterpreter acquire() {
        if (closed) {
            throw new IllegalStateException("Script interpreter pool is closed");
        }
        evictExpired();
        boolean permitted;
        waiting.incrementAndGet();
        try {
            permitted = permits.tryAcquire(acquireTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterpreterPoolExhaustedException("Interrupted while waiting for a script interpreter", e);
        } finally {
            waiting.decrementAndGet();
        }
        if (!permitted) {
            throw new InterpreterPoolExhaustedException(String.format(
                    "No script interpreter available within %d ms (max %d in use)", acquireTimeout.toMillis(), maxSize));
        }

        active.incrementAndGet();
        try {
            ScriptInterpreter interpreter = pollIdle();
            if (interpreter == null) {
                interpreter = create();
            }
            interpreter.beginUse();
            return interpreter;
        } catch (RuntimeException e) {
            active.decrementAndGet();
            permits.release();
            throw e;
        }
    }

    /**
     * Return a borrowed interpreter. Releasing the same interpreter twice is ignored.
     */
    public void release(ScriptInterpreter interpreter) {
        if (interpreter == null || !interpreter.markReturned()) {
            return;
        }
        try {
            if (closed || interpreter.isBroken() || interpreter.uses() >= maxReuses || !interpreter.reset()) {
                discard(interpreter);
            } else {
                interpreter.touch(clock.instant());
                idle.offerFirst(interpreter);
                idleCount.incrementAndGet();
            }
        } finally {
            active.decrementAndGet();
            permits.release();
        }
    }

    /**
     * Close idle interpreters that outlived the idle TTL.
     *
     * @return number of interpreters closed
     */
    public int evictExpired() {
        Instant cutoff = clock.instant().minus(idleTtl);
        List<ScriptInterpreter> expired = new ArrayList<>();
        Iterator<ScriptInterpreter> it = idle.iterator();
        while (it.hasNext()) {
            ScriptInterpreter candidate = it.next();
            if (candidate.lastUsed().isBefore(cutoff) && idle.removeFirstOccurrence(candidate)) {
                idleCount.decrementAndGet();
                expired.add(candidate);
            }
        }
        expired.forEach(this::discard);
        if (!expired.isEmpty()) {
            Log.debugf("Evicted %d idle script interpreters", expired.size());
        }
        return expired.size();
    }

    public PoolStats stats() {
        return new PoolStats(active.get(), waiting.get(), idleCount.get(), maxSize, created.get(), discarded.get());
    }

    /**
     * Threads currently queued for a permit, in arrival order.
     */
    int queuedWaiters() {
        return permits.getQueueLength();
    }

    public int maxSize() {
        return maxSize;
    }

    @PreDestroy
    public void close() {
        closed = true;
        ScriptInterpreter interpreter;
        while ((interpreter = idle.pollFirst()) != null) {
            idleCount.decrementAndGet();
            discard(interpreter);
        }
        try {
            engine.close(true);
        } catch (IllegalStateException e) {
            Log.warnf("Script engine did not close cleanly: %s", e.getMessage());
        }
    }

    private ScriptInterpreter pollIdle() {
        Instant cutoff = clock.instant().minus(idleTtl);
        ScriptInterpreter interpreter;
        while ((interpreter = idle.pollFirst()) != null) {
            idleCount.decrementAndGet();
            if (interpreter.lastUsed().isBefore(cutoff) || interpreter.isBroken()) {
                discard(interpreter);
                continue;
            }
            return interpreter;
        }
        return null;
    }

    private ScriptInterpreter create() {
        long id = created.incrementAndGet();
        if (Log.isDebugEnabled()) {
            Log.debugf("Creating script interpreter %d", id);
        }
        return new ScriptInterpreter(id, engine, limits, clock.instant());
    }

    private void discard(ScriptInterpreter interpreter) {
        discarded.incrementAndGet();
        interpreter.close();
    }
}
