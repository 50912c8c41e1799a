package com.e2eq.hooks.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer meters for the interpreter pool, the dispatcher and the permission evaluator.
 */
@ApplicationScoped
public class HookMetrics {

    public static final String POOL_ACTIVE = "quantum.hooks.pool.active";
    public static final String POOL_WAITING = "quantum.hooks.pool.waiting";
    public static final String POOL_IDLE = "quantum.hooks.pool.idle";
    public static final String DISPATCH_OUTCOMES = "quantum.hooks.dispatch";
    public static final String SCRIPT_DURATION = "quantum.hooks.script.duration";
    public static final String PERMISSION_DECISIONS = "quantum.authz.decisions";

    private final MeterRegistry meterRegistry;

    @Inject
    public HookMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void bindPoolGauges(AtomicInteger active, AtomicInteger waiting, AtomicInteger idle) {
        Gauge.builder(POOL_ACTIVE, active, AtomicInteger::get)
                .description("Interpreter contexts currently leased")
                .register(meterRegistry);
        Gauge.builder(POOL_WAITING, waiting, AtomicInteger::get)
                .description("Callers waiting for an interpreter context")
                .register(meterRegistry);
        Gauge.builder(POOL_IDLE, idle, AtomicInteger::get)
                .description("Interpreter contexts ready for reuse")
                .register(meterRegistry);
    }

    /**
     * @param outcome one of allowed, denied, error
     */
    public void recordDispatch(String hookName, String outcome) {
        Counter.builder(DISPATCH_OUTCOMES)
                .tag("hook", hookName)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    public void recordScriptExecution(String hookName, String status, long durationMs) {
        Timer.builder(SCRIPT_DURATION)
                .tag("hook", hookName)
                .tag("status", status)
                .register(meterRegistry)
                .record(Duration.ofMillis(durationMs));
    }

    /**
     * @param result one of allowed, denied, error
     */
    public void recordPermissionDecision(String entityType, String result) {
        Counter.builder(PERMISSION_DECISIONS)
                .tag("entityType", entityType == null ? "unknown" : entityType)
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    public MeterRegistry registry() {
        return meterRegistry;
    }
}
