package com.e2eq.hooks.pipeline;

import com.e2eq.hooks.config.HookEngineConfig;
import com.e2eq.hooks.exceptions.InterpreterPoolExhaustedException;
import com.e2eq.hooks.exceptions.SandboxException;
import com.e2eq.hooks.metrics.HookMetrics;
import com.e2eq.hooks.model.pipeline.ExecutionMode;
import com.e2eq.hooks.model.pipeline.HookBinding;
import com.e2eq.hooks.model.pipeline.ScriptSource;
import com.e2eq.hooks.model.trace.SpanStatus;
import com.e2eq.hooks.model.trace.TraceOutcome;
import com.e2eq.hooks.registry.HookDefinition;
import com.e2eq.hooks.registry.HookInputValidator;
import com.e2eq.hooks.registry.HookRegistry;
import com.e2eq.hooks.repo.HookBindingRepo;
import com.e2eq.hooks.repo.ScriptSourceRepo;
import com.e2eq.hooks.script.CustomSpanSink;
import com.e2eq.hooks.script.ExecutionBudget;
import com.e2eq.hooks.script.PermissionChecker;
import com.e2eq.hooks.script.SandboxBridge;
import com.e2eq.hooks.script.ScriptExecution;
import com.e2eq.hooks.script.ScriptHelperFactory;
import com.e2eq.hooks.trace.SpanRecord;
import com.e2eq.hooks.trace.TraceMetadata;
import com.e2eq.hooks.trace.TraceRecorder;
import com.e2eq.hooks.util.ExceptionLoggingUtils;
import io.quarkus.logging.Log;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Runs the scripts bound to a hook and combines their results according to the
 * hook's execution mode.
 * <ul>
 *   <li>blocking: in order, stopping at the first denial</li>
 *   <li>enrichment: in order, merging returned data; any denial discards it</li>
 *   <li>async: each binding queued on the async executor; the caller never waits</li>
 * </ul>
 * In the sequential modes each script sees the data returned by the scripts before
 * it: {@code context.prev} holds the previous script's data and
 * {@code context.outputs} maps script id to data. These two keys replace input
 * fields of the same name.
 * <p>
 * Script failures deny blocking and enrichment hooks, as does binding more scripts
 * than the configured chain depth. An exhausted interpreter pool is not a denial and
 * propagates to the caller.
 */
@ApplicationScoped
public class PipelineDispatcher {

    static final String OUTCOME_ALLOWED = "allowed";
    static final String OUTCOME_DENIED = "denied";
    static final String OUTCOME_ERROR = "error";

    private final HookRegistry registry;
    private final HookInputValidator inputValidator;
    private final HookBindingRepo bindingRepo;
    private final ScriptSourceRepo scriptRepo;
    private final SandboxBridge sandbox;
    private final ScriptHelperFactory helperFactory;
    private final PermissionChecker permissionChecker;
    private final TraceRecorder traceRecorder;
    private final HookMetrics metrics;
    private final HookEngineConfig config;
    private final Clock clock;
    private final ThreadPoolExecutor asyncExecutor;

    @Inject
    public PipelineDispatcher(HookRegistry registry,
                              HookInputValidator inputValidator,
                              HookBindingRepo bindingRepo,
                              ScriptSourceRepo scriptRepo,
                              SandboxBridge sandbox,
                              ScriptHelperFactory helperFactory,
                              PermissionChecker permissionChecker,
                              TraceRecorder traceRecorder,
                              HookMetrics metrics,
                              HookEngineConfig config) {
        this(registry, inputValidator, bindingRepo, scriptRepo, sandbox, helperFactory, permissionChecker,
                traceRecorder, metrics, config, Clock.systemUTC());
    }

    public PipelineDispatcher(HookRegistry registry,
                              HookInputValidator inputValidator,
                              HookBindingRepo bindingRepo,
                              ScriptSourceRepo scriptRepo,
                              SandboxBridge sandbox,
                              ScriptHelperFactory helperFactory,
                              PermissionChecker permissionChecker,
                              TraceRecorder traceRecorder,
                              HookMetrics metrics,
                              HookEngineConfig config,
                              Clock clock) {
        this.registry = registry;
        this.inputValidator = inputValidator;
        this.bindingRepo = bindingRepo;
        this.scriptRepo = scriptRepo;
        this.sandbox = sandbox;
        this.helperFactory = helperFactory;
        this.permissionChecker = permissionChecker;
        this.traceRecorder = traceRecorder;
        this.metrics = metrics;
        this.config = config;
        this.clock = clock;
        this.asyncExecutor = newAsyncExecutor(config.async());
    }

    private static ThreadPoolExecutor newAsyncExecutor(HookEngineConfig.Async async) {
        AtomicInteger threadCount = new AtomicInteger();
        int threads = Math.max(1, async.threads());
        return new ThreadPoolExecutor(threads, threads, 60L, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(Math.max(1, async.queueCapacity())),
                r -> {
                    Thread th = new Thread(r, "hook-async-" + threadCount.incrementAndGet());
                    th.setDaemon(true);
                    return th;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    public HookResult dispatch(String hookName, Object input) {
        return dispatch(hookName, input, TraceMetadata.NONE);
    }

    /**
     * @throws com.e2eq.hooks.exceptions.UnknownHookException when the hook does not exist
     * @throws com.e2eq.hooks.exceptions.HookInputValidationException when the payload does not match the hook's input
     * @throws InterpreterPoolExhaustedException when a blocking or enrichment script could not get an interpreter
     */
    public HookResult dispatch(String hookName, Object input, TraceMetadata metadata) {
        HookDefinition definition = registry.require(hookName);
        Map<String, Object> context = inputValidator.validate(definition, input);

        List<HookBinding> bindings = enabledBindings(hookName);
        if (bindings.isEmpty()) {
            return HookResult.neutral();
        }

        String traceId = traceRecorder.startTrace(hookName, context, metadata);
        int limit = scriptLimit(config, definition.executionMode());
        if (bindings.size() > limit) {
            String error = limitError(definition.executionMode(), limit, bindings.size());
            Log.warnf("Hook %s not run: %s", hookName, error);
            traceRecorder.endTrace(traceId, TraceOutcome.ERROR, error, null);
            metrics.recordDispatch(hookName, OUTCOME_ERROR);
            return definition.executionMode() == ExecutionMode.ASYNC ? HookResult.neutral() : HookResult.deny(error);
        }
        switch (definition.executionMode()) {
            case ASYNC:
                dispatchAsync(definition, bindings, context, traceId);
                metrics.recordDispatch(hookName, OUTCOME_ALLOWED);
                return HookResult.neutral();
            case ENRICHMENT:
                return runSequential(definition, bindings, context, traceId, true);
            case BLOCKING:
            default:
                return runSequential(definition, bindings, context, traceId, false);
        }
    }

    /**
     * Most enabled scripts a hook of the given mode may run in one dispatch.
     */
    static int scriptLimit(HookEngineConfig config, ExecutionMode mode) {
        return mode == ExecutionMode.ASYNC ? config.pipeline().maxParallelScripts() : config.pipeline().maxChainDepth();
    }

    static String limitError(ExecutionMode mode, int limit, int actual) {
        return mode == ExecutionMode.ASYNC
                ? "Pipeline exceeds max parallel scripts (" + limit + " allowed, got " + actual + ")"
                : "Pipeline exceeds max chain depth (" + limit + " allowed, got " + actual + ")";
    }

    List<HookBinding> enabledBindings(String hookName) {
        return bindingRepo.findByHook(hookName).stream()
                .filter(HookBinding::isEnabled)
                .sorted(HookBinding.EXECUTION_ORDER)
                .collect(Collectors.toList());
    }

    private HookResult runSequential(HookDefinition definition, List<HookBinding> bindings,
                                     Map<String, Object> context, String traceId, boolean merge) {
        Map<String, Object> accumulated = new LinkedHashMap<>();
        Map<String, Object> outputs = new LinkedHashMap<>();
        Map<String, Object> prev = null;
        try {
            for (HookBinding binding : bindings) {
                Step step = runBinding(definition, binding, chained(context, prev, outputs), traceId);
                if (step.skipped()) {
                    continue;
                }
                if (!step.outcome().allowed()) {
                    TraceOutcome outcome = step.failed() ? TraceOutcome.ERROR : TraceOutcome.BLOCKED;
                    traceRecorder.endTrace(traceId, outcome, step.outcome().error(), null);
                    metrics.recordDispatch(definition.name(), step.failed() ? OUTCOME_ERROR : OUTCOME_DENIED);
                    return HookResult.deny(step.outcome().error());
                }
                outputs.put(binding.getScriptId(), step.outcome().data());
                prev = step.outcome().data();
                if (merge) {
                    accumulated.putAll(step.outcome().data());
                }
            }
        } catch (RuntimeException e) {
            // pool exhaustion, repository or engine failures: not a denial, the caller decides
            traceRecorder.endTrace(traceId, TraceOutcome.ERROR, e.getMessage(), null);
            metrics.recordDispatch(definition.name(), OUTCOME_ERROR);
            throw e;
        }
        traceRecorder.endTrace(traceId, TraceOutcome.SUCCESS, null, merge ? accumulated : null);
        metrics.recordDispatch(definition.name(), OUTCOME_ALLOWED);
        return merge ? HookResult.allow(accumulated) : HookResult.neutral();
    }

    private static Map<String, Object> chained(Map<String, Object> context, Map<String, Object> prev,
                                               Map<String, Object> outputs) {
        Map<String, Object> chained = new LinkedHashMap<>(context);
        chained.put("outputs", new LinkedHashMap<>(outputs));
        if (prev == null) {
            chained.remove("prev");
        } else {
            chained.put("prev", prev);
        }
        return chained;
    }

    private void dispatchAsync(HookDefinition definition, List<HookBinding> bindings,
                               Map<String, Object> context, String traceId) {
        AtomicInteger remaining = new AtomicInteger(bindings.size());
        AtomicBoolean anyFailed = new AtomicBoolean();
        for (HookBinding binding : bindings) {
            Runnable task = () -> {
                try {
                    Step step = runBinding(definition, binding, context, traceId);
                    if (step.failed()) {
                        anyFailed.set(true);
                        Log.warnf("Async hook %s script %s failed: %s", definition.name(), binding.getScriptId(),
                                step.outcome().error());
                    }
                } catch (RuntimeException e) {
                    anyFailed.set(true);
                    ExceptionLoggingUtils.logError(e, "Async hook %s script %s failed", definition.name(),
                            binding.getScriptId());
                } finally {
                    finishAsync(traceId, remaining, anyFailed);
                }
            };
            try {
                asyncExecutor.execute(task);
            } catch (RejectedExecutionException e) {
                anyFailed.set(true);
                Log.warnf("Async hook %s queue is full; dropped script %s", definition.name(), binding.getScriptId());
                traceRecorder.recordSpan(new SpanRecord(traceId, binding.getScriptId(), null, binding.getOrdinal(),
                        SpanStatus.ERROR, clock.instant(), clock.instant(), context, null, "Async queue full"));
                finishAsync(traceId, remaining, anyFailed);
            }
        }
    }

    private void finishAsync(String traceId, AtomicInteger remaining, AtomicBoolean anyFailed) {
        if (remaining.decrementAndGet() == 0) {
            traceRecorder.endTrace(traceId, anyFailed.get() ? TraceOutcome.ERROR : TraceOutcome.SUCCESS);
        }
    }

    /**
     * Run one bound script and record its span. Sandbox failures become a failed denial;
     * pool exhaustion propagates.
     */
    private Step runBinding(HookDefinition definition, HookBinding binding, Map<String, Object> context,
                            String traceId) {
        Instant started = clock.instant();
        Optional<ScriptSource> found = scriptRepo.findById(binding.getScriptId());
        if (found.isEmpty()) {
            Log.warnf("Hook %s is bound to missing script %s; skipping", definition.name(), binding.getScriptId());
            traceRecorder.recordSpan(new SpanRecord(traceId, binding.getScriptId(), null, binding.getOrdinal(),
                    SpanStatus.SKIPPED, started, clock.instant(), context, null, "Script not found"));
            return Step.SKIPPED;
        }
        ScriptSource script = found.get();
        String spanId = UUID.randomUUID().toString();
        CustomSpanSink spanSink = span -> traceRecorder.recordSpan(new SpanRecord(traceId, null, span.name(),
                binding.getOrdinal(), span.failed() ? SpanStatus.ERROR : SpanStatus.SUCCESS, span.startedAt(),
                span.endedAt(), null, null, span.error(), span.id(), span.parentSpanId(), span.attributes()));
        try {
            ScriptExecution execution = sandbox.execute(script.getSourceCode(), context,
                    helperFactory.forHook(definition.name(), script.getName(), permissionChecker, spanId, spanSink),
                    ExecutionBudget.forHooks(config));
            ScriptOutcome outcome = definition.outputContract().interpret(execution.result());
            SpanStatus status = outcome.allowed() ? SpanStatus.SUCCESS : SpanStatus.BLOCKED;
            traceRecorder.recordSpan(new SpanRecord(traceId, script.getId(), script.getName(), binding.getOrdinal(),
                    status, started, clock.instant(), context, execution.result(), outcome.error(), spanId, null, null));
            metrics.recordScriptExecution(definition.name(), status.wireName(), execution.durationMs());
            return new Step(outcome, false, false);
        } catch (SandboxException e) {
            Log.debugf("Hook %s script %s failed (%s): %s", definition.name(), script.getName(), e.getKind(),
                    e.getMessage());
            Instant ended = clock.instant();
            traceRecorder.recordSpan(new SpanRecord(traceId, script.getId(), script.getName(), binding.getOrdinal(),
                    SpanStatus.ERROR, started, ended, context, null, e.getMessage(), spanId, null, null));
            metrics.recordScriptExecution(definition.name(), SpanStatus.ERROR.wireName(),
                    Math.max(0L, ended.toEpochMilli() - started.toEpochMilli()));
            return new Step(ScriptOutcome.deny(e.getMessage()), true, false);
        }
    }

    @PreDestroy
    public void shutdown() {
        asyncExecutor.shutdown();
        try {
            long graceMs = config.async().shutdownGrace().toMillis();
            if (!asyncExecutor.awaitTermination(graceMs, TimeUnit.MILLISECONDS)) {
                List<Runnable> dropped = asyncExecutor.shutdownNow();
                Log.warnf("Async hook executor did not drain in %dms; dropped %d queued tasks", graceMs, dropped.size());
            }
        } catch (InterruptedException e) {
            asyncExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private record Step(ScriptOutcome outcome, boolean failed, boolean skipped) {
        static final Step SKIPPED = new Step(ScriptOutcome.allow(), false, true);
    }
}
