package com.e2eq.hooks.trace;

import com.e2eq.hooks.config.HookEngineConfig;
import com.e2eq.hooks.model.trace.PipelineSpan;
import com.e2eq.hooks.model.trace.PipelineTrace;
import com.e2eq.hooks.model.trace.TraceOutcome;
import com.e2eq.hooks.repo.TraceRepo;
import com.e2eq.hooks.util.ExceptionLoggingUtils;
import com.e2eq.hooks.util.JsonSnapshots;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persists one trace per dispatch and one span per script execution.
 * <p>
 * Writes are best-effort: a failing trace store is logged and never fails the
 * dispatch that produced the trace. Inputs and outputs are stored as bounded JSON
 * snapshots.
 */
@ApplicationScoped
public class TraceRecorder {

    private final TraceRepo repo;
    private final ObjectMapper objectMapper;
    private final HookEngineConfig config;
    private final Clock clock;

    @Inject
    public TraceRecorder(TraceRepo repo, ObjectMapper objectMapper, HookEngineConfig config) {
        this(repo, objectMapper, config, Clock.systemUTC());
    }

    public TraceRecorder(TraceRepo repo, ObjectMapper objectMapper, HookEngineConfig config, Clock clock) {
        this.repo = repo;
        this.objectMapper = objectMapper;
        this.config = config;
        this.clock = clock;
    }

    public String startTrace(String hookName, String triggerEvent) {
        return startTrace(hookName, null, TraceMetadata.of(triggerEvent));
    }

    /**
     * Open a trace in RUNNING state.
     *
     * @return the trace id, assigned even when the write fails
     */
    public String startTrace(String hookName, Object context, TraceMetadata metadata) {
        Instant now = clock.instant();
        TraceMetadata meta = metadata == null ? TraceMetadata.NONE : metadata;
        PipelineTrace trace = PipelineTrace.builder()
                .id(UUID.randomUUID().toString())
                .createdAt(now)
                .hookName(hookName)
                .triggerEvent(meta.triggerEvent() != null ? meta.triggerEvent() : hookName)
                .startedAt(now)
                .outcome(TraceOutcome.RUNNING)
                .contextSnapshot(snapshot(context))
                .userId(meta.userId())
                .requestIp(meta.requestIp())
                .build();
        try {
            repo.saveTrace(trace);
        } catch (RuntimeException e) {
            ExceptionLoggingUtils.logBestEffortFailure(e, "Failed to start trace for hook %s", hookName);
        }
        return trace.getId();
    }

    public void recordSpan(SpanRecord span) {
        Instant now = clock.instant();
        Instant started = span.startedAt() != null ? span.startedAt() : now;
        Instant ended = span.endedAt() != null ? span.endedAt() : now;
        PipelineSpan entity = PipelineSpan.builder()
                .id(span.spanId() != null ? span.spanId() : UUID.randomUUID().toString())
                .createdAt(now)
                .traceId(span.traceId())
                .parentSpanId(span.parentSpanId())
                .scriptId(span.scriptId())
                .scriptName(span.scriptName())
                .ordinal(span.ordinal())
                .status(span.status())
                .startedAt(started)
                .endedAt(ended)
                .durationMs(Math.max(0L, Duration.between(started, ended).toMillis()))
                .input(snapshot(span.input()))
                .output(snapshot(span.output()))
                .error(span.error())
                .attributes(span.attributes())
                .build();
        try {
            repo.saveSpan(entity);
        } catch (RuntimeException e) {
            ExceptionLoggingUtils.logBestEffortFailure(e, "Failed to record span for trace %s", span.traceId());
        }
    }

    public void endTrace(String traceId, TraceOutcome outcome) {
        endTrace(traceId, outcome, null, null);
    }

    public void endTrace(String traceId, TraceOutcome outcome, String statusMessage, Object resultData) {
        try {
            Optional<PipelineTrace> found = repo.findTrace(traceId);
            if (found.isEmpty()) {
                Log.debugf("Trace %s not found when ending it; start was probably not persisted", traceId);
                return;
            }
            PipelineTrace trace = found.get();
            trace.setEndedAt(clock.instant());
            trace.setOutcome(outcome);
            trace.setStatusMessage(statusMessage);
            trace.setResultData(snapshot(resultData));
            repo.saveTrace(trace);
        } catch (RuntimeException e) {
            ExceptionLoggingUtils.logBestEffortFailure(e, "Failed to end trace %s", traceId);
        }
    }

    /**
     * Delete spans created before {@code cutoff}, then traces started before it that
     * have no spans left.
     */
    public CleanupResult cleanup(Instant cutoff) {
        long spans = repo.deleteSpansCreatedBefore(cutoff);
        long traces = repo.deleteOrphanTracesStartedBefore(cutoff);
        Log.infof("Trace cleanup before %s removed %d spans and %d traces", cutoff, spans, traces);
        return new CleanupResult(spans, traces);
    }

    /**
     * Cleanup using the configured retention window.
     */
    public CleanupResult cleanup() {
        return cleanup(clock.instant().minus(config.trace().retention()));
    }

    public Optional<PipelineTrace> findTrace(String traceId) {
        return repo.findTrace(traceId);
    }

    public List<PipelineSpan> findSpans(String traceId) {
        return repo.findSpans(traceId);
    }

    private String snapshot(Object value) {
        return JsonSnapshots.snapshot(objectMapper, value, config.trace().maxPayloadChars());
    }
}
