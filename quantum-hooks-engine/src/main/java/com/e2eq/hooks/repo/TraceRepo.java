package com.e2eq.hooks.repo;

import com.e2eq.hooks.model.trace.PipelineSpan;
import com.e2eq.hooks.model.trace.PipelineTrace;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface TraceRepo {

    PipelineTrace saveTrace(PipelineTrace trace);

    Optional<PipelineTrace> findTrace(String traceId);

    List<PipelineTrace> findRecentTraces(String hookName, int limit);

    PipelineSpan saveSpan(PipelineSpan span);

    /**
     * Spans of a trace ordered by start time.
     */
    List<PipelineSpan> findSpans(String traceId);

    long deleteSpansCreatedBefore(Instant cutoff);

    /**
     * Delete traces started before {@code cutoff} that have no spans left.
     */
    long deleteOrphanTracesStartedBefore(Instant cutoff);
}
