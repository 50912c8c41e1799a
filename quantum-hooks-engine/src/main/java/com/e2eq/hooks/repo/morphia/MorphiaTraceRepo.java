package com.e2eq.hooks.repo.morphia;

import com.e2eq.hooks.model.trace.PipelineSpan;
import com.e2eq.hooks.model.trace.PipelineTrace;
import com.e2eq.hooks.repo.TraceRepo;
import dev.morphia.DeleteOptions;
import dev.morphia.query.FindOptions;
import dev.morphia.query.Sort;
import dev.morphia.query.filters.Filters;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@ApplicationScoped
public class MorphiaTraceRepo implements TraceRepo {

    private static final int DELETE_BATCH = 500;

    @Inject
    HookDatastore datastore;

    @Override
    public PipelineTrace saveTrace(PipelineTrace trace) {
        return datastore.get().save(trace);
    }

    @Override
    public Optional<PipelineTrace> findTrace(String traceId) {
        return Optional.ofNullable(datastore.get().find(PipelineTrace.class)
                .filter(Filters.eq("_id", traceId))
                .first());
    }

    @Override
    public List<PipelineTrace> findRecentTraces(String hookName, int limit) {
        return datastore.get().find(PipelineTrace.class)
                .filter(Filters.eq("hookName", hookName))
                .iterator(new FindOptions().sort(Sort.descending("startedAt")).limit(limit))
                .toList();
    }

    @Override
    public PipelineSpan saveSpan(PipelineSpan span) {
        return datastore.get().save(span);
    }

    @Override
    public List<PipelineSpan> findSpans(String traceId) {
        return datastore.get().find(PipelineSpan.class)
                .filter(Filters.eq("traceId", traceId))
                .iterator(new FindOptions().sort(Sort.ascending("startedAt")))
                .toList();
    }

    @Override
    public long deleteSpansCreatedBefore(Instant cutoff) {
        return datastore.get().find(PipelineSpan.class)
                .filter(Filters.lt("createdAt", cutoff))
                .delete(new DeleteOptions().multi(true))
                .getDeletedCount();
    }

    @Override
    public long deleteOrphanTracesStartedBefore(Instant cutoff) {
        List<String> candidates = datastore.get().find(PipelineTrace.class)
                .filter(Filters.lt("startedAt", cutoff))
                .iterator()
                .toList()
                .stream()
                .map(PipelineTrace::getId)
                .collect(Collectors.toList());
        long deleted = 0;
        for (int from = 0; from < candidates.size(); from += DELETE_BATCH) {
            List<String> batch = candidates.subList(from, Math.min(candidates.size(), from + DELETE_BATCH));
            Set<String> withSpans = new HashSet<>();
            datastore.get().find(PipelineSpan.class)
                    .filter(Filters.in("traceId", batch))
                    .iterator()
                    .toList()
                    .forEach(s -> withSpans.add(s.getTraceId()));
            List<String> orphans = batch.stream()
                    .filter(id -> !withSpans.contains(id))
                    .collect(Collectors.toList());
            if (orphans.isEmpty()) {
                continue;
            }
            deleted += datastore.get().find(PipelineTrace.class)
                    .filter(Filters.in("_id", orphans))
                    .delete(new DeleteOptions().multi(true))
                    .getDeletedCount();
        }
        return deleted;
    }
}
