package com.e2eq.hooks.authz;

import com.e2eq.hooks.metrics.HookMetrics;
import com.e2eq.hooks.model.authz.AccessTuple;
import com.e2eq.hooks.model.authz.AuditLogEntry;
import com.e2eq.hooks.model.authz.AuditResult;
import com.e2eq.hooks.model.authz.PermissionDefinition;
import com.e2eq.hooks.model.authz.PolicySource;
import com.e2eq.hooks.repo.TupleRepo;
import com.e2eq.hooks.script.PermissionChecker;
import com.e2eq.hooks.util.ExceptionLoggingUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Answers "may subject S perform permission P on entity E".
 * <p>
 * The permission names a required relation; the subject (or any group it belongs to)
 * must hold a tuple on the entity, or on {@code *}, whose relation satisfies it through
 * the model's inheritance closure. A tuple carrying a condition only counts when the
 * condition passes. When the permission defines a policy, the policy must pass as well.
 * Every evaluation writes exactly one audit entry and any internal failure denies.
 */
@ApplicationScoped
public class PermissionEvaluator implements PermissionChecker {

    /** Message callers show for any denial. */
    public static final String NOT_AUTHORIZED = "not authorized";

    static final String GROUP_TYPE = "group";
    static final String MEMBER_RELATION = "member";

    private final AuthorizationModelService modelService;
    private final TupleRepo tupleRepo;
    private final PolicyScriptRunner policyRunner;
    private final AuditLogger auditLogger;
    private final HookMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Inject
    public PermissionEvaluator(AuthorizationModelService modelService,
                               TupleRepo tupleRepo,
                               PolicyScriptRunner policyRunner,
                               AuditLogger auditLogger,
                               HookMetrics metrics,
                               ObjectMapper objectMapper) {
        this(modelService, tupleRepo, policyRunner, auditLogger, metrics, objectMapper, Clock.systemUTC());
    }

    public PermissionEvaluator(AuthorizationModelService modelService,
                               TupleRepo tupleRepo,
                               PolicyScriptRunner policyRunner,
                               AuditLogger auditLogger,
                               HookMetrics metrics,
                               ObjectMapper objectMapper,
                               Clock clock) {
        this.modelService = modelService;
        this.tupleRepo = tupleRepo;
        this.policyRunner = policyRunner;
        this.auditLogger = auditLogger;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public boolean check(String subjectType, String subjectId, String entityType, String entityId, String permission) {
        return checkPermission(subjectType, subjectId, entityType, entityId, permission);
    }

    public boolean checkPermission(String subjectType, String subjectId, String entityType, String entityId,
                                   String permission) {
        return evaluate(PermissionRequest.of(subjectType, subjectId, entityType, entityId, permission)).allowed();
    }

    public boolean checkPermission(String subjectType, String subjectId, String entityType, String entityId,
                                   String permission, Map<String, Object> attributes) {
        return evaluate(PermissionRequest.of(subjectType, subjectId, entityType, entityId, permission)
                .withAttributes(attributes)).allowed();
    }

    /**
     * Evaluate and audit a request. Never throws.
     */
    public PermissionDecision evaluate(PermissionRequest request) {
        long start = System.nanoTime();
        Map<String, Object> context = policyContext(request);
        Evaluation evaluation = new Evaluation();
        PermissionDecision decision;
        try {
            decision = decide(request, context, evaluation);
        } catch (RuntimeException e) {
            ExceptionLoggingUtils.logWarn(e, "Permission check %s on %s:%s failed; denying",
                    request.permission(), request.entityType(), request.entityId());
            decision = PermissionDecision.failed(evaluation.source, ExceptionLoggingUtils.rootMessage(e));
        }
        long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        audit(request, context, evaluation, decision, elapsed);
        metrics.recordPermissionDecision(request.entityType(), decision.result().wireName());
        return decision;
    }

    private PermissionDecision decide(PermissionRequest request, Map<String, Object> context, Evaluation evaluation) {
        if (request.subjectType() == null || request.subjectId() == null
                || request.entityType() == null || request.entityId() == null || request.permission() == null) {
            return PermissionDecision.denied(null);
        }
        Optional<CompiledModel> model = modelService.getModel(request.entityType());
        if (model.isEmpty()) {
            Log.debugf("No authorization model for %s; denying %s", request.entityType(), request.permission());
            return PermissionDecision.denied(null);
        }
        Optional<PermissionDefinition> definition = model.get().permission(request.permission());
        if (definition.isEmpty()) {
            Log.debugf("Permission %s is not defined on %s; denying", request.permission(), request.entityType());
            return PermissionDecision.denied(null);
        }

        Set<String> relations = model.get().satisfying(definition.get().getRelation());
        List<AccessTuple> grants = findGrants(request, relations);
        if (!relationSatisfied(grants, context, evaluation)) {
            return PermissionDecision.denied(evaluation.source);
        }

        PermissionDefinition def = definition.get();
        if (!def.hasPolicy()) {
            return PermissionDecision.allowed(evaluation.source);
        }
        evaluation.source = PolicySource.PERMISSION;
        evaluation.script = def.getPolicy();
        boolean passed = policyRunner.passes(def.getPolicy(), context,
                request.entityType() + "." + request.permission());
        return passed ? PermissionDecision.allowed(PolicySource.PERMISSION) : PermissionDecision.denied(PolicySource.PERMISSION);
    }

    private List<AccessTuple> findGrants(PermissionRequest request, Set<String> relations) {
        List<String> entityIds = List.of(request.entityId(), AccessTuple.WILDCARD);
        List<AccessTuple> grants = new ArrayList<>();
        for (Subject subject : expandSubject(request.subjectType(), request.subjectId())) {
            grants.addAll(tupleRepo.findGrants(request.entityType(), entityIds, relations, subject.type(), subject.id()));
        }
        return grants;
    }

    /**
     * Unconditional grants win outright; conditional ones are tried in order until one passes.
     */
    private boolean relationSatisfied(List<AccessTuple> grants, Map<String, Object> context, Evaluation evaluation) {
        List<AccessTuple> conditional = new ArrayList<>();
        for (AccessTuple t : grants) {
            if (t.getCondition() == null || t.getCondition().isBlank()) {
                return true;
            }
            conditional.add(t);
        }
        for (AccessTuple t : conditional) {
            evaluation.source = PolicySource.TUPLE;
            evaluation.script = t.getCondition();
            Map<String, Object> tupleContext = new LinkedHashMap<>(context);
            tupleContext.put("tuple", Map.of("id", t.getId() == null ? "" : t.getId(),
                    "relation", t.getRelation(), "entityId", t.getEntityId()));
            if (policyRunner.passes(t.getCondition(), tupleContext, "tuple/" + t.getId())) {
                return true;
            }
        }
        return false;
    }

    /**
     * The subject itself plus every group it is a member of, transitively.
     */
    Set<Subject> expandSubject(String subjectType, String subjectId) {
        Set<Subject> seen = new LinkedHashSet<>();
        Deque<Subject> queue = new ArrayDeque<>();
        Subject origin = new Subject(subjectType, subjectId);
        seen.add(origin);
        queue.add(origin);
        while (!queue.isEmpty()) {
            Subject current = queue.poll();
            for (AccessTuple membership : tupleRepo.findBySubjectAndRelation(GROUP_TYPE, MEMBER_RELATION,
                    current.type(), current.id())) {
                Subject group = new Subject(GROUP_TYPE, membership.getEntityId());
                if (seen.add(group)) {
                    queue.add(group);
                }
            }
        }
        return seen;
    }

    private Map<String, Object> policyContext(PermissionRequest request) {
        Map<String, Object> subject = new LinkedHashMap<>();
        subject.put("type", request.subjectType());
        subject.put("id", request.subjectId());
        Map<String, Object> entity = new LinkedHashMap<>();
        entity.put("type", request.entityType());
        entity.put("id", request.entityId());
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("subject", subject);
        context.put("entity", entity);
        context.put("permission", request.permission());
        context.put("attributes", request.attributes());
        context.put("timestamp", clock.millis());
        return context;
    }

    private void audit(PermissionRequest request, Map<String, Object> context, Evaluation evaluation,
                       PermissionDecision decision, long elapsedMs) {
        AuditLogEntry entry = AuditLogEntry.builder()
                .entityType(request.entityType())
                .entityId(request.entityId())
                .permission(request.permission())
                .subjectType(request.subjectType())
                .subjectId(request.subjectId())
                .policySource(evaluation.source)
                .policyScript(evaluation.script)
                .result(decision.result())
                .errorMessage(decision.error())
                .contextSnapshot(snapshot(context))
                .executionTimeMs(elapsedMs)
                .requestIp(request.requestIp())
                .requestUserAgent(request.requestUserAgent())
                .build();
        entry.ensureIdentity(clock.instant());
        auditLogger.record(entry);
        if (decision.result() == AuditResult.ERROR) {
            Log.debugf("Permission %s on %s:%s for %s:%s denied on error: %s", request.permission(),
                    request.entityType(), request.entityId(), request.subjectType(), request.subjectId(), decision.error());
        }
    }

    private String snapshot(Map<String, Object> context) {
        try {
            return objectMapper.writeValueAsString(context);
        } catch (JsonProcessingException e) {
            Log.debugf("Permission context is not serializable: %s", e.getOriginalMessage());
            return null;
        }
    }

    record Subject(String type, String id) {
    }

    private static final class Evaluation {
        PolicySource source;
        String script;
    }
}
