package com.e2eq.hooks.authz;

import com.e2eq.hooks.config.HookEngineConfig;
import com.e2eq.hooks.exceptions.AuthorizationModelException;
import com.e2eq.hooks.model.authz.AccessTuple;
import com.e2eq.hooks.model.authz.PolicyLevel;
import com.e2eq.hooks.repo.TupleRepo;
import com.e2eq.hooks.script.SandboxBridge;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Writes relationship tuples after checking them against the entity type's model.
 */
@ApplicationScoped
public class TupleService {

    private final TupleRepo tupleRepo;
    private final AuthorizationModelService modelService;
    private final SandboxBridge sandbox;
    private final HookEngineConfig config;
    private final Clock clock;

    @Inject
    public TupleService(TupleRepo tupleRepo, AuthorizationModelService modelService, SandboxBridge sandbox,
                        HookEngineConfig config) {
        this(tupleRepo, modelService, sandbox, config, Clock.systemUTC());
    }

    public TupleService(TupleRepo tupleRepo, AuthorizationModelService modelService, SandboxBridge sandbox,
                        HookEngineConfig config, Clock clock) {
        this.tupleRepo = tupleRepo;
        this.modelService = modelService;
        this.sandbox = sandbox;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Grant {@code relation} on the entity to the subject. Granting an existing
     * tuple is a no-op that returns the stored one.
     *
     * @throws AuthorizationModelException when the entity type has no model or the relation is not defined
     */
    public TupleRepo.CreateResult grant(String entityType, String entityId, String relation,
                                        String subjectType, String subjectId) {
        CompiledModel model = modelService.getModel(entityType)
                .orElseThrow(() -> new AuthorizationModelException("No authorization model for entity type '" + entityType + "'"));
        if (!model.hasRelation(relation)) {
            throw new AuthorizationModelException("Relation '" + relation + "' is not defined on entity type '" + entityType + "'");
        }
        if (isBlank(entityId) || isBlank(subjectType) || isBlank(subjectId)) {
            throw new AuthorizationModelException("Tuple requires entityId, subjectType and subjectId");
        }
        AccessTuple tuple = AccessTuple.builder()
                .entityType(entityType)
                .entityTypeId(model.modelId())
                .entityId(entityId)
                .relation(relation)
                .subjectType(subjectType)
                .subjectId(subjectId)
                .build();
        tuple.ensureIdentity(clock.instant());
        TupleRepo.CreateResult result = tupleRepo.createIfNotExists(tuple);
        if (result.created()) {
            Log.debugf("Granted %s on %s:%s to %s:%s", relation, entityType, entityId, subjectType, subjectId);
        }
        return result;
    }

    public boolean revoke(String entityType, String entityId, String relation, String subjectType, String subjectId) {
        boolean deleted = tupleRepo.delete(entityType, entityId, relation, subjectType, subjectId);
        if (deleted) {
            Log.debugf("Revoked %s on %s:%s from %s:%s", relation, entityType, entityId, subjectType, subjectId);
        }
        return deleted;
    }

    /**
     * Attach, replace or (with a null/blank script) remove the condition of a tuple.
     * Every change is versioned.
     */
    public AccessTuple setCondition(String tupleId, String condition, ChangeAuthor author) {
        AccessTuple tuple = tupleRepo.findById(tupleId)
                .orElseThrow(() -> new AuthorizationModelException("Tuple not found: " + tupleId));
        String normalized = isBlank(condition) ? null : condition;
        if (normalized != null) {
            sandbox.checkSyntax(normalized, config.sandbox().maxPolicyScriptSize());
        }
        tuple.setCondition(normalized);
        AccessTuple saved = tupleRepo.save(tuple);
        Instant now = clock.instant();
        modelService.appendVersion(tuple.getEntityType(), tuple.getRelation(), PolicyLevel.TUPLE, tuple.getId(),
                normalized, author, now);
        return saved;
    }

    public List<AccessTuple> listForEntity(String entityType, String entityId) {
        return tupleRepo.findByEntity(entityType, entityId);
    }

    public List<AccessTuple> listForSubject(String subjectType, String subjectId) {
        return tupleRepo.findBySubject(subjectType, subjectId);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
