package com.e2eq.hooks.authz;

import com.e2eq.hooks.config.HookEngineConfig;
import com.e2eq.hooks.exceptions.AuthorizationModelException;
import com.e2eq.hooks.model.authz.AuthorizationModel;
import com.e2eq.hooks.model.authz.PermissionDefinition;
import com.e2eq.hooks.model.authz.PolicyLevel;
import com.e2eq.hooks.model.authz.PolicyVersion;
import com.e2eq.hooks.repo.AuthorizationModelRepo;
import com.e2eq.hooks.repo.PolicyVersionRepo;
import com.e2eq.hooks.repo.RegistrationContextRepo;
import com.e2eq.hooks.repo.TupleRepo;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reads and writes authorization models.
 * <p>
 * Writes are validated (reference integrity, acyclic inheritance, policy limits),
 * checked against existing tuples and registration grants, versioned when a policy
 * script changes, and compiled into a relation closure that is cached until the next
 * write. Entity types without a stored model fall back to the built-in system models.
 */
@ApplicationScoped
public class AuthorizationModelService {

    private final AuthorizationModelRepo modelRepo;
    private final TupleRepo tupleRepo;
    private final PolicyVersionRepo versionRepo;
    private final RegistrationContextRepo registrationRepo;
    private final HookEngineConfig config;
    private final Clock clock;

    private final Map<String, CompiledModel> cache = new ConcurrentHashMap<>();
    private final Map<String, CompiledModel> systemModels = new ConcurrentHashMap<>();

    @Inject
    public AuthorizationModelService(AuthorizationModelRepo modelRepo,
                                     TupleRepo tupleRepo,
                                     PolicyVersionRepo versionRepo,
                                     RegistrationContextRepo registrationRepo,
                                     HookEngineConfig config) {
        this(modelRepo, tupleRepo, versionRepo, registrationRepo, config, Clock.systemUTC());
    }

    public AuthorizationModelService(AuthorizationModelRepo modelRepo,
                                     TupleRepo tupleRepo,
                                     PolicyVersionRepo versionRepo,
                                     RegistrationContextRepo registrationRepo,
                                     HookEngineConfig config,
                                     Clock clock) {
        this.modelRepo = modelRepo;
        this.tupleRepo = tupleRepo;
        this.versionRepo = versionRepo;
        this.registrationRepo = registrationRepo;
        this.config = config;
        this.clock = clock;
        for (AuthorizationModel m : SystemModels.all()) {
            systemModels.put(m.getEntityType(), CompiledModel.of(m));
        }
    }

    /**
     * The stored model for {@code entityType}, else the system model, else empty.
     */
    public Optional<CompiledModel> getModel(String entityType) {
        if (entityType == null) {
            return Optional.empty();
        }
        // filled atomically so a concurrent write cannot be overwritten by a stale read
        CompiledModel compiled = cache.computeIfAbsent(entityType,
                type -> modelRepo.findByEntityType(type).map(CompiledModel::of).orElse(null));
        if (compiled != null) {
            return Optional.of(compiled);
        }
        return Optional.ofNullable(systemModels.get(entityType));
    }

    public Optional<AuthorizationModel> findById(String modelId) {
        if (modelId != null && modelId.startsWith(SystemModels.ID_PREFIX)) {
            return SystemModels.find(modelId.substring(SystemModels.ID_PREFIX.length()));
        }
        return modelRepo.findById(modelId);
    }

    /**
     * Stored models followed by system models that have no stored override.
     */
    public List<AuthorizationModel> listModels() {
        List<AuthorizationModel> models = new ArrayList<>(modelRepo.findAll());
        Set<String> stored = new HashSet<>();
        models.forEach(m -> stored.add(m.getEntityType()));
        for (AuthorizationModel system : SystemModels.all()) {
            if (!stored.contains(system.getEntityType())) {
                models.add(system);
            }
        }
        return models;
    }

    /**
     * Validate a proposed model against its structure and against the data that
     * depends on the current version.
     */
    public ModelChangeReport preValidateUpdate(String entityType,
                                               Map<String, List<String>> relations,
                                               Map<String, PermissionDefinition> permissions) {
        List<String> errors = new ArrayList<>(AuthorizationModelValidator.validate(entityType, relations, permissions,
                config.sandbox().maxPolicyScriptSize()));
        List<String> warnings = new ArrayList<>();
        Optional<AuthorizationModel> existing = entityType == null ? Optional.empty() : modelRepo.findByEntityType(entityType);
        if (existing.isPresent()) {
            checkDependencySafety(existing.get(), relations == null ? Map.of() : relations,
                    permissions == null ? Map.of() : permissions, errors, warnings);
        }
        return new ModelChangeReport(List.copyOf(errors), List.copyOf(warnings));
    }

    /**
     * Create or replace the model for {@code entityType}.
     *
     * @throws AuthorizationModelException when validation or dependency checks fail
     */
    public AuthorizationModel upsertModel(String entityType,
                                          Map<String, List<String>> relations,
                                          Map<String, PermissionDefinition> permissions,
                                          ChangeAuthor author) {
        ModelChangeReport report = preValidateUpdate(entityType, relations, permissions);
        if (!report.valid()) {
            throw new AuthorizationModelException(report.errors());
        }
        report.warnings().forEach(w -> Log.warnf("Authorization model %s: %s", entityType, w));

        Instant now = clock.instant();
        Optional<AuthorizationModel> existing = modelRepo.findByEntityType(entityType);
        Map<String, PermissionDefinition> previousPermissions = existing
                .map(AuthorizationModel::getPermissions)
                .orElseGet(() -> SystemModels.find(entityType).map(AuthorizationModel::getPermissions).orElse(Map.of()));

        AuthorizationModel model = existing.orElseGet(AuthorizationModel::new);
        model.setEntityType(entityType);
        model.setRelations(new LinkedHashMap<>(relations == null ? Map.of() : relations));
        model.setPermissions(new LinkedHashMap<>(permissions == null ? Map.of() : permissions));
        model.setUpdatedAt(now);
        model.ensureIdentity(now);
        AuthorizationModel saved = modelRepo.save(model);

        recordPolicyChanges(entityType, previousPermissions, saved.getPermissions(), author, now);
        cache.put(entityType, CompiledModel.of(saved));
        Log.infof("%s authorization model %s (%d relations, %d permissions)",
                existing.isPresent() ? "Updated" : "Created", entityType,
                saved.getRelations().size(), saved.getPermissions().size());
        return saved;
    }

    /**
     * Delete a stored model. Refused while tuples or registration grants reference it.
     */
    public boolean deleteModel(String entityType) {
        Optional<AuthorizationModel> existing = modelRepo.findByEntityType(entityType);
        if (existing.isEmpty()) {
            return false;
        }
        long tuples = tupleRepo.countByEntityType(entityType);
        if (tuples > 0) {
            throw new AuthorizationModelException("Cannot delete model '" + entityType + "' because there are "
                    + tuples + " active permission tuples relying on it.");
        }
        AuthorizationModel model = existing.get();
        for (String relation : model.getRelations().keySet()) {
            long grants = registrationRepo.countGrantsUsing(model.getId(), relation);
            if (grants > 0) {
                throw new AuthorizationModelException("Cannot delete model '" + entityType + "' because "
                        + grants + " registration contexts grant relation '" + relation + "'.");
            }
        }
        boolean deleted = modelRepo.delete(model.getId());
        cache.remove(entityType);
        Log.infof("Deleted authorization model %s", entityType);
        return deleted;
    }

    /**
     * Rename the entity type of a stored model, then refresh the entity type name
     * denormalized onto its tuples.
     *
     * @return number of tuples migrated
     */
    public long renameEntityType(String modelId, String newEntityType) {
        AuthorizationModel model = modelRepo.findById(modelId)
                .orElseThrow(() -> new AuthorizationModelException("Authorization model not found: " + modelId));
        String oldEntityType = model.getEntityType();
        if (Objects.equals(oldEntityType, newEntityType)) {
            return 0;
        }
        List<String> errors = AuthorizationModelValidator.validate(newEntityType, model.getRelations(),
                model.getPermissions(), config.sandbox().maxPolicyScriptSize());
        if (modelRepo.findByEntityType(newEntityType).isPresent()) {
            errors.add("Entity type '" + newEntityType + "' already has a model");
        }
        if (!errors.isEmpty()) {
            throw new AuthorizationModelException(errors);
        }
        model.setEntityType(newEntityType);
        model.setUpdatedAt(clock.instant());
        modelRepo.save(model);
        cache.remove(oldEntityType);
        cache.put(newEntityType, CompiledModel.of(model));

        long migrated = migrateTupleEntityType(modelId, newEntityType);
        Log.infof("Renamed authorization model %s to %s; migrated %d tuples", oldEntityType, newEntityType, migrated);
        return migrated;
    }

    /**
     * Refresh denormalized entity type names on the model's tuples. Safe to re-run.
     */
    public long migrateTupleEntityType(String modelId, String entityType) {
        return tupleRepo.updateEntityTypeName(modelId, entityType);
    }

    public void invalidate(String entityType) {
        cache.remove(entityType);
    }

    private void checkDependencySafety(AuthorizationModel current,
                                       Map<String, List<String>> newRelations,
                                       Map<String, PermissionDefinition> newPermissions,
                                       List<String> errors,
                                       List<String> warnings) {
        String entityType = current.getEntityType();
        for (String relation : current.getRelations().keySet()) {
            if (newRelations.containsKey(relation)) {
                continue;
            }
            long tupleCount = tupleRepo.countByRelation(entityType, relation);
            if (tupleCount > 0) {
                errors.add("Cannot remove relation '" + relation + "' from entity '" + entityType + "' because there are "
                        + tupleCount + " active permission tuples relying on it.");
            }
            long grantCount = registrationRepo.countGrantsUsing(current.getId(), relation);
            if (grantCount > 0) {
                errors.add("Cannot remove relation '" + relation + "' from entity '" + entityType + "' because there are "
                        + grantCount + " registration context grants using it.");
            }
        }
        for (String permission : current.getPermissions().keySet()) {
            if (!newPermissions.containsKey(permission)) {
                warnings.add("Permission '" + permission + "' is removed; checks for it will be denied.");
            }
        }
    }

    private void recordPolicyChanges(String entityType,
                                     Map<String, PermissionDefinition> before,
                                     Map<String, PermissionDefinition> after,
                                     ChangeAuthor author,
                                     Instant now) {
        Set<String> names = new HashSet<>(before.keySet());
        names.addAll(after.keySet());
        for (String name : names) {
            String oldPolicy = policyOf(before.get(name));
            String newPolicy = policyOf(after.get(name));
            if (Objects.equals(oldPolicy, newPolicy)) {
                continue;
            }
            appendVersion(entityType, name, PolicyLevel.PERMISSION, null, newPolicy, author, now);
        }
    }

    PolicyVersion appendVersion(String entityType, String permissionName, PolicyLevel level, String tupleId,
                                String script, ChangeAuthor author, Instant now) {
        ChangeAuthor who = author == null ? ChangeAuthor.SYSTEM : author;
        int next = versionRepo.latestVersion(entityType, permissionName, level, tupleId) + 1;
        PolicyVersion version = PolicyVersion.builder()
                .entityType(entityType)
                .permissionName(permissionName)
                .policyLevel(level)
                .tupleId(tupleId)
                .policyScript(script)
                .version(next)
                .changedByType(who.type())
                .changedById(who.id())
                .changeReason(who.reason())
                .build();
        version.ensureIdentity(now);
        Log.debugf("Policy %s.%s (%s) now at version %d", entityType, permissionName, level.wireName(), next);
        return versionRepo.append(version);
    }

    public List<PolicyVersion> policyHistory(String entityType, String permissionName, PolicyLevel level, String tupleId) {
        return versionRepo.findHistory(entityType, permissionName, level, tupleId);
    }

    private static String policyOf(PermissionDefinition def) {
        return def != null && def.hasPolicy() ? def.getPolicy() : null;
    }
}
