package com.e2eq.hooks.authz;

import com.e2eq.hooks.model.authz.AuthorizationModel;
import com.e2eq.hooks.model.authz.PermissionDefinition;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * An authorization model together with its precomputed relation closure.
 */
public record CompiledModel(AuthorizationModel model, RelationClosure closure) {

    public static CompiledModel of(AuthorizationModel model) {
        return new CompiledModel(model, RelationClosure.compute(model.getRelations()));
    }

    public String entityType() {
        return model.getEntityType();
    }

    public String modelId() {
        return model.getId();
    }

    public boolean isSystem() {
        return model.isSystem();
    }

    public Optional<PermissionDefinition> permission(String name) {
        Map<String, PermissionDefinition> permissions = model.getPermissions();
        return permissions == null ? Optional.empty() : Optional.ofNullable(permissions.get(name));
    }

    public boolean hasRelation(String relation) {
        return model.getRelations() != null && model.getRelations().containsKey(relation);
    }

    public Set<String> satisfying(String relation) {
        return closure.satisfying(relation);
    }
}
