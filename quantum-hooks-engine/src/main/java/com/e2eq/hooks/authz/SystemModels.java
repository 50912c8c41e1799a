package com.e2eq.hooks.authz;

import com.e2eq.hooks.model.authz.AuthorizationModel;
import com.e2eq.hooks.model.authz.PermissionDefinition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Built-in models for platform resources. A stored model with the same entity type
 * takes precedence.
 */
public final class SystemModels {

    public static final String ID_PREFIX = "system:";

    private static final Map<String, AuthorizationModel> MODELS;

    static {
        Map<String, AuthorizationModel> m = new LinkedHashMap<>();
        add(m, "platform",
                rels("super_admin", List.of(), "admin", List.of("super_admin"), "member", List.of("admin")),
                perms("manage_platform", "admin"));
        add(m, "users",
                rels("admin", List.of(), "viewer", List.of("admin")),
                perms("view", "viewer", "create", "admin", "update", "admin", "delete", "admin",
                        "ban", "admin", "impersonate", "admin"));
        add(m, "groups",
                rels("admin", List.of(), "editor", List.of("admin"), "viewer", List.of("editor")),
                perms("view", "viewer", "create", "admin", "update", "editor", "delete", "admin",
                        "manage_members", "admin"));
        add(m, "clients",
                rels("admin", List.of(), "viewer", List.of("admin")),
                perms("view", "viewer", "create", "admin", "update", "admin", "delete", "admin",
                        "manage_access", "admin"));
        add(m, "webhooks",
                rels("editor", List.of(), "viewer", List.of("editor")),
                perms("view", "viewer", "create", "editor", "update", "editor", "delete", "editor", "test", "editor"));
        add(m, "pipelines",
                rels("editor", List.of(), "viewer", List.of("editor")),
                perms("view", "viewer", "create", "editor", "update", "editor", "delete", "editor", "execute", "viewer"));
        add(m, "api_keys",
                rels("admin", List.of()),
                perms("view_all", "admin", "revoke", "admin"));
        add(m, "keys",
                rels("admin", List.of()),
                perms("view", "admin", "rotate", "admin"));
        add(m, "sessions",
                rels("admin", List.of()),
                perms("view_all", "admin", "revoke_all", "admin"));
        MODELS = Collections.unmodifiableMap(m);
    }

    private SystemModels() {
    }

    public static Optional<AuthorizationModel> find(String entityType) {
        return Optional.ofNullable(MODELS.get(entityType));
    }

    public static boolean isSystemType(String entityType) {
        return MODELS.containsKey(entityType);
    }

    public static List<AuthorizationModel> all() {
        return List.copyOf(MODELS.values());
    }

    private static void add(Map<String, AuthorizationModel> m, String entityType,
                            Map<String, List<String>> relations, Map<String, PermissionDefinition> permissions) {
        AuthorizationModel model = AuthorizationModel.builder()
                .id(ID_PREFIX + entityType)
                .entityType(entityType)
                .relations(Collections.unmodifiableMap(relations))
                .permissions(Collections.unmodifiableMap(permissions))
                .system(true)
                .build();
        m.put(entityType, model);
    }

    private static Map<String, List<String>> rels(Object... pairs) {
        Map<String, List<String>> r = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            @SuppressWarnings("unchecked")
            List<String> impliers = (List<String>) pairs[i + 1];
            r.put((String) pairs[i], impliers);
        }
        return r;
    }

    private static Map<String, PermissionDefinition> perms(String... pairs) {
        Map<String, PermissionDefinition> p = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            p.put(pairs[i], PermissionDefinition.of(pairs[i + 1]));
        }
        return p;
    }
}
