package com.e2eq.hooks.authz;

import com.e2eq.hooks.model.authz.PermissionDefinition;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Structural checks for authorization models: name syntax, reference integrity of
 * relation inheritance and permissions, acyclic inheritance, and policy script limits.
 */
public final class AuthorizationModelValidator {

    private static final Pattern NAME = Pattern.compile("^[a-z][a-z0-9_]*$");

    private AuthorizationModelValidator() {
    }

    /**
     * @return every problem found; empty when the model is valid
     */
    public static List<String> validate(String entityType,
                                        Map<String, List<String>> relations,
                                        Map<String, PermissionDefinition> permissions,
                                        int maxPolicyBytes) {
        List<String> errors = new ArrayList<>();
        if (entityType == null || entityType.isBlank()) {
            errors.add("Entity type is required");
        } else if (!NAME.matcher(entityType).matches()) {
            errors.add("Invalid entity type '" + entityType + "': use lower case letters, digits and underscores");
        }
        Map<String, List<String>> rels = relations == null ? Map.of() : relations;
        Map<String, PermissionDefinition> perms = permissions == null ? Map.of() : permissions;

        for (Map.Entry<String, List<String>> e : rels.entrySet()) {
            String relation = e.getKey();
            require(errors, relation != null && NAME.matcher(relation).matches(),
                    "Invalid relation name '" + relation + "'");
            if (e.getValue() == null) {
                continue;
            }
            for (String implier : e.getValue()) {
                require(errors, rels.containsKey(implier),
                        "Unknown relation '" + implier + "' in inheritance of " + relation);
            }
        }
        detectInheritanceCycles(rels, errors);

        for (Map.Entry<String, PermissionDefinition> e : perms.entrySet()) {
            String permission = e.getKey();
            PermissionDefinition def = e.getValue();
            require(errors, permission != null && NAME.matcher(permission).matches(),
                    "Invalid permission name '" + permission + "'");
            if (def == null || def.getRelation() == null) {
                errors.add("Permission '" + permission + "' must name a relation");
                continue;
            }
            require(errors, rels.containsKey(def.getRelation()),
                    "Unknown relation '" + def.getRelation() + "' required by permission " + permission);
            if (def.hasPolicy()) {
                String engine = def.getPolicyEngine();
                require(errors, engine == null || PermissionDefinition.DEFAULT_POLICY_ENGINE.equals(engine),
                        "Unsupported policy engine '" + engine + "' on permission " + permission);
                int size = def.getPolicy().getBytes(StandardCharsets.UTF_8).length;
                require(errors, maxPolicyBytes <= 0 || size <= maxPolicyBytes,
                        "Policy of permission " + permission + " exceeds " + maxPolicyBytes + " bytes");
            }
        }
        return errors;
    }

    private static void detectInheritanceCycles(Map<String, List<String>> relations, List<String> errors) {
        Set<String> reported = new HashSet<>();
        for (String start : relations.keySet()) {
            Set<String> visited = new HashSet<>();
            Deque<String> stack = new ArrayDeque<>();
            stack.push(start);
            visited.add(start);

            while (!stack.isEmpty()) {
                String current = stack.pop();
                List<String> impliers = relations.get(current);
                if (impliers == null) {
                    continue;
                }
                for (String implier : impliers) {
                    if (implier.equals(start)) {
                        if (reported.add(start)) {
                            errors.add("Cycle detected in relation inheritance involving '" + start + "'");
                        }
                        continue;
                    }
                    if (visited.add(implier)) {
                        stack.push(implier);
                    }
                }
            }
        }
    }

    private static void require(List<String> errors, boolean cond, String msg) {
        if (!cond) {
            errors.add(msg);
        }
    }
}
