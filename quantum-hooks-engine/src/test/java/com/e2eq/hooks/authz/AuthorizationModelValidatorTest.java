package com.e2eq.hooks.authz;

import com.e2eq.hooks.model.authz.PermissionDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class AuthorizationModelValidatorTest {

    private static final Map<String, List<String>> DOCUMENT_RELATIONS = Map.of(
            "owner", List.of(),
            "editor", List.of("owner"),
            "viewer", List.of("editor"));

    @Test
    void documents_model_is_valid() {
        List<String> errors = AuthorizationModelValidator.validate("documents", DOCUMENT_RELATIONS,
                Map.of("read", PermissionDefinition.of("viewer"), "edit", PermissionDefinition.of("editor")), 10240);
        assertTrue(errors.isEmpty(), errors.toString());
    }

    @Test
    void cycle_is_reported() {
        List<String> errors = AuthorizationModelValidator.validate("documents",
                Map.of("a", List.of("b"), "b", List.of("a")), Map.of(), 10240);
        assertTrue(errors.stream().anyMatch(e -> e.startsWith("Cycle detected in relation inheritance")), errors.toString());
    }

    @Test
    void unknown_relation_in_inheritance_is_reported() {
        List<String> errors = AuthorizationModelValidator.validate("documents",
                Map.of("viewer", List.of("editor")), Map.of(), 10240);
        assertEquals(List.of("Unknown relation 'editor' in inheritance of viewer"), errors);
    }

    @Test
    void permission_must_reference_existing_relation() {
        List<String> errors = AuthorizationModelValidator.validate("documents", DOCUMENT_RELATIONS,
                Map.of("delete", PermissionDefinition.of("admin")), 10240);
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).contains("'admin'"));
    }

    @Test
    void policy_engine_and_size_are_checked() {
        PermissionDefinition lua = PermissionDefinition.builder()
                .relation("viewer").policyEngine("lua").policy("return true").build();
        PermissionDefinition huge = PermissionDefinition.builder()
                .relation("viewer").policy("return true; //" + "x".repeat(200)).build();
        List<String> errors = AuthorizationModelValidator.validate("documents", DOCUMENT_RELATIONS,
                Map.of("read", lua, "peek", huge), 100);
        assertEquals(2, errors.size(), errors.toString());
    }

    @Test
    void names_must_be_lower_snake_case() {
        List<String> errors = AuthorizationModelValidator.validate("Documents",
                Map.of("Owner", List.of()), Map.of(), 10240);
        assertEquals(2, errors.size(), errors.toString());
    }
}
