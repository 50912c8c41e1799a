package com.e2eq.hooks.model.authz;

import dev.morphia.annotations.Entity;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity(useDiscriminator = false)
public class PermissionDefinition {

    public static final String DEFAULT_POLICY_ENGINE = "javascript";

    /** Relation a subject must hold (directly or by inheritance) to be granted the permission. */
    @NotBlank
    private String relation;

    private String description;

    private String policyEngine;

    /** Optional attribute policy evaluated after the relation check passes. */
    private String policy;

    public static PermissionDefinition of(String relation) {
        return PermissionDefinition.builder().relation(relation).build();
    }

    public boolean hasPolicy() {
        return policy != null && !policy.isBlank();
    }
}
