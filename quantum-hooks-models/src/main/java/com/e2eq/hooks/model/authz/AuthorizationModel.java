package com.e2eq.hooks.model.authz;

import com.e2eq.hooks.model.base.HookBaseModel;
import dev.morphia.annotations.Entity;
import dev.morphia.annotations.Field;
import dev.morphia.annotations.Index;
import dev.morphia.annotations.IndexOptions;
import dev.morphia.annotations.Indexes;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-entity-type relation and permission model.
 * <p>
 * {@code relations} maps each relation to the relations that imply it, so
 * {@code viewer -> [editor]} and {@code editor -> [owner]} means an owner is also an
 * editor and a viewer. {@code permissions} maps a permission name to the relation it
 * requires plus an optional attribute policy.
 */
@Data
@NoArgsConstructor
@SuperBuilder
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@Entity(value = "authz_models", useDiscriminator = false)
@Indexes({
    @Index(fields = {@Field("entityType")}, options = @IndexOptions(name = "uniq_model_entity_type", unique = true))
})
public class AuthorizationModel extends HookBaseModel {

    @NotBlank
    private String entityType;

    private Map<String, List<String>> relations = new LinkedHashMap<>();

    private Map<String, PermissionDefinition> permissions = new LinkedHashMap<>();

    private Instant updatedAt;

    /** True for the built-in models that apply when no stored model exists. */
    private transient boolean system;
}
