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

/**
 * Relationship fact: subject (subjectType, subjectId) holds {@code relation} on
 * entity (entityType, entityId). An entityId of {@code *} grants the relation on
 * every entity of the type.
 */
@Data
@NoArgsConstructor
@SuperBuilder
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@Entity(value = "authz_tuples", useDiscriminator = false)
@Indexes({
    @Index(options = @IndexOptions(name = "uniq_tuple", unique = true),
           fields = {
               @Field("entityType"),
               @Field("entityId"),
               @Field("relation"),
               @Field("subjectType"),
               @Field("subjectId")
           }),
    @Index(options = @IndexOptions(name = "idx_tuple_subject"),
           fields = {@Field("subjectType"), @Field("subjectId")}),
    @Index(options = @IndexOptions(name = "idx_tuple_entity_type_id"),
           fields = {@Field("entityTypeId")})
})
public class AccessTuple extends HookBaseModel {

    public static final String WILDCARD = "*";

    @NotBlank
    private String entityType;

    /** Stable id of the authorization model; survives entity type renames. */
    private String entityTypeId;

    @NotBlank
    private String entityId;

    @NotBlank
    private String relation;

    @NotBlank
    private String subjectType;

    @NotBlank
    private String subjectId;

    /** Optional per-grant policy script; the grant only applies when it passes. */
    private String condition;

    public boolean isWildcard() {
        return WILDCARD.equals(entityId);
    }
}
