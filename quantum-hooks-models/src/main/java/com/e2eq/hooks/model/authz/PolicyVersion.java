package com.e2eq.hooks.model.authz;

import com.e2eq.hooks.model.base.HookBaseModel;
import dev.morphia.annotations.Entity;
import dev.morphia.annotations.Field;
import dev.morphia.annotations.Index;
import dev.morphia.annotations.IndexOptions;
import dev.morphia.annotations.Indexes;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * Append-only history of a permission or tuple policy script.
 */
@Data
@NoArgsConstructor
@SuperBuilder
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@Entity(value = "authz_policy_versions", useDiscriminator = false)
@Indexes({
    @Index(options = @IndexOptions(name = "uniq_policy_version", unique = true),
           fields = {
               @Field("entityType"),
               @Field("permissionName"),
               @Field("policyLevel"),
               @Field("tupleId"),
               @Field("version")
           })
})
public class PolicyVersion extends HookBaseModel {

    private String entityType;

    private String permissionName;

    private PolicyLevel policyLevel;

    private String tupleId;

    /** Null when the policy was removed. */
    private String policyScript;

    private int version;

    private String changedByType;

    private String changedById;

    private String changeReason;
}
