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
 * One record per permission evaluation. Written best-effort; a failed write never
 * changes the decision.
 */
@Data
@NoArgsConstructor
@SuperBuilder
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@Entity(value = "authz_audit_log", useDiscriminator = false)
@Indexes({
    @Index(fields = {@Field("entityType"), @Field("entityId")}, options = @IndexOptions(name = "idx_audit_entity")),
    @Index(fields = {@Field("subjectType"), @Field("subjectId")}, options = @IndexOptions(name = "idx_audit_subject")),
    @Index(fields = {@Field("createdAt")}, options = @IndexOptions(name = "idx_audit_created"))
})
public class AuditLogEntry extends HookBaseModel {

    private String entityType;

    private String entityId;

    private String permission;

    private String subjectType;

    private String subjectId;

    private PolicySource policySource;

    private String policyScript;

    private AuditResult result;

    private String errorMessage;

    private String contextSnapshot;

    private long executionTimeMs;

    private String requestIp;

    private String requestUserAgent;
}
