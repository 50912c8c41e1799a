package com.e2eq.hooks.model.trace;

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

import java.time.Instant;

/**
 * One record per hook dispatch that had at least one bound script.
 */
@Data
@NoArgsConstructor
@SuperBuilder
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@Entity(value = "pipeline_traces", useDiscriminator = false)
@Indexes({
    @Index(fields = {@Field("startedAt")}, options = @IndexOptions(name = "idx_trace_started")),
    @Index(fields = {@Field("hookName"), @Field("startedAt")}, options = @IndexOptions(name = "idx_trace_hook_started"))
})
public class PipelineTrace extends HookBaseModel {

    private String hookName;

    private String triggerEvent;

    private Instant startedAt;

    private Instant endedAt;

    private TraceOutcome outcome;

    private String statusMessage;

    private String contextSnapshot;

    private String resultData;

    private String userId;

    private String requestIp;
}
