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
 * One record per script execution within a trace, plus one per span a script opens
 * with {@code helpers.trace}. Script spans have no parent.
 */
@Data
@NoArgsConstructor
@SuperBuilder
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@Entity(value = "pipeline_spans", useDiscriminator = false)
@Indexes({
    @Index(fields = {@Field("traceId"), @Field("startedAt")}, options = @IndexOptions(name = "idx_span_trace")),
    @Index(fields = {@Field("createdAt")}, options = @IndexOptions(name = "idx_span_created"))
})
public class PipelineSpan extends HookBaseModel {

    private String traceId;

    private String parentSpanId;

    private String scriptId;

    private String scriptName;

    private int ordinal;

    private SpanStatus status;

    private Instant startedAt;

    private Instant endedAt;

    private long durationMs;

    private String input;

    private String output;

    private String error;

    /** JSON text supplied by the script for its own spans. */
    private String attributes;
}
