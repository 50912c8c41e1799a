package com.e2eq.hooks.model.pipeline;

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
import java.util.Comparator;

/**
 * Attachment of a script to a named hook at an ordinal position.
 */
@Data
@NoArgsConstructor
@SuperBuilder
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@Entity(value = "pipeline_bindings", useDiscriminator = false)
@Indexes({
    @Index(fields = {@Field("hookName"), @Field("ordinal")}, options = @IndexOptions(name = "idx_binding_hook_ordinal")),
    @Index(fields = {@Field("scriptId")}, options = @IndexOptions(name = "idx_binding_script"))
})
public class HookBinding extends HookBaseModel {

    /** Ascending ordinal; equal ordinals fall back to creation time and then id. */
    public static final Comparator<HookBinding> EXECUTION_ORDER = Comparator
            .comparingInt(HookBinding::getOrdinal)
            .thenComparing(HookBinding::getCreatedAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .thenComparing(HookBinding::getId, Comparator.nullsLast(Comparator.<String>naturalOrder()));

    @NotBlank
    private String hookName;

    @NotBlank
    private String scriptId;

    private int ordinal;

    private boolean enabled;
}
