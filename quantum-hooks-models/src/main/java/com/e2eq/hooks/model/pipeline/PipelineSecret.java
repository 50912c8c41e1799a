package com.e2eq.hooks.model.pipeline;

import com.e2eq.hooks.model.base.HookBaseModel;
import dev.morphia.annotations.Entity;
import dev.morphia.annotations.Field;
import dev.morphia.annotations.Index;
import dev.morphia.annotations.IndexOptions;
import dev.morphia.annotations.Indexes;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.time.Instant;

/**
 * Named secret readable by scripts through {@code helpers.secret(name)}. Only the
 * encrypted value is stored; it is never returned to administrators.
 */
@Data
@NoArgsConstructor
@SuperBuilder
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true, exclude = "encryptedValue")
@Entity(value = "pipeline_secrets", useDiscriminator = false)
@Indexes({
    @Index(fields = {@Field("name")}, options = @IndexOptions(name = "uniq_secret_name", unique = true))
})
public class PipelineSecret extends HookBaseModel {

    public static final String NAME_PATTERN = "^[A-Z][A-Z0-9_]*$";

    @NotBlank
    @Pattern(regexp = NAME_PATTERN, message = "secret names must be upper snake case")
    private String name;

    @NotBlank
    private String encryptedValue;

    private String description;

    private Instant updatedAt;
}
