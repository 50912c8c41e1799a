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

/**
 * Administrator-authored script body. Bindings reference scripts by id only, so
 * renaming or editing a script never breaks the hooks it is wired to.
 */
@Data
@NoArgsConstructor
@SuperBuilder
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true, exclude = "sourceCode")
@Entity(value = "pipeline_scripts", useDiscriminator = false)
@Indexes({
    @Index(fields = {@Field("name")}, options = @IndexOptions(name = "idx_script_name"))
})
public class ScriptSource extends HookBaseModel {

    @NotBlank
    private String name;

    private String description;

    @NotBlank
    private String sourceCode;

    private Instant updatedAt;
}
