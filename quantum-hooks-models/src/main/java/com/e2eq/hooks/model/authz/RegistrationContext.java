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

import java.util.ArrayList;
import java.util.List;

/**
 * Named sign-up context (for example an invite link) whose grants are applied to
 * the user created through it.
 */
@Data
@NoArgsConstructor
@SuperBuilder
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@Entity(value = "registration_contexts", useDiscriminator = false)
@Indexes({
    @Index(fields = {@Field("slug")}, options = @IndexOptions(name = "uniq_registration_slug", unique = true))
})
public class RegistrationContext extends HookBaseModel {

    @NotBlank
    private String slug;

    private String name;

    private boolean enabled;

    private List<RegistrationGrant> grants = new ArrayList<>();
}
