package com.e2eq.hooks.model.authz;

import dev.morphia.annotations.Entity;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity(useDiscriminator = false)
public class RegistrationGrant {

    /** Stable id of the authorization model the grant targets. */
    private String entityTypeId;

    private String entityId;

    private String relation;
}
