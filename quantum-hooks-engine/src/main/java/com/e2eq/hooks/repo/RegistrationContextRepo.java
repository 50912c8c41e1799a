package com.e2eq.hooks.repo;

import com.e2eq.hooks.model.authz.RegistrationContext;

import java.util.Optional;

public interface RegistrationContextRepo {

    Optional<RegistrationContext> findBySlug(String slug);

    RegistrationContext save(RegistrationContext context);

    /**
     * Number of contexts carrying a grant of {@code relation} on the given model.
     */
    long countGrantsUsing(String entityTypeId, String relation);
}
