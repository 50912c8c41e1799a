package com.e2eq.hooks.repo.morphia;

import com.e2eq.hooks.model.authz.RegistrationContext;
import com.e2eq.hooks.repo.RegistrationContextRepo;
import dev.morphia.query.filters.Filters;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.Optional;

@ApplicationScoped
public class MorphiaRegistrationContextRepo implements RegistrationContextRepo {

    @Inject
    HookDatastore datastore;

    @Override
    public Optional<RegistrationContext> findBySlug(String slug) {
        return Optional.ofNullable(datastore.get().find(RegistrationContext.class)
                .filter(Filters.eq("slug", slug))
                .first());
    }

    @Override
    public RegistrationContext save(RegistrationContext context) {
        return datastore.get().save(context);
    }

    @Override
    public long countGrantsUsing(String entityTypeId, String relation) {
        return datastore.get().find(RegistrationContext.class)
                .filter(Filters.elemMatch("grants",
                        Filters.eq("entityTypeId", entityTypeId),
                        Filters.eq("relation", relation)))
                .count();
    }
}
