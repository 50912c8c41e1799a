package com.e2eq.hooks.repo.morphia;

import com.e2eq.hooks.model.authz.AuthorizationModel;
import com.e2eq.hooks.repo.AuthorizationModelRepo;
import dev.morphia.DeleteOptions;
import dev.morphia.query.FindOptions;
import dev.morphia.query.Sort;
import dev.morphia.query.filters.Filters;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.List;
import java.util.Optional;

@ApplicationScoped
public class MorphiaAuthorizationModelRepo implements AuthorizationModelRepo {

    @Inject
    HookDatastore datastore;

    @Override
    public Optional<AuthorizationModel> findByEntityType(String entityType) {
        return Optional.ofNullable(datastore.get().find(AuthorizationModel.class)
                .filter(Filters.eq("entityType", entityType))
                .first());
    }

    @Override
    public Optional<AuthorizationModel> findById(String id) {
        return Optional.ofNullable(datastore.get().find(AuthorizationModel.class)
                .filter(Filters.eq("_id", id))
                .first());
    }

    @Override
    public List<AuthorizationModel> findAll() {
        return datastore.get().find(AuthorizationModel.class)
                .iterator(new FindOptions().sort(Sort.ascending("entityType")))
                .toList();
    }

    @Override
    public AuthorizationModel save(AuthorizationModel model) {
        return datastore.get().save(model);
    }

    @Override
    public boolean delete(String id) {
        return datastore.get().find(AuthorizationModel.class)
                .filter(Filters.eq("_id", id))
                .delete(new DeleteOptions())
                .getDeletedCount() > 0;
    }
}
