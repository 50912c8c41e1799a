package com.e2eq.hooks.repo.morphia;

import com.e2eq.hooks.model.pipeline.PipelineSecret;
import com.e2eq.hooks.repo.SecretRepo;
import dev.morphia.DeleteOptions;
import dev.morphia.query.FindOptions;
import dev.morphia.query.Sort;
import dev.morphia.query.filters.Filters;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.List;
import java.util.Optional;

@ApplicationScoped
public class MorphiaSecretRepo implements SecretRepo {

    @Inject
    HookDatastore datastore;

    @Override
    public Optional<PipelineSecret> findByName(String name) {
        return Optional.ofNullable(datastore.get().find(PipelineSecret.class)
                .filter(Filters.eq("name", name))
                .first());
    }

    @Override
    public List<PipelineSecret> findAll() {
        return datastore.get().find(PipelineSecret.class)
                .iterator(new FindOptions().sort(Sort.ascending("name")))
                .toList();
    }

    @Override
    public PipelineSecret save(PipelineSecret secret) {
        return datastore.get().save(secret);
    }

    @Override
    public boolean deleteByName(String name) {
        return datastore.get().find(PipelineSecret.class)
                .filter(Filters.eq("name", name))
                .delete(new DeleteOptions())
                .getDeletedCount() > 0;
    }
}
