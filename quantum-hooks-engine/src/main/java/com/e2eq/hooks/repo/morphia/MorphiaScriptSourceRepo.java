package com.e2eq.hooks.repo.morphia;

import com.e2eq.hooks.model.pipeline.ScriptSource;
import com.e2eq.hooks.repo.ScriptSourceRepo;
import dev.morphia.DeleteOptions;
import dev.morphia.query.FindOptions;
import dev.morphia.query.Sort;
import dev.morphia.query.filters.Filters;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.List;
import java.util.Optional;

@ApplicationScoped
public class MorphiaScriptSourceRepo implements ScriptSourceRepo {

    @Inject
    HookDatastore datastore;

    @Override
    public Optional<ScriptSource> findById(String id) {
        return Optional.ofNullable(datastore.get().find(ScriptSource.class)
                .filter(Filters.eq("_id", id))
                .first());
    }

    @Override
    public List<ScriptSource> findAll() {
        return datastore.get().find(ScriptSource.class)
                .iterator(new FindOptions().sort(Sort.ascending("name")))
                .toList();
    }

    @Override
    public ScriptSource save(ScriptSource script) {
        return datastore.get().save(script);
    }

    @Override
    public boolean delete(String id) {
        return datastore.get().find(ScriptSource.class)
                .filter(Filters.eq("_id", id))
                .delete(new DeleteOptions())
                .getDeletedCount() > 0;
    }
}
