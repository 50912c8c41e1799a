package com.e2eq.hooks.repo.morphia;

import com.e2eq.hooks.model.pipeline.HookBinding;
import com.e2eq.hooks.repo.HookBindingRepo;
import dev.morphia.DeleteOptions;
import dev.morphia.query.FindOptions;
import dev.morphia.query.Sort;
import dev.morphia.query.filters.Filters;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.List;
import java.util.Optional;

@ApplicationScoped
public class MorphiaHookBindingRepo implements HookBindingRepo {

    @Inject
    HookDatastore datastore;

    @Override
    public List<HookBinding> findByHook(String hookName) {
        return datastore.get().find(HookBinding.class)
                .filter(Filters.eq("hookName", hookName))
                .iterator(new FindOptions().sort(Sort.ascending("ordinal"), Sort.ascending("createdAt")))
                .toList();
    }

    @Override
    public Optional<HookBinding> findById(String id) {
        return Optional.ofNullable(datastore.get().find(HookBinding.class)
                .filter(Filters.eq("_id", id))
                .first());
    }

    @Override
    public HookBinding save(HookBinding binding) {
        return datastore.get().save(binding);
    }

    @Override
    public boolean delete(String id) {
        return datastore.get().find(HookBinding.class)
                .filter(Filters.eq("_id", id))
                .delete(new DeleteOptions())
                .getDeletedCount() > 0;
    }

    @Override
    public long deleteByScriptId(String scriptId) {
        return datastore.get().find(HookBinding.class)
                .filter(Filters.eq("scriptId", scriptId))
                .delete(new DeleteOptions().multi(true))
                .getDeletedCount();
    }
}
