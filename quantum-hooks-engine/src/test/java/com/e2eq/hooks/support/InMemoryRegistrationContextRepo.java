package com.e2eq.hooks.support;

import com.e2eq.hooks.model.authz.RegistrationContext;
import com.e2eq.hooks.repo.RegistrationContextRepo;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryRegistrationContextRepo implements RegistrationContextRepo {

    private final Map<String, RegistrationContext> bySlug = new ConcurrentHashMap<>();

    @Override
    public Optional<RegistrationContext> findBySlug(String slug) {
        return slug == null ? Optional.empty() : Optional.ofNullable(bySlug.get(slug));
    }

    @Override
    public RegistrationContext save(RegistrationContext context) {
        bySlug.put(context.getSlug(), context);
        return context;
    }

    @Override
    public long countGrantsUsing(String entityTypeId, String relation) {
        return bySlug.values().stream()
                .filter(c -> c.getGrants().stream().anyMatch(g -> entityTypeId.equals(g.getEntityTypeId())
                        && relation.equals(g.getRelation())))
                .count();
    }
}
