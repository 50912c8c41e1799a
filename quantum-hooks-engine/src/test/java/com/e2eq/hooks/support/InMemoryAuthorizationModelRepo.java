package com.e2eq.hooks.support;

import com.e2eq.hooks.model.authz.AuthorizationModel;
import com.e2eq.hooks.repo.AuthorizationModelRepo;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryAuthorizationModelRepo implements AuthorizationModelRepo {

    private final Map<String, AuthorizationModel> byId = new ConcurrentHashMap<>();

    @Override
    public Optional<AuthorizationModel> findByEntityType(String entityType) {
        return byId.values().stream().filter(m -> entityType.equals(m.getEntityType())).findFirst();
    }

    @Override
    public Optional<AuthorizationModel> findById(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(byId.get(id));
    }

    @Override
    public List<AuthorizationModel> findAll() {
        return new ArrayList<>(byId.values());
    }

    @Override
    public AuthorizationModel save(AuthorizationModel model) {
        byId.put(model.getId(), model);
        return model;
    }

    @Override
    public boolean delete(String id) {
        return byId.remove(id) != null;
    }
}
