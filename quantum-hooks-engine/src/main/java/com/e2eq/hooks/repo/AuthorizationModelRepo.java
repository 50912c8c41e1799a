package com.e2eq.hooks.repo;

import com.e2eq.hooks.model.authz.AuthorizationModel;

import java.util.List;
import java.util.Optional;

public interface AuthorizationModelRepo {

    Optional<AuthorizationModel> findByEntityType(String entityType);

    Optional<AuthorizationModel> findById(String id);

    List<AuthorizationModel> findAll();

    AuthorizationModel save(AuthorizationModel model);

    boolean delete(String id);
}
