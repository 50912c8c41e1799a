package com.e2eq.hooks.repo;

import com.e2eq.hooks.model.pipeline.ScriptSource;

import java.util.List;
import java.util.Optional;

public interface ScriptSourceRepo {

    Optional<ScriptSource> findById(String id);

    List<ScriptSource> findAll();

    ScriptSource save(ScriptSource script);

    boolean delete(String id);
}
