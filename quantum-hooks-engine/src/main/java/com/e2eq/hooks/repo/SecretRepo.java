package com.e2eq.hooks.repo;

import com.e2eq.hooks.model.pipeline.PipelineSecret;

import java.util.List;
import java.util.Optional;

public interface SecretRepo {

    Optional<PipelineSecret> findByName(String name);

    List<PipelineSecret> findAll();

    PipelineSecret save(PipelineSecret secret);

    boolean deleteByName(String name);
}
