package com.e2eq.hooks.repo;

import com.e2eq.hooks.model.pipeline.HookBinding;

import java.util.List;
import java.util.Optional;

public interface HookBindingRepo {

    /**
     * All bindings of a hook, enabled or not, in no particular order.
     */
    List<HookBinding> findByHook(String hookName);

    Optional<HookBinding> findById(String id);

    HookBinding save(HookBinding binding);

    boolean delete(String id);

    long deleteByScriptId(String scriptId);
}
