package com.e2eq.hooks.registry;

import com.e2eq.hooks.model.pipeline.ExecutionMode;
import com.e2eq.hooks.model.pipeline.HookGroup;

/**
 * Immutable description of a lifecycle hook.
 *
 * @param name hook name, e.g. {@code before_signup}
 * @param executionMode how bound script results are combined
 * @param group lifecycle group the hook belongs to
 * @param inputType record type the payload is bound to and validated against
 * @param outputContract shape each script must return
 * @param description one-line summary for administrators
 */
public record HookDefinition(String name,
                             ExecutionMode executionMode,
                             HookGroup group,
                             Class<?> inputType,
                             HookOutputContract outputContract,
                             String description) {

    static HookDefinition blocking(String name, HookGroup group, Class<?> inputType, String description) {
        return new HookDefinition(name, ExecutionMode.BLOCKING, group, inputType, HookOutputContract.BLOCKING, description);
    }

    static HookDefinition async(String name, HookGroup group, Class<?> inputType, String description) {
        return new HookDefinition(name, ExecutionMode.ASYNC, group, inputType, HookOutputContract.ASYNC, description);
    }

    static HookDefinition enrichment(String name, HookGroup group, Class<?> inputType, String description) {
        return new HookDefinition(name, ExecutionMode.ENRICHMENT, group, inputType, HookOutputContract.ENRICHMENT, description);
    }
}
