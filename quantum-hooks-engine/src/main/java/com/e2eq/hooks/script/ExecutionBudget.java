package com.e2eq.hooks.script;

import com.e2eq.hooks.config.HookEngineConfig;

import java.time.Duration;

/**
 * Wall-clock and size limits for one script execution. The statement limit is a
 * property of the pool's contexts.
 */
public record ExecutionBudget(Duration timeout, int maxScriptBytes) {

    public static ExecutionBudget forHooks(HookEngineConfig config) {
        return new ExecutionBudget(config.sandbox().hookTimeout(), config.sandbox().maxHookScriptSize());
    }

    public static ExecutionBudget forPolicies(HookEngineConfig config) {
        return new ExecutionBudget(config.sandbox().policyTimeout(), config.sandbox().maxPolicyScriptSize());
    }
}
