package com.e2eq.hooks.authz;

import com.e2eq.hooks.config.HookEngineConfig;
import com.e2eq.hooks.script.ExecutionBudget;
import com.e2eq.hooks.script.SandboxBridge;
import com.e2eq.hooks.script.ScriptExecution;
import com.e2eq.hooks.script.ScriptHelperFactory;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.Map;

/**
 * Runs permission policies and tuple conditions. A policy passes when it returns
 * {@code true} or {@code {allowed: true}}; anything else fails it.
 */
@ApplicationScoped
public class PolicyScriptRunner {

    private final SandboxBridge sandbox;
    private final ScriptHelperFactory helperFactory;
    private final HookEngineConfig config;

    @Inject
    public PolicyScriptRunner(SandboxBridge sandbox, ScriptHelperFactory helperFactory, HookEngineConfig config) {
        this.sandbox = sandbox;
        this.helperFactory = helperFactory;
        this.config = config;
    }

    /**
     * @throws com.e2eq.hooks.exceptions.SandboxException when the script fails to run
     */
    public boolean passes(String script, Map<String, Object> context, String label) {
        ScriptExecution execution = run(script, context, label);
        return isPass(execution.result());
    }

    public ScriptExecution run(String script, Map<String, Object> context, String label) {
        return sandbox.execute(script, context, helperFactory.forPolicy(label), ExecutionBudget.forPolicies(config));
    }

    static boolean isPass(Object result) {
        if (result instanceof Boolean) {
            return (Boolean) result;
        }
        if (result instanceof Map) {
            return Boolean.TRUE.equals(((Map<?, ?>) result).get("allowed"));
        }
        return false;
    }
}
