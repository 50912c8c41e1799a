package com.e2eq.hooks.authz;

import com.e2eq.hooks.config.HookEngineConfig;
import com.e2eq.hooks.exceptions.InterpreterPoolExhaustedException;
import com.e2eq.hooks.exceptions.SandboxException;
import com.e2eq.hooks.script.SandboxBridge;
import com.e2eq.hooks.script.ScriptExecution;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Authoring support for policy scripts: syntax checks, static hints, and dry runs.
 */
@ApplicationScoped
public class ScriptValidator {

    private static final Pattern RETURN = Pattern.compile("\\breturn\\b");
    private static final Pattern UNBOUNDED_LOOP = Pattern.compile("while\\s*\\(\\s*true\\s*\\)|for\\s*\\(\\s*;\\s*;\\s*\\)");
    private static final Pattern USES_CONTEXT = Pattern.compile("\\bcontext\\b");

    public record SyntaxCheck(boolean valid, String error) {
    }

    public record PolicyAnalysis(List<String> warnings, List<String> suggestions) {
    }

    /**
     * @param result the value the policy returned, null when it failed
     * @param error failure message, null on success
     */
    public record PolicyTestResult(Object result, long executionTimeMs, String error) {
    }

    private final SandboxBridge sandbox;
    private final PolicyScriptRunner policyRunner;
    private final HookEngineConfig config;

    @Inject
    public ScriptValidator(SandboxBridge sandbox, PolicyScriptRunner policyRunner, HookEngineConfig config) {
        this.sandbox = sandbox;
        this.policyRunner = policyRunner;
        this.config = config;
    }

    public SyntaxCheck validateSyntax(String script) {
        try {
            sandbox.checkSyntax(script, config.sandbox().maxPolicyScriptSize());
            return new SyntaxCheck(true, null);
        } catch (SandboxException e) {
            return new SyntaxCheck(false, e.getMessage());
        }
    }

    public PolicyAnalysis analyzePolicy(String script) {
        List<String> warnings = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();
        String code = script == null ? "" : script;
        if (!RETURN.matcher(code).find()) {
            warnings.add("Policy has no return statement and will always deny");
        }
        if (UNBOUNDED_LOOP.matcher(code).find()) {
            warnings.add("Policy contains an unbounded loop and will hit the execution limit");
        }
        if (!USES_CONTEXT.matcher(code).find()) {
            suggestions.add("Policy never reads context; consider a plain relation instead");
        }
        return new PolicyAnalysis(List.copyOf(warnings), List.copyOf(suggestions));
    }

    /**
     * Run {@code script} against a sample context. Script failures are reported in the
     * result rather than thrown.
     */
    public PolicyTestResult testPolicy(String script, Map<String, Object> context) {
        long start = System.currentTimeMillis();
        try {
            ScriptExecution execution = policyRunner.run(script, context == null ? Map.of() : context, "test");
            return new PolicyTestResult(execution.result(), execution.durationMs(), null);
        } catch (SandboxException | InterpreterPoolExhaustedException e) {
            return new PolicyTestResult(null, System.currentTimeMillis() - start, e.getMessage());
        }
    }
}
