package com.e2eq.hooks.script;

import com.e2eq.hooks.config.HookEngineConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Clock;
import java.util.HashSet;
import java.util.function.UnaryOperator;

/**
 * Builds the helper surface for hook scripts and policy scripts. Policy scripts get
 * the same surface minus {@code checkPermission} and {@code fetch}, and their
 * {@code trace} calls record no spans.
 */
@ApplicationScoped
public class ScriptHelperFactory {

    private final HookEngineConfig config;
    private final SecretResolver secretResolver;
    private final SafeFetch fetcher;
    private final Clock clock;
    private final UnaryOperator<String> envLookup;

    @Inject
    public ScriptHelperFactory(HookEngineConfig config, SecretResolver secretResolver, SafeFetch fetcher) {
        this(config, secretResolver, fetcher, Clock.systemUTC(), System::getenv);
    }

    public ScriptHelperFactory(HookEngineConfig config, SecretResolver secretResolver, SafeFetch fetcher, Clock clock,
                               UnaryOperator<String> envLookup) {
        this.config = config;
        this.secretResolver = secretResolver;
        this.fetcher = fetcher;
        this.clock = clock;
        this.envLookup = envLookup;
    }

    public ScriptHelpers forHook(String hookName, String scriptName, PermissionChecker permissionChecker) {
        return forHook(hookName, scriptName, permissionChecker, null, null);
    }

    /**
     * @param scriptSpanId id of the span recorded for this script execution
     * @param spanSink receiver of the spans opened through {@code helpers.trace}
     */
    public ScriptHelpers forHook(String hookName, String scriptName, PermissionChecker permissionChecker,
                                 String scriptSpanId, CustomSpanSink spanSink) {
        return new ScriptHelpers(hookName + "/" + scriptName, clock,
                new HashSet<>(config.sandbox().allowedEnv()), envLookup, secretResolver, permissionChecker,
                fetcher, scriptSpanId, spanSink);
    }

    public ScriptHelpers forPolicy(String label) {
        return new ScriptHelpers("policy/" + label, clock,
                new HashSet<>(config.sandbox().allowedEnv()), envLookup, secretResolver, null);
    }
}
