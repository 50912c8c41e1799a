package com.e2eq.hooks.pipeline;

import com.e2eq.hooks.trace.TraceMetadata;
import com.e2eq.hooks.util.ExceptionLoggingUtils;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.Map;

/**
 * Adapter used by the identity provider's lifecycle callbacks.
 */
@ApplicationScoped
public class PipelineIntegrator {

    public static final String DEFAULT_BLOCK_MESSAGE = "Blocked by pipeline policy";

    /**
     * @param abort true when the caller must stop the operation
     * @param error message to show; never null when aborting
     */
    public record HookDecision(boolean abort, String error) {

        static final HookDecision PROCEED = new HookDecision(false, null);
    }

    private final PipelineDispatcher dispatcher;

    @Inject
    public PipelineIntegrator(PipelineDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    public HookDecision runBlocking(String hookName, Object input) {
        return runBlocking(hookName, input, TraceMetadata.NONE);
    }

    public HookDecision runBlocking(String hookName, Object input, TraceMetadata metadata) {
        HookResult result = dispatcher.dispatch(hookName, input, metadata);
        if (result.allowed()) {
            return HookDecision.PROCEED;
        }
        String error = result.error() == null || result.error().isBlank() ? DEFAULT_BLOCK_MESSAGE : result.error();
        return new HookDecision(true, error);
    }

    /**
     * Fire an async hook. Failures are logged, never raised.
     */
    public void runAsync(String hookName, Object input) {
        try {
            dispatcher.dispatch(hookName, input);
        } catch (RuntimeException e) {
            ExceptionLoggingUtils.logWarn(e, "Async hook %s could not be dispatched", hookName);
        }
    }

    /**
     * Merge the hook's enrichment data into {@code target} when the hook allows it.
     *
     * @return the decision; {@code target} is untouched when aborting
     */
    public HookDecision runEnrichment(String hookName, Object input, Map<String, Object> target) {
        HookResult result = dispatcher.dispatch(hookName, input);
        if (!result.allowed()) {
            String error = result.error() == null || result.error().isBlank() ? DEFAULT_BLOCK_MESSAGE : result.error();
            return new HookDecision(true, error);
        }
        target.putAll(result.data());
        return HookDecision.PROCEED;
    }
}
