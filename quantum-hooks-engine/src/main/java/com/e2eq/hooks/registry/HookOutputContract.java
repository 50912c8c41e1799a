package com.e2eq.hooks.registry;

import com.e2eq.hooks.exceptions.SandboxException;
import com.e2eq.hooks.pipeline.ScriptOutcome;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shape a script must return for each execution mode:
 * <ul>
 *   <li>blocking: {@code {allowed: boolean, error?: string, data?: object}}</li>
 *   <li>async: {@code {allowed: true}}</li>
 *   <li>enrichment: {@code {allowed: boolean, data?: object}}</li>
 * </ul>
 * Blocking data is only seen by later scripts of the same dispatch, through
 * {@code context.prev} and {@code context.outputs}.
 */
public enum HookOutputContract {

    BLOCKING {
        @Override
        public ScriptOutcome interpret(Object raw) {
            Map<?, ?> result = requireObject(raw);
            boolean allowed = requireAllowed(result);
            return new ScriptOutcome(allowed, optionalError(result), optionalData(result));
        }
    },

    ASYNC {
        @Override
        public ScriptOutcome interpret(Object raw) {
            Map<?, ?> result = requireObject(raw);
            if (!requireAllowed(result)) {
                throw SandboxException.malformed("async hooks must return allowed: true");
            }
            return ScriptOutcome.allow();
        }
    },

    ENRICHMENT {
        @Override
        public ScriptOutcome interpret(Object raw) {
            Map<?, ?> result = requireObject(raw);
            boolean allowed = requireAllowed(result);
            return new ScriptOutcome(allowed, optionalError(result), optionalData(result));
        }
    };

    /**
     * Validate a script's raw return value.
     *
     * @throws SandboxException with kind MALFORMED_OUTPUT when the value has the wrong shape
     */
    public abstract ScriptOutcome interpret(Object raw);

    private static Map<?, ?> requireObject(Object raw) {
        if (!(raw instanceof Map)) {
            throw SandboxException.malformed("expected an object with an 'allowed' field but got "
                    + (raw == null ? "nothing" : raw.getClass().getSimpleName()));
        }
        return (Map<?, ?>) raw;
    }

    private static boolean requireAllowed(Map<?, ?> result) {
        Object allowed = result.get("allowed");
        if (!(allowed instanceof Boolean)) {
            throw SandboxException.malformed("'allowed' must be a boolean");
        }
        return (Boolean) allowed;
    }

    private static Map<String, Object> optionalData(Map<?, ?> result) {
        Object data = result.get("data");
        if (data != null && !(data instanceof Map)) {
            throw SandboxException.malformed("data must be an object");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        if (data != null) {
            ((Map<?, ?>) data).forEach((k, v) -> copy.put(String.valueOf(k), v));
        }
        return copy;
    }

    private static String optionalError(Map<?, ?> result) {
        Object error = result.get("error");
        if (error == null) {
            return null;
        }
        if (!(error instanceof String)) {
            throw SandboxException.malformed("'error' must be a string");
        }
        return (String) error;
    }
}
