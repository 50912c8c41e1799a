package com.e2eq.hooks.script;

import java.util.List;

/**
 * @param result the script's return value as plain Java (Map, List, String, Number, Boolean or null)
 * @param durationMs wall-clock time spent inside the interpreter
 * @param logLines lines written through {@code helpers.log}
 */
public record ScriptExecution(Object result, long durationMs, List<String> logLines) {
}
