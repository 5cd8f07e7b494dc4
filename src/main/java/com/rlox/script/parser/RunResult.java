package com.rlox.script.parser;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one run: every diagnostic in report order, the runtime error that stopped
 * execution (null when the program ran to the end) and the bindings left behind.
 */
public class RunResult {
    private final List<Diagnostic> diagnostics;
    private final RuntimeError runtimeError;
    private final Map<String, Value> env;

    public RunResult(List<Diagnostic> diagnostics, RuntimeError runtimeError, Map<String, Value> env) {
        this.diagnostics = List.copyOf(diagnostics);
        this.runtimeError = runtimeError;
        this.env = env;
    }

    public List<Diagnostic> diagnostics() { return diagnostics; }
    public RuntimeError runtimeError() { return runtimeError; }
    public Map<String, Value> env() { return env; }

    /** True when scanning or parsing reported anything. */
    public boolean hadError() {
        for (Diagnostic d : diagnostics) {
            if (d.stage() != Diagnostic.Stage.RUNTIME) return true;
        }
        return false;
    }

    public boolean hadRuntimeError() { return runtimeError != null; }

    public boolean ok() { return diagnostics.isEmpty(); }
}
