package com.rlox.script.parser;

import java.util.List;

public class ScanResult {
    private final List<Token> tokens;
    private final List<Diagnostic> diagnostics;

    public ScanResult(List<Token> tokens, List<Diagnostic> diagnostics) {
        this.tokens = List.copyOf(tokens);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<Token> tokens() { return tokens; }
    public List<Diagnostic> diagnostics() { return diagnostics; }
    public boolean hadError() { return !diagnostics.isEmpty(); }
}
