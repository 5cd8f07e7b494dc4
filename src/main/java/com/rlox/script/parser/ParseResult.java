package com.rlox.script.parser;

import java.util.List;

import com.rlox.script.parser.Statement.Stmt;

/** Statements that parsed cleanly, plus one diagnostic per statement that did not. */
public class ParseResult {
    private final List<Stmt> statements;
    private final List<Diagnostic> diagnostics;

    public ParseResult(List<Stmt> statements, List<Diagnostic> diagnostics) {
        this.statements = List.copyOf(statements);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<Stmt> statements() { return statements; }
    public List<Diagnostic> diagnostics() { return diagnostics; }
    public boolean hadError() { return !diagnostics.isEmpty(); }
}
