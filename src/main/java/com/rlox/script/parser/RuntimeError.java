package com.rlox.script.parser;

/** Evaluation failure. Fatal to the current run: the interpreter does not recover from it. */
public class RuntimeError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public enum Kind { TYPE_MISMATCH, UNDEFINED_VARIABLE }

    private final Kind kind;
    private final transient Token token;

    public RuntimeError(Kind kind, Token token, String message) {
        super(message);
        this.kind = kind;
        this.token = token;
    }

    public static RuntimeError typeMismatch(Token operator, String message) {
        return new RuntimeError(Kind.TYPE_MISMATCH, operator, message);
    }

    public static RuntimeError undefinedVariable(Token name) {
        return new RuntimeError(Kind.UNDEFINED_VARIABLE, name, "Undefined variable '" + name.lexeme + "'.");
    }

    public Kind kind() { return kind; }
    public Token token() { return token; }
    public int line() { return token == null ? 0 : token.line; }
}
