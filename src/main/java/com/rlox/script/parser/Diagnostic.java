package com.rlox.script.parser;

/**
 * One reported problem with source-line attribution.
 *
 * <p>Rendered as {@code [line 3] Error at ';': Expect expression.}
 */
public final class Diagnostic {

    public enum Stage {
        LEXICAL("lexical"),
        SYNTAX("syntax"),
        RUNTIME("runtime");

        private final String display;

        Stage(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    private final Stage stage;
    private final int line;
    private final String where;
    private final String message;

    public Diagnostic(Stage stage, int line, String where, String message) {
        this.stage = stage;
        this.line = line;
        this.where = (where == null) ? "" : where;
        this.message = message;
    }

    public static Diagnostic lexical(int line, String message) {
        return new Diagnostic(Stage.LEXICAL, line, "", message);
    }

    /** Syntax error located at {@code token}: " at end" for EOF, " at 'lexeme'" otherwise. */
    public static Diagnostic syntax(Token token, String message) {
        String where = (token.type == TokenType.EOF) ? " at end" : " at '" + token.lexeme + "'";
        return new Diagnostic(Stage.SYNTAX, token.line, where, message);
    }

    public static Diagnostic runtime(RuntimeError error) {
        return new Diagnostic(Stage.RUNTIME, error.line(), "", error.getMessage());
    }

    public Stage stage() { return stage; }
    public int line() { return line; }
    public String where() { return where; }
    public String message() { return message; }

    public String format() {
        return "[line " + line + "] Error" + where + ": " + message;
    }

    @Override
    public String toString() {
        return format();
    }
}
