package com.rlox.script.parser;

public class Token {
    public final TokenType type;
    public final String lexeme;
    /** Value for STRING and NUMBER tokens, null for everything else. */
    public final Value literal;
    public final int line;

    public Token(TokenType type, String lexeme, Value literal, int line) {
        if (type == null) throw new IllegalArgumentException("token type must not be null");
        this.type = type;
        this.lexeme = (lexeme == null) ? "" : lexeme;
        this.literal = literal;
        this.line = line;
    }

    @Override
    public String toString() {
        return type + " " + lexeme + " " + (literal == null ? "" : literal.display());
    }
}
