package com.rlox.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Single-pass scanner. Lexical errors are recorded as diagnostics and never stop the scan;
 * the resulting list always ends with exactly one EOF token.
 */
public class Lexer {
    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("and", TokenType.AND);
        map.put("class", TokenType.CLASS);
        map.put("else", TokenType.ELSE);
        map.put("false", TokenType.FALSE);
        map.put("for", TokenType.FOR);
        map.put("fun", TokenType.FUN);
        map.put("if", TokenType.IF);
        map.put("nil", TokenType.NIL);
        map.put("or", TokenType.OR);
        map.put("print", TokenType.PRINT);
        map.put("return", TokenType.RETURN);
        map.put("super", TokenType.SUPER);
        map.put("this", TokenType.THIS);
        map.put("true", TokenType.TRUE);
        map.put("var", TokenType.VAR);
        map.put("while", TokenType.WHILE);
        keywords = Collections.unmodifiableMap(map);
    }

    public Lexer(String source) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        this.source = source;
    }

    /** Reserved word for {@code text}, or null when it is a plain identifier. */
    public static TokenType keyword(String text) {
        return keywords.get(text);
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, line));
        return Collections.unmodifiableList(tokens);
    }

    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case ',': addToken(TokenType.COMMA); break;
            case '.': addToken(TokenType.DOT); break;
            case '-': addToken(TokenType.MINUS); break;
            case '+': addToken(TokenType.PLUS); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '*': addToken(TokenType.STAR); break;
            case '/':
                if (match('/')) {
                    while (!isAtEnd() && peek() != '\n') advance();
                } else if (match('*')) {
                    blockComment();
                } else {
                    addToken(TokenType.SLASH);
                }
                break;
            case '!': addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG); break;
            case '=': addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL); break;
            case '<': addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS); break;
            case '>': addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER); break;
            case ' ': case '\r': case '\t':
                break;
            case '\n':
                break;
            case '"':
                string();
                break;
            default:
                if (isDigit(c)) number();
                else if (isAlpha(c)) identifier();
                else error("Unexpected character: " + c);
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        addToken(type);
    }

    private void number() {
        while (isDigit(peek())) advance();
        // A '.' without a digit after it stays behind and becomes a DOT token.
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
        }
        double value = Double.parseDouble(source.substring(start, current));
        addToken(TokenType.NUMBER, Value.number(value));
    }

    private void string() {
        while (!isAtEnd() && peek() != '"') {
            advance();
        }
        if (isAtEnd()) {
            error("Unterminated string.");
            return;
        }
        advance();
        String value = source.substring(start + 1, current - 1);
        addToken(TokenType.STRING, Value.string(value));
    }

    // Block comments nest: /* a /* b */ c */ is one comment.
    private void blockComment() {
        int depth = 1;
        while (!isAtEnd()) {
            char c = advance();
            if (c == '*' && peek() == '/') {
                advance();
                if (--depth == 0) return;
            } else if (c == '/' && peek() == '*') {
                advance();
                depth++;
            }
        }
        error("Unterminated comment.");
    }

    private boolean isAtEnd() { return current >= source.length(); }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') line++;
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }
    private char peekNext() { return (current + 1 >= source.length()) ? '\0' : source.charAt(current + 1); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Value literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, line));
    }

    private void error(String msg) {
        diagnostics.add(Diagnostic.lexical(line, msg));
    }
}
