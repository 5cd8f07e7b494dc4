package com.rlox.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import com.rlox.script.parser.Expr.Binary;
import com.rlox.script.parser.Expr.Grouping;
import com.rlox.script.parser.Expr.Literal;
import com.rlox.script.parser.Expr.Unary;
import com.rlox.script.parser.Expr.Variable;
import com.rlox.script.parser.Statement.ExprStmt;
import com.rlox.script.parser.Statement.PrintStmt;
import com.rlox.script.parser.Statement.Stmt;
import com.rlox.script.parser.Statement.VarStmt;

/**
 * Recursive-descent parser. Each binary precedence level folds its operands in a loop,
 * which makes them left-associative; unary recurses on itself and is right-associative.
 *
 * <pre>
 * program     -> declaration* EOF
 * declaration -> varDecl | statement
 * varDecl     -> "var" IDENTIFIER ( "=" expression )? ";"
 * statement   -> printStmt | exprStmt
 * expression  -> equality
 * equality    -> comparison ( ( "==" | "!=" ) comparison )*
 * comparison  -> term ( ( ">" | ">=" | "<" | "<=" ) term )*
 * term        -> factor ( ( "+" | "-" ) factor )*
 * factor      -> unary ( ( "*" | "/" ) unary )*
 * unary       -> ( "!" | "-" ) unary | primary
 * primary     -> NUMBER | STRING | "true" | "false" | "nil" | IDENTIFIER | "(" expression ")"
 * </pre>
 */
public class Parser {
    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

    // Tokens that begin a declaration or statement; synchronization stops in front of them.
    private static final Set<TokenType> STATEMENT_STARTS = Collections.unmodifiableSet(EnumSet.of(
            TokenType.CLASS, TokenType.FUN, TokenType.VAR, TokenType.FOR,
            TokenType.IF, TokenType.WHILE, TokenType.PRINT, TokenType.RETURN));

    private static final class ParseError extends RuntimeException {
        private static final long serialVersionUID = 1L;

        ParseError(String message) {
            super(message, null, false, false);
        }
    }

    private final List<Token> tokens;
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final int maxDepth;
    private int current = 0;
    private int depth = 0;

    public Parser(List<Token> tokens) { this(tokens, DEFAULT_MAX_NESTING_DEPTH); }

    public Parser(List<Token> tokens, int maxDepth) {
        if (tokens == null || tokens.isEmpty() || tokens.get(tokens.size() - 1).type != TokenType.EOF) {
            throw new IllegalArgumentException("token stream must end with EOF");
        }
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        this.tokens = tokens;
        this.maxDepth = maxDepth;
    }

    public List<Stmt> parse() {
        List<Stmt> statements = new ArrayList<Stmt>();
        while (!isAtEnd()) {
            Stmt stmt = declaration();
            if (stmt != null) statements.add(stmt);
        }
        return statements;
    }

    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    // A syntax error anywhere below unwinds to here; the statement is dropped and parsing resumes.
    private Stmt declaration() {
        int startedAt = current;
        depth = 0;
        try {
            if (match(TokenType.VAR)) return varDeclaration();
            return statement();
        } catch (ParseError error) {
            synchronize(startedAt);
            return null;
        }
    }

    private Stmt varDeclaration() {
        Token name = consume(TokenType.IDENTIFIER, "Expect variable name.");
        Expr.ExprInterface initializer = new Literal(Value.nil());
        if (match(TokenType.EQUAL)) {
            initializer = expression();
        }
        consume(TokenType.SEMICOLON, "Expect ';' after variable declaration.");
        return new VarStmt(name, initializer);
    }

    private Stmt statement() {
        if (match(TokenType.PRINT)) return printStatement();
        return exprStatement();
    }

    private Stmt printStatement() {
        Expr.ExprInterface value = expression();
        consume(TokenType.SEMICOLON, "Expect ';' after value.");
        return new PrintStmt(value);
    }

    private Stmt exprStatement() {
        Expr.ExprInterface expr = expression();
        consume(TokenType.SEMICOLON, "Expect ';' after expression.");
        return new ExprStmt(expr);
    }

    private Expr.ExprInterface expression() {
        enter();
        try {
            return equality();
        } finally {
            depth--;
        }
    }

    private Expr.ExprInterface equality() {
        Expr.ExprInterface expr = comparison();
        int folded = 0;
        try {
            while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL)) {
                Token op = previous();
                folded++;
                enter();
                Expr.ExprInterface right = comparison();
                expr = new Binary(expr, op, right);
            }
            return expr;
        } finally {
            depth -= folded;
        }
    }

    private Expr.ExprInterface comparison() {
        Expr.ExprInterface expr = term();
        int folded = 0;
        try {
            while (match(TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL)) {
                Token op = previous();
                folded++;
                enter();
                Expr.ExprInterface right = term();
                expr = new Binary(expr, op, right);
            }
            return expr;
        } finally {
            depth -= folded;
        }
    }

    private Expr.ExprInterface term() {
        Expr.ExprInterface expr = factor();
        int folded = 0;
        try {
            while (match(TokenType.PLUS, TokenType.MINUS)) {
                Token op = previous();
                folded++;
                enter();
                Expr.ExprInterface right = factor();
                expr = new Binary(expr, op, right);
            }
            return expr;
        } finally {
            depth -= folded;
        }
    }

    private Expr.ExprInterface factor() {
        Expr.ExprInterface expr = unary();
        int folded = 0;
        try {
            while (match(TokenType.STAR, TokenType.SLASH)) {
                Token op = previous();
                folded++;
                enter();
                Expr.ExprInterface right = unary();
                expr = new Binary(expr, op, right);
            }
            return expr;
        } finally {
            depth -= folded;
        }
    }

    private Expr.ExprInterface unary() {
        if (match(TokenType.BANG, TokenType.MINUS)) {
            Token op = previous();
            enter();
            try {
                Expr.ExprInterface right = unary();
                return new Unary(op, right);
            } finally {
                depth--;
            }
        }
        return primary();
    }

    private Expr.ExprInterface primary() {
        if (match(TokenType.FALSE)) return new Literal(Value.bool(false));
        if (match(TokenType.TRUE)) return new Literal(Value.bool(true));
        if (match(TokenType.NIL)) return new Literal(Value.nil());
        if (match(TokenType.NUMBER, TokenType.STRING)) return new Literal(previous().literal);
        if (match(TokenType.IDENTIFIER)) return new Variable(previous());

        if (match(TokenType.LEFT_PAREN)) {
            Expr.ExprInterface expr = expression();
            consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
            return new Grouping(expr);
        }

        throw error(peek(), "Expect expression.");
    }

    // Each fold deepens the left-leaning tree by one level, so chains count like nesting.
    private void enter() {
        if (++depth > maxDepth) {
            throw error(peek(), "Expression nesting too deep.");
        }
    }

    /*
     * Discard tokens until just past a ';' or in front of a statement keyword.
     * A declaration that failed on its very first token drops that token so the loop always progresses.
     */
    private void synchronize(int startedAt) {
        if (current == startedAt) advance();

        while (!isAtEnd()) {
            if (previous().type == TokenType.SEMICOLON) return;
            if (STATEMENT_STARTS.contains(peek().type)) return;
            advance();
        }
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private ParseError error(Token token, String message) {
        Diagnostic diagnostic = Diagnostic.syntax(token, message);
        diagnostics.add(diagnostic);
        return new ParseError(diagnostic.format());
    }
}
