package com.rlox.script.parser;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public class Expr {

    // Operators the interpreter evaluates; nodes reject anything else at construction.
    static final Set<TokenType> BINARY_OPERATORS = Collections.unmodifiableSet(EnumSet.of(
            TokenType.PLUS, TokenType.MINUS, TokenType.STAR, TokenType.SLASH,
            TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL,
            TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL));
    static final Set<TokenType> UNARY_OPERATORS = Collections.unmodifiableSet(EnumSet.of(
            TokenType.BANG, TokenType.MINUS));

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitBinaryExpr(Binary expr);
        R visitUnaryExpr(Unary expr);
        R visitLiteralExpr(Literal expr);
        R visitGroupingExpr(Grouping expr);
        R visitVariableExpr(Variable expr);
    }

    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, Token operator, ExprInterface right) {
            this.left = requireChild(left);
            this.operator = requireOperator(operator, BINARY_OPERATORS);
            this.right = requireChild(right);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }
    }

    public static final class Unary implements ExprInterface {
        public final Token operator;
        public final ExprInterface right;

        public Unary(Token operator, ExprInterface right) {
            this.operator = requireOperator(operator, UNARY_OPERATORS);
            this.right = requireChild(right);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }
    }

    public static final class Literal implements ExprInterface {
        public final Value value;

        public Literal(Value value) {
            this.value = (value == null) ? Value.nil() : value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }
    }

    public static final class Grouping implements ExprInterface {
        public final ExprInterface expression;

        public Grouping(ExprInterface expression) {
            this.expression = requireChild(expression);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitGroupingExpr(this);
        }
    }

    public static final class Variable implements ExprInterface {
        public final Token name;

        public Variable(Token name) {
            if (name == null || name.type != TokenType.IDENTIFIER) {
                throw new IllegalArgumentException("Variable name must be an identifier token");
            }
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariableExpr(this);
        }
    }

    private static Token requireOperator(Token operator, Set<TokenType> allowed) {
        if (operator == null || !allowed.contains(operator.type)) {
            throw new IllegalArgumentException("Not an operator for this node: " + operator);
        }
        return operator;
    }

    private static ExprInterface requireChild(ExprInterface child) {
        if (child == null) throw new IllegalArgumentException("child expression must not be null");
        return child;
    }
}
