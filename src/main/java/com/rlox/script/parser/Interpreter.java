package com.rlox.script.parser;

import java.io.PrintStream;
import java.util.List;

import com.rlox.script.parser.Expr.Binary;
import com.rlox.script.parser.Expr.ExprVisitor;
import com.rlox.script.parser.Expr.Grouping;
import com.rlox.script.parser.Expr.Literal;
import com.rlox.script.parser.Expr.Unary;
import com.rlox.script.parser.Expr.Variable;
import com.rlox.script.parser.Statement.ExprStmt;
import com.rlox.script.parser.Statement.PrintStmt;
import com.rlox.script.parser.Statement.Stmt;
import com.rlox.script.parser.Statement.StmtVisitor;
import com.rlox.script.parser.Statement.VarStmt;

/**
 * Tree-walking evaluator. The first {@link RuntimeError} aborts {@link #execute(List)};
 * statements after it do not run.
 *
 * <p>Equality never fails: values of different variants are simply unequal.
 * Division by zero is plain IEEE arithmetic and yields Infinity or NaN.
 */
public class Interpreter implements ExprVisitor<Value>, StmtVisitor {
    private final Environment env;
    private final PrintStream out;

    public Interpreter(Environment env, PrintStream out) {
        if (env == null) throw new IllegalArgumentException("env must not be null");
        if (out == null) throw new IllegalArgumentException("out must not be null");
        this.env = env;
        this.out = out;
    }

    public void execute(List<Stmt> program) {
        for (Stmt stmt : program) stmt.accept(this);
    }

    public Value evaluate(Expr.ExprInterface expr) {
        return expr.accept(this);
    }

    public void visitExprStmt(ExprStmt stmt) { evaluate(stmt.expression); }

    public void visitPrintStmt(PrintStmt stmt) {
        Value value = evaluate(stmt.expression);
        out.println(value.display());
    }

    public void visitVarStmt(VarStmt stmt) {
        Value value = evaluate(stmt.initializer);
        env.define(stmt.name.lexeme, value);
    }

    public Value visitBinaryExpr(Binary expr) {
        Value left = evaluate(expr.left);
        Value right = evaluate(expr.right);
        Token op = expr.operator;

        switch (op.type) {
            case PLUS:
                if (left.getType() == Value.Type.NUMBER && right.getType() == Value.Type.NUMBER) {
                    return Value.number(left.asNumber() + right.asNumber());
                }
                if (left.getType() == Value.Type.STRING && right.getType() == Value.Type.STRING) {
                    return Value.string(left.asString() + right.asString());
                }
                throw RuntimeError.typeMismatch(op, "Operands must be two numbers or two strings.");
            case MINUS:
                requireNumbers(op, left, right);
                return Value.number(left.asNumber() - right.asNumber());
            case STAR:
                requireNumbers(op, left, right);
                return Value.number(left.asNumber() * right.asNumber());
            case SLASH:
                requireNumbers(op, left, right);
                return Value.number(left.asNumber() / right.asNumber());

            case GREATER:
                requireNumbers(op, left, right);
                return Value.bool(left.asNumber() > right.asNumber());
            case GREATER_EQUAL:
                requireNumbers(op, left, right);
                return Value.bool(left.asNumber() >= right.asNumber());
            case LESS:
                requireNumbers(op, left, right);
                return Value.bool(left.asNumber() < right.asNumber());
            case LESS_EQUAL:
                requireNumbers(op, left, right);
                return Value.bool(left.asNumber() <= right.asNumber());

            case EQUAL_EQUAL:
                return Value.bool(isEqual(left, right));
            case BANG_EQUAL:
                return Value.bool(!isEqual(left, right));

            default:
                // Expr.Binary admits only the operators above.
                throw new IllegalStateException("Unsupported binary operator: " + op.type);
        }
    }

    public Value visitUnaryExpr(Unary expr) {
        Value right = evaluate(expr.right);
        switch (expr.operator.type) {
            case BANG:
                return Value.bool(!isTruthy(right));
            case MINUS:
                if (right.getType() != Value.Type.NUMBER) {
                    throw RuntimeError.typeMismatch(expr.operator, "Operand must be a number.");
                }
                return Value.number(-right.asNumber());
            default:
                // Expr.Unary admits only '!' and '-'.
                throw new IllegalStateException("Unsupported unary operator: " + expr.operator.type);
        }
    }

    public Value visitLiteralExpr(Literal expr) {
        return expr.value;
    }

    public Value visitGroupingExpr(Grouping expr) {
        return evaluate(expr.expression);
    }

    public Value visitVariableExpr(Variable expr) {
        return env.get(expr.name);
    }

    /** nil and false are falsy; everything else, including 0 and "", is truthy. */
    public static boolean isTruthy(Value v) {
        return switch (v.getType()) {
            case NIL -> false;
            case BOOL -> v.asBool();
            case NUMBER, STRING -> true;
        };
    }

    static boolean isEqual(Value left, Value right) {
        return left.sameAs(right);
    }

    private static void requireNumbers(Token op, Value left, Value right) {
        if (left.getType() == Value.Type.NUMBER && right.getType() == Value.Type.NUMBER) return;
        throw RuntimeError.typeMismatch(op, "Operands must be numbers.");
    }
}
