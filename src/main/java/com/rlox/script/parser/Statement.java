package com.rlox.script.parser;

public class Statement {

    public interface Stmt {
        void accept(StmtVisitor visitor);
    }

    public interface StmtVisitor {
        void visitExprStmt(ExprStmt stmt);
        void visitPrintStmt(PrintStmt stmt);
        void visitVarStmt(VarStmt stmt);
    }

    public static final class ExprStmt implements Stmt {
        public final Expr.ExprInterface expression;
        public ExprStmt(Expr.ExprInterface expression) { this.expression = requireExpr(expression); }
        public void accept(StmtVisitor visitor) { visitor.visitExprStmt(this); }
    }

    public static final class PrintStmt implements Stmt {
        public final Expr.ExprInterface expression;
        public PrintStmt(Expr.ExprInterface expression) { this.expression = requireExpr(expression); }
        public void accept(StmtVisitor visitor) { visitor.visitPrintStmt(this); }
    }

    /** {@code var name = initializer;} where a missing initializer is a nil literal, never null. */
    public static final class VarStmt implements Stmt {
        public final Token name;
        public final Expr.ExprInterface initializer;

        public VarStmt(Token name, Expr.ExprInterface initializer) {
            if (name == null || name.type != TokenType.IDENTIFIER) {
                throw new IllegalArgumentException("var name must be an identifier token");
            }
            this.name = name;
            this.initializer = requireExpr(initializer);
        }

        public void accept(StmtVisitor visitor) { visitor.visitVarStmt(this); }
    }

    private static Expr.ExprInterface requireExpr(Expr.ExprInterface expr) {
        if (expr == null) throw new IllegalArgumentException("statement expression must not be null");
        return expr;
    }
}
