package com.valyxo.script.parser;

import java.util.List;

public class Statement {

    public interface Stmt {
        void accept(StmtVisitor visitor);

        /** 1-based line of the statement's first token. */
        int line();

        /** Source text of that line, for diagnostics. */
        String source();
    }

    public interface StmtVisitor {
        void visitSetStmt(SetStmt stmt);
        void visitPrintStmt(PrintStmt stmt);
        void visitIfStmt(IfStmt stmt);
        void visitForStmt(ForStmt stmt);
        void visitWhileStmt(WhileStmt stmt);
        void visitFuncDefStmt(FuncDefStmt stmt);
        void visitCallStmt(CallStmt stmt);
        void visitVarsStmt(VarsStmt stmt);
        void visitExitStmt(ExitStmt stmt);
    }

    abstract static class Positioned implements Stmt {
        private final int line;
        private final String source;

        Positioned(int line, String source) {
            this.line = line;
            this.source = source;
        }

        @Override public int line() { return line; }
        @Override public String source() { return source; }
    }

    public static final class SetStmt extends Positioned {
        public final Token target;
        public final Expr.ExprInterface expr;

        SetStmt(int line, String source, Token target, Expr.ExprInterface expr) {
            super(line, source);
            this.target = target;
            this.expr = expr;
        }

        public void accept(StmtVisitor visitor) { visitor.visitSetStmt(this); }
    }

    public static final class PrintStmt extends Positioned {
        public final List<Expr.ExprInterface> exprs;

        PrintStmt(int line, String source, List<Expr.ExprInterface> exprs) {
            super(line, source);
            this.exprs = exprs;
        }

        public void accept(StmtVisitor visitor) { visitor.visitPrintStmt(this); }
    }

    public static final class IfStmt extends Positioned {
        public final Expr.ExprInterface condition;
        public final List<Stmt> thenBlock;
        public final List<Stmt> elseBlock; // may be null

        IfStmt(int line, String source, Expr.ExprInterface condition, List<Stmt> thenBlock, List<Stmt> elseBlock) {
            super(line, source);
            this.condition = condition;
            this.thenBlock = thenBlock;
            this.elseBlock = elseBlock;
        }

        public void accept(StmtVisitor visitor) { visitor.visitIfStmt(this); }
    }

    /** for var in start to end { ... }, both bounds inclusive. */
    public static final class ForStmt extends Positioned {
        public final Token var;
        public final Expr.ExprInterface rangeStart;
        public final Expr.ExprInterface rangeEnd;
        public final List<Stmt> body;

        ForStmt(int line, String source, Token var, Expr.ExprInterface rangeStart, Expr.ExprInterface rangeEnd, List<Stmt> body) {
            super(line, source);
            this.var = var;
            this.rangeStart = rangeStart;
            this.rangeEnd = rangeEnd;
            this.body = body;
        }

        public void accept(StmtVisitor visitor) { visitor.visitForStmt(this); }
    }

    public static final class WhileStmt extends Positioned {
        public final Expr.ExprInterface condition;
        public final List<Stmt> body;

        WhileStmt(int line, String source, Expr.ExprInterface condition, List<Stmt> body) {
            super(line, source);
            this.condition = condition;
            this.body = body;
        }

        public void accept(StmtVisitor visitor) { visitor.visitWhileStmt(this); }
    }

    public static final class FuncDefStmt extends Positioned {
        public final Token name;
        public final List<Token> params;
        public final List<Stmt> body;

        FuncDefStmt(int line, String source, Token name, List<Token> params, List<Stmt> body) {
            super(line, source);
            this.name = name;
            this.params = params;
            this.body = body;
        }

        public void accept(StmtVisitor visitor) { visitor.visitFuncDefStmt(this); }
    }

    public static final class CallStmt extends Positioned {
        public final Token name;
        public final List<Expr.ExprInterface> args;

        CallStmt(int line, String source, Token name, List<Expr.ExprInterface> args) {
            super(line, source);
            this.name = name;
            this.args = args;
        }

        public void accept(StmtVisitor visitor) { visitor.visitCallStmt(this); }
    }

    public static final class VarsStmt extends Positioned {
        VarsStmt(int line, String source) { super(line, source); }
        public void accept(StmtVisitor visitor) { visitor.visitVarsStmt(this); }
    }

    public static final class ExitStmt extends Positioned {
        ExitStmt(int line, String source) { super(line, source); }
        public void accept(StmtVisitor visitor) { visitor.visitExitStmt(this); }
    }
}
