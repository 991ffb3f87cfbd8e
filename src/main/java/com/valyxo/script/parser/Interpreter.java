package com.valyxo.script.parser;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.valyxo.script.parser.Expr.ExprInterface;
import com.valyxo.script.parser.Statement.CallStmt;
import com.valyxo.script.parser.Statement.ExitStmt;
import com.valyxo.script.parser.Statement.ForStmt;
import com.valyxo.script.parser.Statement.FuncDefStmt;
import com.valyxo.script.parser.Statement.IfStmt;
import com.valyxo.script.parser.Statement.PrintStmt;
import com.valyxo.script.parser.Statement.SetStmt;
import com.valyxo.script.parser.Statement.Stmt;
import com.valyxo.script.parser.Statement.StmtVisitor;
import com.valyxo.script.parser.Statement.VarsStmt;
import com.valyxo.script.parser.Statement.WhileStmt;

/**
 * Statement dispatcher. Drives the environment, the function registry and the evaluator of one
 * {@link RuntimeState}; every loop step is counted against the state's limits.
 */
public class Interpreter implements StmtVisitor {

    /** Unwinds the current execution after 'exit'. */
    static final class ExitSignal extends RuntimeException {
        private static final long serialVersionUID = 1L;

        ExitSignal() {
            super(null, null, false, false);
        }
    }

    private final RuntimeState state;
    private final Environment env;
    private final Evaluator evaluator;
    private int callDepth = 0;

    public Interpreter(RuntimeState state) {
        this.state = state;
        this.env = state.environment();
        this.evaluator = new Evaluator(env, state.limits());
    }

    Environment environment() {
        return env;
    }

    /**
     * Executes top-level statements.
     *
     * @return false if an 'exit' statement stopped the run
     */
    public boolean run(List<Stmt> program) {
        try {
            execute(program);
            return true;
        } catch (ExitSignal exit) {
            state.markExited();
            return false;
        }
    }

    void execute(List<Stmt> statements) {
        for (Stmt s : statements) {
            try {
                s.accept(this);
            } catch (ScriptError e) {
                throw e.at(s.line(), s.source());
            }
        }
    }

    private Value eval(ExprInterface expr) {
        return evaluator.eval(expr);
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public void visitSetStmt(SetStmt stmt) {
        Value value = eval(stmt.expr);
        env.assign(stmt.target.lexeme, value);
    }

    @Override
    public void visitPrintStmt(PrintStmt stmt) {
        List<String> parts = new ArrayList<>(stmt.exprs.size());
        for (ExprInterface e : stmt.exprs) parts.add(eval(e).display());
        state.appendOutput(String.join(" ", parts));
    }

    @Override
    public void visitIfStmt(IfStmt stmt) {
        if (Evaluator.isTruthy(eval(stmt.condition))) {
            execute(stmt.thenBlock);
        } else if (stmt.elseBlock != null) {
            execute(stmt.elseBlock);
        }
    }

    @Override
    public void visitForStmt(ForStmt stmt) {
        BigInteger start = loopBound(eval(stmt.rangeStart), "start", stmt);
        BigInteger end = loopBound(eval(stmt.rangeEnd), "end", stmt);
        String var = stmt.var.lexeme;

        int iterations = 0;
        // inclusive of both bounds; start > end runs zero times
        for (BigInteger i = start; i.compareTo(end) <= 0; i = i.add(BigInteger.ONE)) {
            iterations = step(iterations, stmt);
            env.define(var, Value.integer(i));
            execute(stmt.body);
        }
    }

    private BigInteger loopBound(Value v, String which, ForStmt stmt) {
        if (v.type != Value.Type.INT) {
            throw new ScriptError(ErrorKind.TYPE_ERROR, stmt.line(), stmt.source(),
                    "for-loop " + which + " must be an int, got " + v.typeName(), null);
        }
        return v.asInteger();
    }

    @Override
    public void visitWhileStmt(WhileStmt stmt) {
        int iterations = 0;
        while (Evaluator.isTruthy(eval(stmt.condition))) {
            iterations = step(iterations, stmt);
            execute(stmt.body);
        }
    }

    private int step(int iterations, Stmt loop) {
        int max = state.limits().maxIterations;
        if (iterations >= max) {
            throw new ScriptError(ErrorKind.LOOP_LIMIT_EXCEEDED, loop.line(), loop.source(),
                    "Loop iteration limit exceeded (" + max + ") - possible infinite loop",
                    "Check that the loop condition eventually becomes false");
        }
        state.countIteration(loop.line(), loop.source());
        return iterations + 1;
    }

    @Override
    public void visitFuncDefStmt(FuncDefStmt stmt) {
        state.registry().define(new UserFunction(stmt.name.lexeme, stmt.params, stmt.body, stmt.line()));
    }

    @Override
    public void visitCallStmt(CallStmt stmt) {
        UserFunction fn = state.registry().lookup(stmt.name.lexeme);

        List<Value> args = new ArrayList<>(stmt.args.size());
        for (ExprInterface a : stmt.args) args.add(eval(a));

        int max = state.limits().maxCallDepth;
        if (callDepth >= max) {
            throw new ScriptError(ErrorKind.RESOURCE_LIMIT_EXCEEDED, stmt.line(), stmt.source(),
                    "Maximum call depth (" + max + ") exceeded calling " + fn.name + "()",
                    "Check for unbounded recursion");
        }

        callDepth++;
        try {
            fn.call(this, args);
        } finally {
            callDepth--;
        }
    }

    @Override
    public void visitVarsStmt(VarsStmt stmt) {
        for (Map.Entry<String, Value> e : env.visible().entrySet()) {
            state.appendOutput(e.getKey() + " = " + e.getValue().display());
        }
    }

    @Override
    public void visitExitStmt(ExitStmt stmt) {
        throw new ExitSignal();
    }
}
