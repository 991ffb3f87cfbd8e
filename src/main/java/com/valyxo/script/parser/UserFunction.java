package com.valyxo.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.valyxo.script.parser.Statement.Stmt;

/** A named procedure: parameters plus a body block. Owned by the {@link FunctionRegistry}. */
public class UserFunction {
    final String name;
    final List<String> params;
    final List<Stmt> body;
    final int line;

    UserFunction(String name, List<Token> params, List<Stmt> body, int line) {
        this.name = name;
        List<String> names = new ArrayList<>(params.size());
        for (Token p : params) names.add(p.lexeme);
        this.params = Collections.unmodifiableList(names);
        this.body = Collections.unmodifiableList(new ArrayList<>(body));
        this.line = line;
    }

    public String name() { return name; }
    public List<String> params() { return params; }
    public int arity() { return params.size(); }

    /** Line of the 'func' keyword. */
    public int line() { return line; }

    /**
     * Runs the body in a fresh frame holding only the parameters.
     * The frame is popped on every exit path.
     */
    void call(Interpreter interpreter, List<Value> args) {
        if (args.size() != params.size()) {
            throw new ScriptError(ErrorKind.ARITY_MISMATCH, 0, null,
                    name + "() expects " + params.size() + " argument" + (params.size() == 1 ? "" : "s")
                            + ", got " + args.size(),
                    "Use: " + signature());
        }

        Environment env = interpreter.environment();
        env.pushFrame();
        try {
            for (int i = 0; i < params.size(); i++) {
                env.define(params.get(i), args.get(i));
            }
            interpreter.execute(body);
        } finally {
            env.popFrame();
        }
    }

    public String signature() {
        return name + "(" + String.join(", ", params) + ")";
    }

    @Override
    public String toString() {
        return "func " + signature();
    }
}
