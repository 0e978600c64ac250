package com.nikl.script.parser;

import java.util.List;

import com.nikl.script.parser.Statement.Stmt;

/**
 * Function value created by {@code fn}. The closure is a live reference to
 * the defining scope, so later bindings in that scope (including the
 * function's own name) are visible from the body.
 */
public class UserFunction {
    final String name;
    final List<Token> params;
    final List<Stmt> body;
    final Environment closure;

    UserFunction(String name, List<Token> params, List<Stmt> body, Environment closure) {
        this.name = name;
        this.params = params;
        this.body = body;
        this.closure = closure;
    }

    public String getName() {
        return name;
    }

    public int arity() {
        return params.size();
    }

    Value call(Interpreter interpreter, List<Value> args) {
        if (args.size() != params.size()) {
            throw new RuntimeError(name + "() expects " + params.size() + " arguments, got " + args.size());
        }

        Environment previous = interpreter.env;

        // New call frame is a child of the closure, not of the caller.
        interpreter.env = closure.child();

        try {
            for (int i = 0; i < params.size(); i++) {
                interpreter.env.defineOrReplace(params.get(i).lexeme, args.get(i), true);
            }

            ControlFlow flow = interpreter.executeBlock(body);
            if (flow.kind == ControlFlow.Kind.RETURN) return flow.value;
            return Value.nil();
        } finally {
            interpreter.env = previous;
        }
    }
}
