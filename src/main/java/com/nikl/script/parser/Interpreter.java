package com.nikl.script.parser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

import com.nikl.debug.Debug;
import com.nikl.script.parser.Expr.ArrayLiteral;
import com.nikl.script.parser.Expr.Assign;
import com.nikl.script.parser.Expr.Binary;
import com.nikl.script.parser.Expr.Call;
import com.nikl.script.parser.Expr.ExprVisitor;
import com.nikl.script.parser.Expr.GetExpr;
import com.nikl.script.parser.Expr.Literal;
import com.nikl.script.parser.Expr.MapLiteral;
import com.nikl.script.parser.Expr.TupleLiteral;
import com.nikl.script.parser.Expr.Unary;
import com.nikl.script.parser.Expr.Variable;
import com.nikl.script.parser.Statement.BreakStmt;
import com.nikl.script.parser.Statement.ContinueStmt;
import com.nikl.script.parser.Statement.DeleteStmt;
import com.nikl.script.parser.Statement.ElifBranch;
import com.nikl.script.parser.Statement.ExprStmt;
import com.nikl.script.parser.Statement.For;
import com.nikl.script.parser.Statement.FunctionStmt;
import com.nikl.script.parser.Statement.If;
import com.nikl.script.parser.Statement.ImportStmt;
import com.nikl.script.parser.Statement.LetStmt;
import com.nikl.script.parser.Statement.Loop;
import com.nikl.script.parser.Statement.ReturnStmt;
import com.nikl.script.parser.Statement.Stmt;
import com.nikl.script.parser.Statement.StmtVisitor;
import com.nikl.script.parser.Statement.While;

/**
 * Tree-walking evaluator. Statements yield a {@link ControlFlow}; expressions
 * yield a {@link Value}. Errors are thrown as {@link RuntimeError} and are
 * never caught by script code.
 */
public class Interpreter implements ExprVisitor<Value>, StmtVisitor<ControlFlow> {
    private static final String TAG = "Interpreter";

    Environment env;
    private final Map<String, BuiltinFunction> builtins;
    private final Map<String, Supplier<Value>> modules;
    private final Path basePath;
    private final Set<String> loaded;
    private final int maxCallDepth;
    private int callDepth = 0;

    /**
     * @param env          scope top-level statements run in
     * @param builtins     root builtins, also installed in the root scope of every imported file
     * @param modules      built-in modules by import name
     * @param basePath     directory relative import paths resolve against
     * @param loaded       canonical paths and module names already imported; owned by this interpreter
     * @param maxCallDepth nesting limit for user function calls
     */
    public Interpreter(Environment env, Map<String, BuiltinFunction> builtins, Map<String, Supplier<Value>> modules,
                       Path basePath, Set<String> loaded, int maxCallDepth) {
        this.env = env;
        this.builtins = builtins;
        this.modules = modules;
        this.basePath = basePath;
        this.loaded = loaded;
        this.maxCallDepth = maxCallDepth;
    }

    /** Fresh root scope holding every builtin as an immutable binding. */
    public static Environment newRootEnvironment(Map<String, BuiltinFunction> builtins) {
        Environment root = new Environment();
        for (Map.Entry<String, BuiltinFunction> e : builtins.entrySet()) {
            root.define(e.getKey(), Value.builtin(e.getValue()), false);
        }
        return root;
    }

    public Environment getEnvironment() { return env; }
    public Path getBasePath() { return basePath; }
    public Set<String> getLoaded() { return Collections.unmodifiableSet(loaded); }

    /** Records a path or module name as imported so a later {@code import} of it is skipped. */
    public void markLoaded(String key) { loaded.add(key); }

    /**
     * Runs a program in the current scope. Returns the first non-normal
     * signal (break/continue/return reaching the top level) or the value of
     * the last statement.
     */
    public ControlFlow execute(List<Stmt> program) {
        return executeBlock(program);
    }

    ControlFlow executeBlock(List<Stmt> statements) {
        ControlFlow result = ControlFlow.NORMAL;
        for (Stmt s : statements) {
            ControlFlow flow = s.accept(this);
            if (!flow.isNormal()) return flow;
            result = flow;
        }
        return result;
    }

    private Value eval(Expr.ExprInterface expr) {
        return expr.accept(this);
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public ControlFlow visitExprStmt(ExprStmt stmt) {
        return ControlFlow.value(eval(stmt.expression));
    }

    @Override
    public ControlFlow visitLetStmt(LetStmt stmt) {
        Value value = eval(stmt.initializer);
        env.define(stmt.name.lexeme, value, !stmt.constant);
        return ControlFlow.NORMAL;
    }

    @Override
    public ControlFlow visitFunctionStmt(FunctionStmt stmt) {
        String name = stmt.name.lexeme;
        UserFunction fn = new UserFunction(name, stmt.params, stmt.body, env);
        env.define(name, Value.function(fn), false);
        return ControlFlow.NORMAL;
    }

    @Override
    public ControlFlow visitIfStmt(If stmt) {
        // branch bodies share the enclosing scope
        if (condition(stmt.condition, "if")) return executeBlock(stmt.thenBranch);
        for (ElifBranch branch : stmt.elifs) {
            if (condition(branch.condition, "elif")) return executeBlock(branch.body);
        }
        if (stmt.elseBranch != null) return executeBlock(stmt.elseBranch);
        return ControlFlow.NORMAL;
    }

    @Override
    public ControlFlow visitWhileStmt(While stmt) {
        while (condition(stmt.condition, "while")) {
            ControlFlow flow = loopBody(stmt.body);
            if (flow.kind == ControlFlow.Kind.BREAK) break;
            if (flow.kind == ControlFlow.Kind.RETURN) return flow;
        }
        return ControlFlow.NORMAL;
    }

    @Override
    public ControlFlow visitLoopStmt(Loop stmt) {
        while (true) {
            ControlFlow flow = loopBody(stmt.body);
            if (flow.kind == ControlFlow.Kind.BREAK) break;
            if (flow.kind == ControlFlow.Kind.RETURN) return flow;
        }
        return ControlFlow.NORMAL;
    }

    @Override
    public ControlFlow visitForStmt(For stmt) {
        Value iterable = eval(stmt.iterable);
        String first = stmt.name.lexeme;
        String second = stmt.secondName == null ? null : stmt.secondName.lexeme;

        List<Value[]> rounds = new ArrayList<>();
        switch (iterable.type) {
            case STRING:
                requireSingleName(stmt, iterable);
                iterable.asString().codePoints().forEach(cp ->
                        rounds.add(new Value[] { Value.string(new String(Character.toChars(cp))) }));
                break;
            case ARRAY:
                requireSingleName(stmt, iterable);
                for (Value v : iterable.asArray()) rounds.add(new Value[] { v });
                break;
            case TUPLE:
                requireSingleName(stmt, iterable);
                for (Value v : iterable.asTuple()) rounds.add(new Value[] { v });
                break;
            case HASHMAP:
                if (second == null) {
                    throw new RuntimeError("Iterating a HashMap requires two loop variables (key, value), got one: " + first);
                }
                for (Value.Entry e : iterable.asHashMap()) rounds.add(new Value[] { e.key, e.value });
                break;
            default:
                throw new RuntimeError("Cannot iterate over " + iterable.typeName());
        }

        // bound names stay visible after the loop with the last value
        bindLoopName(first);
        if (second != null) bindLoopName(second);

        for (Value[] round : rounds) {
            env.assign(first, round[0]);
            if (second != null) env.assign(second, round[1]);

            ControlFlow flow = loopBody(stmt.body);
            if (flow.kind == ControlFlow.Kind.BREAK) break;
            if (flow.kind == ControlFlow.Kind.RETURN) return flow;
        }
        return ControlFlow.NORMAL;
    }

    /** Reuses an existing local binding (constants refuse the rebind); otherwise defines a mutable one. */
    private void bindLoopName(String name) {
        if (env.existsLocal(name)) env.assign(name, Value.nil());
        else env.define(name, Value.nil(), true);
    }

    private void requireSingleName(For stmt, Value iterable) {
        if (stmt.secondName != null) {
            throw new RuntimeError("Iterating " + iterable.typeName() + " takes one loop variable, got two: "
                    + stmt.name.lexeme + ", " + stmt.secondName.lexeme);
        }
    }

    /** Each iteration gets its own child scope so {@code let} inside a loop body can run again. */
    private ControlFlow loopBody(List<Stmt> body) {
        Environment previous = env;
        env = previous.child();
        try {
            return executeBlock(body);
        } finally {
            env = previous;
        }
    }

    private boolean condition(Expr.ExprInterface expr, String keyword) {
        Value v = eval(expr);
        if (v.type != Value.Type.BOOL) {
            throw new RuntimeError("Type error: '" + keyword + "' condition must be a Boolean, got " + v.typeName() + " " + v);
        }
        return v.asBool();
    }

    @Override
    public ControlFlow visitReturnStmt(ReturnStmt stmt) {
        return ControlFlow.returning(eval(stmt.value));
    }

    @Override
    public ControlFlow visitBreakStmt(BreakStmt stmt) {
        return ControlFlow.BREAK;
    }

    @Override
    public ControlFlow visitContinueStmt(ContinueStmt stmt) {
        return ControlFlow.CONTINUE;
    }

    @Override
    public ControlFlow visitDeleteStmt(DeleteStmt stmt) {
        env.delete(stmt.name.lexeme);
        return ControlFlow.NORMAL;
    }

    @Override
    public ControlFlow visitImportStmt(ImportStmt stmt) {
        String path = stmt.path;
        String alias = stmt.alias.lexeme;

        Supplier<Value> builtinModule = modules.get(path);
        if (builtinModule != null) {
            if (loaded.contains(path)) {
                Debug.get().d(TAG, "module '" + path + "' already imported, skipping");
                return ControlFlow.NORMAL;
            }
            env.define(alias, builtinModule.get(), false);
            loaded.add(path);
            Debug.get().d(TAG, "bound built-in module '" + path + "' as " + alias);
            return ControlFlow.NORMAL;
        }

        Path resolved;
        try {
            resolved = basePath.resolve(path).toRealPath();
        } catch (IOException e) {
            throw new RuntimeError("Cannot resolve import '" + path + "' from " + basePath + ": " + e.getMessage(), e);
        }

        String key = resolved.toString();
        if (loaded.contains(key)) {
            Debug.get().d(TAG, "module " + key + " already imported, skipping");
            return ControlFlow.NORMAL;
        }

        // only a module that loaded and bound counts as imported
        env.define(alias, loadModule(path, resolved), false);
        loaded.add(key);
        return ControlFlow.NORMAL;
    }

    private Value loadModule(String path, Path resolved) {
        String source;
        try {
            source = Files.readString(resolved, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeError("Cannot read module '" + path + "' (" + resolved + "): " + e.getMessage(), e);
        }

        Debug.get().d(TAG, "loading module " + resolved);
        Environment moduleScope = newRootEnvironment(builtins).child();
        Path dir = resolved.getParent();
        Set<String> nestedLoaded = new LinkedHashSet<>(loaded);
        nestedLoaded.add(resolved.toString());
        Interpreter nested = new Interpreter(moduleScope, builtins, modules, dir, nestedLoaded, maxCallDepth);
        try {
            List<Stmt> program = new Parser(new Lexer(source).tokenize()).parse();
            nested.execute(program);
        } catch (NiklException e) {
            throw new RuntimeError("Error in module '" + path + "' (" + resolved + "): " + e.getMessage(), e);
        }

        List<Value.Entry> exports = new ArrayList<>();
        for (Map.Entry<String, Value> e : nested.env.flatten().entrySet()) {
            exports.add(new Value.Entry(Value.string(e.getKey()), e.getValue()));
        }
        return Value.hashMap(Collections.unmodifiableList(exports));
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public Value visitLiteralExpr(Literal expr) {
        Object v = expr.value;
        if (v instanceof Long) return Value.integer((Long) v);
        if (v instanceof Double) return Value.floating((Double) v);
        if (v instanceof Boolean) return Value.bool((Boolean) v);
        if (v instanceof String) return Value.string((String) v);
        throw new RuntimeError("Unsupported literal: " + v);
    }

    @Override
    public Value visitVariableExpr(Variable expr) {
        return env.get(expr.name.lexeme);
    }

    @Override
    public Value visitAssignExpr(Assign expr) {
        Value value = eval(expr.value);
        env.assign(expr.name.lexeme, value);
        return value;
    }

    @Override
    public Value visitBinaryExpr(Binary expr) {
        // both sides are always evaluated, including for 'and'/'or'
        Value left = eval(expr.left);
        Value right = eval(expr.right);
        return Operators.binary(left, expr.operator, right);
    }

    @Override
    public Value visitUnaryExpr(Unary expr) {
        return Operators.unary(expr.operator, eval(expr.right));
    }

    @Override
    public Value visitCallExpr(Call expr) {
        Value callee = eval(expr.callee);

        List<Value> args = new ArrayList<>(expr.arguments.size());
        for (Expr.ExprInterface a : expr.arguments) args.add(eval(a));

        if (callee.type == Value.Type.FUNCTION) {
            if (callDepth >= maxCallDepth) {
                throw new RuntimeError("Max call depth exceeded (" + maxCallDepth + ") calling " + callee.asFunction().name + "()");
            }
            callDepth++;
            try {
                return callee.asFunction().call(this, args);
            } finally {
                callDepth--;
            }
        }
        if (callee.type == Value.Type.BUILTIN) {
            return callee.asBuiltin().call(args);
        }
        throw new RuntimeError("Tried to call non-function value: " + callee.typeName() + " " + callee
                + " at line " + expr.paren.line);
    }

    @Override
    public Value visitGetExpr(GetExpr expr) {
        Value object = eval(expr.object);
        String property = expr.name.lexeme;
        if (object.type != Value.Type.HASHMAP) {
            throw new RuntimeError("Cannot access property '" + property + "' on " + object.typeName());
        }
        Value v = object.lookup(property);
        if (v == null) throw new RuntimeError("Property '" + property + "' not found");
        return v;
    }

    @Override
    public Value visitArrayLiteralExpr(ArrayLiteral expr) {
        return Value.array(evalAll(expr.elements));
    }

    @Override
    public Value visitTupleLiteralExpr(TupleLiteral expr) {
        return Value.tuple(evalAll(expr.elements));
    }

    @Override
    public Value visitMapLiteralExpr(MapLiteral expr) {
        List<Value.Entry> entries = new ArrayList<>(expr.keys.size());
        for (int i = 0; i < expr.keys.size(); i++) {
            Value key = eval(expr.keys.get(i));
            Value value = eval(expr.values.get(i));
            entries.add(new Value.Entry(key, value));
        }
        return Value.hashMap(Collections.unmodifiableList(entries));
    }

    private List<Value> evalAll(List<Expr.ExprInterface> exprs) {
        List<Value> out = new ArrayList<>(exprs.size());
        for (Expr.ExprInterface e : exprs) out.add(eval(e));
        return Collections.unmodifiableList(out);
    }
}
