package com.nikl.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import com.nikl.debug.Debug;
import com.nikl.debug.DebugLevel;
import com.nikl.script.modules.CoreBuiltins;
import com.nikl.script.modules.ModuleRegistry;
import com.nikl.script.modules.OsModule;
import com.nikl.script.parser.BuiltinFunction;
import com.nikl.script.parser.ControlFlow;
import com.nikl.script.parser.Environment;
import com.nikl.script.parser.Interpreter;
import com.nikl.script.parser.Lexer;
import com.nikl.script.parser.NiklException;
import com.nikl.script.parser.Parser;
import com.nikl.script.parser.RuntimeError;
import com.nikl.script.parser.Statement.Stmt;
import com.nikl.script.parser.Token;
import com.nikl.script.parser.Value;

/**
 * Nikl engine.
 *
 * - Dynamically typed: Integer (64-bit), Float, Bool, String, Array, Tuple, HashMap, functions
 * - Lexically scoped closures; if/elif/else bodies share the enclosing scope
 * - Control flow: return, break, continue, loop, while, for-in
 * - Modules: {@code import "path" as name} for files and for the built-in
 *   {@code os}, {@code regex} and {@code json} modules
 *
 * Every failure is thrown as a {@link NiklException} subtype; nothing is
 * swallowed here.
 */
public class NiklScript {
    private static final String TAG = "NiklScript";

    public static final int DEFAULT_MAX_CALL_DEPTH = 1000;

    private final Map<String, BuiltinFunction> functions = new LinkedHashMap<>();
    private final OsModule os;
    private final ModuleRegistry modules;
    private PrintStream out = System.out;
    private BufferedReader in;
    private Path basePath;
    private int maxCallDepth = DEFAULT_MAX_CALL_DEPTH;

    public NiklScript() {
        this.basePath = Path.of("").toAbsolutePath();
        this.os = new OsModule(basePath);
        this.modules = ModuleRegistry.withDefaults(os);
    }

    // ===================== CONFIGURATION =====================

    public void setOut(PrintStream out) { this.out = out; }

    public void setIn(BufferedReader in) { this.in = in; }

    /** Directory that relative imports resolve against for {@link #run(String)}. */
    public void setBasePath(Path basePath) { this.basePath = basePath.toAbsolutePath().normalize(); }

    public Path getBasePath() { return basePath; }

    public void setMaxCallDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("max call depth must be positive: " + depth);
        this.maxCallDepth = depth;
    }

    public void registerFunction(String name, BuiltinFunction fn) { functions.put(name, fn); }

    public void registerModule(String name, Supplier<Value> factory) { modules.register(name, factory); }

    /** The engine-wide {@code os} module state (tracked working directory, env overlay). */
    public OsModule os() { return os; }

    // ===================== FRONT END =====================

    public List<Token> tokenize(String source) {
        List<Token> tokens = new Lexer(source).tokenize();
        if (Debug.get().enabled(DebugLevel.TRACE)) {
            for (Token t : tokens) Debug.get().t(TAG, t + " @" + t.line + ":" + t.column);
        }
        return tokens;
    }

    public List<Stmt> parse(String source) {
        return new Parser(tokenize(source)).parse();
    }

    // ===================== EXECUTION =====================

    public Interpreter newInterpreter() {
        return newInterpreter(basePath);
    }

    /** Interpreter with a fresh root scope of builtins and an empty loaded-module set. */
    public Interpreter newInterpreter(Path base) {
        Map<String, BuiltinFunction> builtins = new LinkedHashMap<>(CoreBuiltins.create(out, reader()));
        builtins.putAll(functions);
        Environment global = Interpreter.newRootEnvironment(builtins).child();
        return new Interpreter(global, builtins, modules.asMap(), base, new LinkedHashSet<>(), maxCallDepth);
    }

    public ControlFlow run(String source) {
        return run(source, newInterpreter());
    }

    /** Runs against an existing interpreter; bindings from earlier runs stay visible. */
    public ControlFlow run(String source, Interpreter interpreter) {
        try {
            List<Stmt> program = parse(source);
            return interpreter.execute(program);
        } catch (NiklException e) {
            Debug.get().w(TAG, e.getClass().getSimpleName() + ": " + e.getMessage());
            throw e;
        } catch (StackOverflowError e) {
            Debug.get().e(TAG, "host stack exhausted", e);
            throw new RuntimeError("Max call depth exceeded (host stack exhausted)", e);
        }
    }

    /**
     * Runs a script file. Its canonical path counts as already imported and
     * its imports resolve against its own directory.
     */
    public ControlFlow runFile(Path file) {
        Path real;
        String source;
        try {
            real = file.toRealPath();
            source = Files.readString(real, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeError("Cannot read script " + file + ": " + e.getMessage(), e);
        }
        Debug.get().d(TAG, "running " + real);
        Interpreter interpreter = newInterpreter(real.getParent());
        interpreter.markLoaded(real.toString());
        return run(source, interpreter);
    }

    private BufferedReader reader() {
        if (in == null) in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        return in;
    }
}
