package com.nikl.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.nikl.debug.Debug;
import com.nikl.debug.DebugLevel;
import com.nikl.debug.DebugSink;
import com.nikl.script.parser.Interpreter;
import com.nikl.script.parser.LexError;
import com.nikl.script.parser.NiklException;
import com.nikl.script.parser.ParseError;

/**
 * Command-line runner.
 *
 *   nikl [--debug] script.nk   run a file
 *   nikl [--debug]             line REPL, "exit" leaves
 *
 * Exit codes: 0 ok, 1 script error, 2 usage / not a .nk file, 3 unreadable or empty file.
 */
public final class NiklCli {

    public static void main(String[] args) {
        int code = run(args, System.in, System.out, System.err);
        if (code != 0) System.exit(code);
    }

    public static int run(String[] args, InputStream stdin, PrintStream out, PrintStream err) {
        boolean debug = false;
        List<String> files = new ArrayList<>();
        for (String a : args) {
            if ("--debug".equals(a)) debug = true;
            else files.add(a);
        }

        String env = System.getenv("NIKL_DEBUG");
        if (debug || (env != null && !env.isEmpty())) {
            DebugLevel min = "trace".equalsIgnoreCase(env) ? DebugLevel.TRACE : DebugLevel.DEBUG;
            Debug.get().setSink(DebugSink.printing(err), min);
        }

        BufferedReader reader = new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8));
        NiklScript engine = new NiklScript();
        engine.setOut(out);
        engine.setIn(reader);

        if (files.isEmpty()) return repl(engine, reader, out, err);
        if (files.size() > 1) {
            err.println("Usage: nikl [--debug] [script.nk]");
            return 2;
        }
        return runFile(engine, Path.of(files.get(0)), err);
    }

    private static int runFile(NiklScript engine, Path file, PrintStream err) {
        String name = file.getFileName() == null ? "" : file.getFileName().toString();
        if (!name.endsWith(".nk")) {
            err.println("Error: File '" + file + "' is not a valid script, it should end with .nk");
            return 2;
        }
        if (!Files.isRegularFile(file)) {
            err.println("Error: File '" + file + "' does not exist.");
            return 3;
        }
        try {
            if (Files.size(file) == 0) {
                err.println("Error: Script '" + file + "' is empty.");
                return 3;
            }
        } catch (IOException e) {
            err.println("Error reading file '" + file + "': " + e.getMessage());
            return 3;
        }

        try {
            engine.runFile(file);
            return 0;
        } catch (NiklException e) {
            err.println(label(e) + e.getMessage());
            return 1;
        }
    }

    private static int repl(NiklScript engine, BufferedReader reader, PrintStream out, PrintStream err) {
        out.println("Welcome to Nikl REPL!");
        out.println("To exit, type 'exit' or press Ctrl+D");

        Interpreter interpreter = engine.newInterpreter();
        while (true) {
            out.print(">>> ");
            out.flush();

            String line;
            try {
                line = reader.readLine();
            } catch (IOException e) {
                err.println("Error reading input: " + e.getMessage());
                return 1;
            }
            if (line == null) break;

            String input = line.trim();
            if (input.isEmpty()) continue;
            if ("exit".equals(input)) break;

            try {
                engine.run(input, interpreter);
            } catch (NiklException e) {
                err.println(label(e) + e.getMessage());
            }
        }
        return 0;
    }

    private static String label(NiklException e) {
        if (e instanceof LexError) return "Lex error: ";
        if (e instanceof ParseError) return "Parse error: ";
        return "Runtime error: ";
    }

    private NiklCli() {}
}
