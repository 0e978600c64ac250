package com.nikl.script.modules;

import static com.nikl.script.modules.Args.requireArgs;
import static com.nikl.script.modules.Args.str;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import com.nikl.debug.Debug;
import com.nikl.script.parser.BuiltinFunction;
import com.nikl.script.parser.RuntimeError;
import com.nikl.script.parser.Value;

/**
 * The {@code "os"} import: file system and environment access.
 *
 * The JVM cannot change its process working directory, so {@code set_cwd}
 * moves a working directory tracked by this instance and relative paths
 * resolve against it. {@code env_set} writes to an overlay consulted by
 * {@code env_get} before the process environment.
 */
public final class OsModule {
    private static final String TAG = "OsModule";

    private Path cwd;
    private final Map<String, String> envOverlay = new HashMap<>();

    public OsModule(Path cwd) {
        this.cwd = cwd.toAbsolutePath().normalize();
    }

    public Path getCwd() {
        return cwd;
    }

    /** Builds a fresh module record; every record shares this instance's cwd and overlay. */
    public Value toValue() {
        Map<String, BuiltinFunction> fns = new LinkedHashMap<>();

        fns.put("get_cwd", args -> {
            requireArgs("get_cwd", args, 0);
            return Value.string(cwd.toString());
        });

        fns.put("set_cwd", args -> {
            requireArgs("set_cwd", args, 1);
            Path target = resolve(str("set_cwd", args, 0));
            if (!Files.isDirectory(target)) {
                throw new RuntimeError("os.set_cwd error: not a directory: " + target);
            }
            try {
                cwd = target.toRealPath();
            } catch (IOException e) {
                throw failure("set_cwd", e);
            }
            Debug.get().d(TAG, "cwd is now " + cwd);
            return Value.nil();
        });

        fns.put("list_dir", args -> {
            requireArgs("list_dir", args, 1);
            Path dir = resolve(str("list_dir", args, 0));
            List<Value> names = new ArrayList<>();
            try (Stream<Path> entries = Files.list(dir)) {
                entries.map(p -> p.getFileName().toString())
                        .sorted()
                        .forEach(n -> names.add(Value.string(n)));
            } catch (IOException e) {
                throw failure("list_dir", e);
            }
            return Value.array(Collections.unmodifiableList(names));
        });

        fns.put("make_dir", args -> {
            requireArgs("make_dir", args, 1);
            try {
                Files.createDirectories(resolve(str("make_dir", args, 0)));
            } catch (IOException e) {
                throw failure("make_dir", e);
            }
            return Value.nil();
        });

        fns.put("remove_dir", args -> {
            requireArgs("remove_dir", args, 1);
            Path dir = resolve(str("remove_dir", args, 0));
            if (!Files.isDirectory(dir)) {
                throw new RuntimeError("os.remove_dir error: not a directory: " + dir);
            }
            // deepest entries first
            try (Stream<Path> walk = Files.walk(dir)) {
                for (Path p : (Iterable<Path>) walk.sorted(Comparator.reverseOrder())::iterator) {
                    Files.delete(p);
                }
            } catch (IOException e) {
                throw failure("remove_dir", e);
            }
            return Value.nil();
        });

        fns.put("remove_file", args -> {
            requireArgs("remove_file", args, 1);
            Path file = resolve(str("remove_file", args, 0));
            if (Files.isDirectory(file)) {
                throw new RuntimeError("os.remove_file error: is a directory: " + file);
            }
            try {
                Files.delete(file);
            } catch (IOException e) {
                throw failure("remove_file", e);
            }
            return Value.nil();
        });

        fns.put("rename", args -> {
            requireArgs("rename", args, 2);
            Path from = resolve(str("rename", args, 0));
            Path to = resolve(str("rename", args, 1));
            try {
                Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                throw failure("rename", e);
            }
            return Value.nil();
        });

        fns.put("exists", args -> {
            requireArgs("exists", args, 1);
            return Value.bool(Files.exists(resolve(str("exists", args, 0))));
        });

        fns.put("is_file", args -> {
            requireArgs("is_file", args, 1);
            return Value.bool(Files.isRegularFile(resolve(str("is_file", args, 0))));
        });

        fns.put("is_dir", args -> {
            requireArgs("is_dir", args, 1);
            return Value.bool(Files.isDirectory(resolve(str("is_dir", args, 0))));
        });

        fns.put("read_file", args -> {
            requireArgs("read_file", args, 1);
            try {
                return Value.string(Files.readString(resolve(str("read_file", args, 0)), StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw failure("read_file", e);
            }
        });

        fns.put("write_file", args -> {
            requireArgs("write_file", args, 2);
            Path file = resolve(str("write_file", args, 0));
            String content = str("write_file", args, 1);
            try {
                Files.writeString(file, content, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw failure("write_file", e);
            }
            return Value.nil();
        });

        fns.put("env_get", args -> {
            requireArgs("env_get", args, 1);
            String key = str("env_get", args, 0);
            String value = envOverlay.containsKey(key) ? envOverlay.get(key) : System.getenv(key);
            return value == null ? Value.nil() : Value.string(value);
        });

        fns.put("env_set", args -> {
            requireArgs("env_set", args, 2);
            envOverlay.put(str("env_set", args, 0), str("env_set", args, 1));
            return Value.nil();
        });

        return Args.module(fns);
    }

    private Path resolve(String path) {
        return cwd.resolve(path).normalize();
    }

    private static RuntimeError failure(String op, IOException e) {
        return new RuntimeError("os." + op + " error: " + describe(e), e);
    }

    private static String describe(IOException e) {
        String msg = e.getMessage();
        String kind = e.getClass().getSimpleName();
        return msg == null ? kind : kind + ": " + msg;
    }
}
