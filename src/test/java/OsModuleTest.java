import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.nikl.script.NiklScript;
import com.nikl.script.parser.Interpreter;
import com.nikl.script.parser.RuntimeError;
import com.nikl.script.parser.Value;

public class OsModuleTest {

    @TempDir
    Path dir;

    private NiklScript engine;
    private Interpreter interp;

    @BeforeEach
    void setUp() {
        engine = new NiklScript();
        engine.setOut(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));
        interp = engine.newInterpreter();
        engine.run("import \"os\" as os", interp);
    }

    private Value eval(String expr) {
        engine.run("result = " + expr, interp);
        return interp.getEnvironment().get("result");
    }

    private void exec(String src) {
        engine.run(src, interp);
    }

    private String p(String name) {
        return dir.resolve(name).toString();
    }

    @Test
    void writeReadAndInspectFiles() throws IOException {
        exec("let result = 0");
        exec("os.write_file(\"" + p("note.txt") + "\", \"hello\")");

        assertEquals("hello", Files.readString(dir.resolve("note.txt")));
        assertEquals("hello", eval("os.read_file(\"" + p("note.txt") + "\")").asString());
        assertTrue(eval("os.exists(\"" + p("note.txt") + "\")").asBool());
        assertTrue(eval("os.is_file(\"" + p("note.txt") + "\")").asBool());
        assertFalse(eval("os.is_dir(\"" + p("note.txt") + "\")").asBool());
        assertFalse(eval("os.exists(\"" + p("nothing.txt") + "\")").asBool());
    }

    @Test
    void directories_makeListRemove() throws IOException {
        exec("let result = 0");
        exec("os.make_dir(\"" + p("a/b/c") + "\")");
        assertTrue(Files.isDirectory(dir.resolve("a/b/c")));

        Files.writeString(dir.resolve("a/zeta.txt"), "z");
        Files.writeString(dir.resolve("a/alpha.txt"), "a");
        assertEquals("[alpha.txt, b, zeta.txt]", eval("os.list_dir(\"" + p("a") + "\")").toString());

        exec("os.remove_dir(\"" + p("a") + "\")");
        assertFalse(Files.exists(dir.resolve("a")));
    }

    @Test
    void renameAndRemoveFile() throws IOException {
        Files.writeString(dir.resolve("old.txt"), "x");
        exec("os.rename(\"" + p("old.txt") + "\", \"" + p("new.txt") + "\")");
        assertFalse(Files.exists(dir.resolve("old.txt")));
        assertTrue(Files.exists(dir.resolve("new.txt")));

        exec("os.remove_file(\"" + p("new.txt") + "\")");
        assertFalse(Files.exists(dir.resolve("new.txt")));
    }

    @Test
    void ioFailures_areRuntimeErrors() {
        RuntimeError e = assertThrows(RuntimeError.class,
                () -> exec("os.read_file(\"" + p("missing.txt") + "\")"));
        assertTrue(e.getMessage().startsWith("os.read_file error: NoSuchFileException"), e.getMessage());

        RuntimeError notDir = assertThrows(RuntimeError.class,
                () -> exec("os.remove_dir(\"" + p("missing") + "\")"));
        assertTrue(notDir.getMessage().startsWith("os.remove_dir error: not a directory"), notDir.getMessage());
    }

    @Test
    void setCwd_changesRelativeResolution() throws IOException {
        exec("let result = 0");
        exec("os.set_cwd(\"" + dir + "\")");
        assertEquals(dir.toRealPath().toString(), eval("os.get_cwd()").asString());
        assertEquals(dir.toRealPath(), engine.os().getCwd());

        exec("os.write_file(\"rel.txt\", \"relative\")");
        assertEquals("relative", Files.readString(dir.resolve("rel.txt")));

        assertThrows(RuntimeError.class, () -> exec("os.set_cwd(\"" + p("nope") + "\")"));
    }

    @Test
    void environmentOverlay() {
        exec("let result = 0");
        assertTrue(eval("os.env_get(\"NIKL_SURELY_UNSET_VARIABLE_123\")").isNull());
        exec("os.env_set(\"NIKL_TEST_KEY\", \"v1\")");
        assertEquals("v1", eval("os.env_get(\"NIKL_TEST_KEY\")").asString());
    }

    @Test
    void argumentChecks() {
        RuntimeError count = assertThrows(RuntimeError.class, () -> exec("os.exists()"));
        assertEquals("exists() expects 1 argument, got 0", count.getMessage());

        RuntimeError type = assertThrows(RuntimeError.class, () -> exec("os.exists(1)"));
        assertEquals("exists() expects a String as argument 1, got Integer", type.getMessage());
    }
}
