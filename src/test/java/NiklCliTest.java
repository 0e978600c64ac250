import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.nikl.script.NiklCli;

public class NiklCliTest {

    @TempDir
    Path dir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int run(String stdin, String... args) {
        return NiklCli.run(args,
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String out() { return out.toString(StandardCharsets.UTF_8); }
    private String err() { return err.toString(StandardCharsets.UTF_8); }

    @Test
    void script_runsAndExitsZero() throws IOException {
        Path script = dir.resolve("hello.nk");
        Files.writeString(script, "let who = \"world\"\nprint(\"hello\", who)");
        assertEquals(0, run("", script.toString()));
        assertEquals("hello world", out().trim());
    }

    @Test
    void wrongExtension_exitsTwo() throws IOException {
        Path script = dir.resolve("hello.txt");
        Files.writeString(script, "print(1)");
        assertEquals(2, run("", script.toString()));
        assertTrue(err().contains("is not a valid script, it should end with .nk"), err());
    }

    @Test
    void missingOrEmptyFile_exitsThree() throws IOException {
        assertEquals(3, run("", dir.resolve("missing.nk").toString()));
        assertTrue(err().contains("does not exist."), err());

        Path empty = Files.createFile(dir.resolve("empty.nk"));
        assertEquals(3, run("", empty.toString()));
        assertTrue(err().contains("is empty."), err());
    }

    @Test
    void scriptError_exitsOneWithLabel() throws IOException {
        Path script = dir.resolve("bad.nk");
        Files.writeString(script, "print(\"before\")\nprint(undefined_name)");
        assertEquals(1, run("", script.toString()));
        assertTrue(out().contains("before"));
        assertTrue(err().contains("Runtime error: Undefined variable: undefined_name"), err());
    }

    @Test
    void tooManyArguments_exitsTwo() {
        assertEquals(2, run("", "a.nk", "b.nk"));
        assertTrue(err().startsWith("Usage:"), err());
    }

    @Test
    void repl_keepsStateAndSurvivesErrors() {
        String session = String.join("\n",
                "let x = 2",
                "print(x * 21)",
                "let y = 1 !",
                "print(1 +)",
                "print(missing)",
                "",
                "print(x)",
                "exit",
                "print(99)") + "\n";

        assertEquals(0, run(session));
        String shown = out();
        assertTrue(shown.startsWith("Welcome to Nikl REPL!"), shown);
        assertTrue(shown.contains("42"));
        assertTrue(shown.contains(">>> 2"));
        assertFalse(shown.contains("99"));

        String errors = err();
        assertTrue(errors.contains("Lex error: "), errors);
        assertTrue(errors.contains("Parse error: "), errors);
        assertTrue(errors.contains("Runtime error: Undefined variable: missing"), errors);
    }

    @Test
    void repl_endOfInputExitsCleanly() {
        assertEquals(0, run("print(\"bye\")"));
        assertTrue(out().contains("bye"));
    }
}
