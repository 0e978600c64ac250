import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.nikl.debug.Debug;
import com.nikl.debug.DebugLevel;
import com.nikl.script.NiklScript;

public class DebugTest {

    @AfterEach
    void silence() {
        Debug.get().setSink(null, null);
    }

    @Test
    void threshold_dropsLowerLevels() {
        List<String> seen = new ArrayList<>();
        Debug.get().setSink((level, tag, message, error) -> seen.add(level + " " + tag + " " + message), DebugLevel.DEBUG);

        Debug.get().t("T", "hidden");
        Debug.get().d("T", "shown");
        Debug.get().w("T", "also shown");

        assertEquals(List.of("DEBUG T shown", "WARN T also shown"), seen);
        assertTrue(Debug.get().enabled(DebugLevel.DEBUG));
        assertFalse(Debug.get().enabled(DebugLevel.TRACE));
    }

    @Test
    void engineFailures_areLoggedAtWarn() {
        List<String> seen = new ArrayList<>();
        Debug.get().setSink((level, tag, message, error) -> seen.add(level + " " + message), DebugLevel.WARN);

        assertThrows(RuntimeException.class, () -> new NiklScript().run("print(nope)"));
        assertEquals(List.of("WARN RuntimeError: Undefined variable: nope"), seen);
    }

    @Test
    void noSink_isSilent() {
        Debug.get().setSink(null, DebugLevel.TRACE);
        assertFalse(Debug.get().enabled(DebugLevel.ERROR));
        Debug.get().e("T", "nowhere", new IllegalStateException());
    }
}
