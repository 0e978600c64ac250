import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.nikl.script.parser.Environment;
import com.nikl.script.parser.RuntimeError;
import com.nikl.script.parser.Value;

public class EnvironmentTest {

    @Test
    void child_shadowsWithoutTouchingParent() {
        Environment outer = new Environment();
        outer.define("x", Value.integer(5), true);
        Environment inner = outer.child();
        inner.define("x", Value.integer(10), true);

        assertEquals(10, inner.get("x").asInteger());
        assertEquals(5, outer.get("x").asInteger());
        assertTrue(inner.existsLocal("x"));
        assertFalse(outer.child().existsLocal("x"));
        assertTrue(outer.child().exists("x"));
    }

    @Test
    void assign_updatesNearestBinding() {
        Environment outer = new Environment();
        outer.define("count", Value.integer(0), true);
        Environment inner = outer.child().child();

        inner.assign("count", Value.integer(3));
        assertEquals(3, outer.get("count").asInteger());
    }

    @Test
    void assign_rejectsConstantsAndUnknownNames() {
        Environment env = new Environment();
        env.define("pi", Value.floating(3.14), false);

        RuntimeError constant = assertThrows(RuntimeError.class, () -> env.child().assign("pi", Value.floating(3.0)));
        assertEquals("Cannot assign to constant: pi", constant.getMessage());
        assertEquals(3.14, env.get("pi").asFloat(), 0.0);

        RuntimeError unknown = assertThrows(RuntimeError.class, () -> env.assign("tau", Value.floating(6.28)));
        assertEquals("Undefined variable: tau", unknown.getMessage());
    }

    @Test
    void define_twiceInSameScope() {
        Environment env = new Environment();
        env.define("a", Value.integer(1), true);
        assertThrows(RuntimeError.class, () -> env.define("a", Value.integer(2), true));

        env.defineOrReplace("a", Value.integer(2), false);
        assertEquals(2, env.get("a").asInteger());
        assertThrows(RuntimeError.class, () -> env.assign("a", Value.integer(3)));
    }

    @Test
    void delete_walksOutward() {
        Environment outer = new Environment();
        outer.define("a", Value.integer(1), true);
        Environment inner = outer.child();

        inner.delete("a");
        assertFalse(outer.exists("a"));

        RuntimeError e = assertThrows(RuntimeError.class, () -> inner.delete("a"));
        assertEquals("Cannot delete undefined variable: a", e.getMessage());
    }

    @Test
    void get_undefined() {
        RuntimeError e = assertThrows(RuntimeError.class, () -> new Environment().get("ghost"));
        assertEquals("Undefined variable: ghost", e.getMessage());
    }

    @Test
    void flatten_outerFirstInnerWins() {
        Environment root = new Environment();
        root.define("a", Value.integer(1), true);
        root.define("b", Value.integer(2), true);
        Environment mid = root.child();
        mid.define("c", Value.integer(3), true);
        Environment leaf = mid.child();
        leaf.define("a", Value.integer(10), true);

        Map<String, Value> flat = leaf.flatten();
        assertEquals(List.of("a", "b", "c"), List.copyOf(flat.keySet()));
        assertEquals(10, flat.get("a").asInteger());
    }
}
