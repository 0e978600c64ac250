import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.nikl.script.parser.Operators;
import com.nikl.script.parser.RuntimeError;
import com.nikl.script.parser.Token;
import com.nikl.script.parser.TokenType;
import com.nikl.script.parser.Value;

public class OperatorsTest {

    private static Token op(TokenType type, String lexeme) {
        return new Token(type, lexeme, null, 1, 1);
    }

    private static final Token PLUS = op(TokenType.PLUS, "+");
    private static final Token MINUS = op(TokenType.MINUS, "-");
    private static final Token SLASH = op(TokenType.SLASH, "/");
    private static final Token LESS = op(TokenType.LESS, "<");
    private static final Token LESS_EQUAL = op(TokenType.LESS_EQUAL, "<=");
    private static final Token GREATER_EQUAL = op(TokenType.GREATER_EQUAL, ">=");
    private static final Token EQ = op(TokenType.EQUAL_EQUAL, "==");
    private static final Token NEQ = op(TokenType.BANG_EQUAL, "!=");
    private static final Token AND = op(TokenType.AND, "and");
    private static final Token OR = op(TokenType.OR, "or");
    private static final Token NOT = op(TokenType.NOT, "not");

    @Test
    void divisionByZero_everyNumericPairing() {
        Value[][] pairs = {
                { Value.integer(1), Value.integer(0) },
                { Value.floating(1.0), Value.floating(0.0) },
                { Value.integer(1), Value.floating(0.0) },
                { Value.floating(1.5), Value.integer(0) },
        };
        for (Value[] p : pairs) {
            RuntimeError e = assertThrows(RuntimeError.class, () -> Operators.binary(p[0], SLASH, p[1]));
            assertEquals("Division by zero", e.getMessage());
        }
    }

    @Test
    void mixedNumbers_promoteToFloat() {
        Value sum = Operators.binary(Value.integer(1), PLUS, Value.floating(2.5));
        assertEquals(Value.Type.FLOAT, sum.getType());
        assertEquals(3.5, sum.asFloat(), 0.0);

        Value quotient = Operators.binary(Value.floating(7.0), SLASH, Value.integer(2));
        assertEquals(3.5, quotient.asFloat(), 0.0);

        assertTrue(Operators.binary(Value.integer(2), EQ, Value.floating(2.0)).asBool());
    }

    @Test
    void comparisons() {
        assertTrue(Operators.binary(Value.integer(2), LESS_EQUAL, Value.integer(2)).asBool());
        assertFalse(Operators.binary(Value.integer(2), LESS, Value.integer(2)).asBool());
        assertTrue(Operators.binary(Value.floating(2.5), GREATER_EQUAL, Value.integer(2)).asBool());
    }

    @Test
    void integerOverflow() {
        Value max = Value.integer(Long.MAX_VALUE);
        assertEquals("integer overflow",
                assertThrows(RuntimeError.class, () -> Operators.binary(max, PLUS, Value.integer(1))).getMessage());
        Value min = Value.integer(Long.MIN_VALUE);
        assertEquals("integer overflow",
                assertThrows(RuntimeError.class, () -> Operators.binary(min, SLASH, Value.integer(-1))).getMessage());
        assertEquals("integer overflow",
                assertThrows(RuntimeError.class, () -> Operators.unary(MINUS, min)).getMessage());
    }

    @Test
    void strings_concatenateAndCompareForEquality() {
        assertEquals("ab", Operators.binary(Value.string("a"), PLUS, Value.string("b")).asString());
        assertTrue(Operators.binary(Value.string("a"), EQ, Value.string("a")).asBool());
        assertTrue(Operators.binary(Value.string("a"), NEQ, Value.string("b")).asBool());

        RuntimeError e = assertThrows(RuntimeError.class,
                () -> Operators.binary(Value.string("a"), LESS, Value.string("b")));
        assertEquals("Type error: unsupported operator '<' for String \"a\" and String \"b\"", e.getMessage());
    }

    @Test
    void stringAndBool_mix() {
        assertEquals("xTrue", Operators.binary(Value.string("x"), PLUS, Value.bool(true)).asString());
        assertEquals("Falsex", Operators.binary(Value.bool(false), PLUS, Value.string("x")).asString());
        assertFalse(Operators.binary(Value.string("True"), EQ, Value.bool(true)).asBool());
        assertTrue(Operators.binary(Value.string("True"), NEQ, Value.bool(true)).asBool());
    }

    @Test
    void booleans_logic() {
        assertFalse(Operators.binary(Value.bool(true), AND, Value.bool(false)).asBool());
        assertTrue(Operators.binary(Value.bool(false), OR, Value.bool(true)).asBool());
        assertThrows(RuntimeError.class, () -> Operators.binary(Value.bool(true), PLUS, Value.bool(true)));
        assertThrows(RuntimeError.class, () -> Operators.binary(Value.integer(1), AND, Value.integer(1)));
    }

    @Test
    void unsupportedPairing_namesBothOperands() {
        RuntimeError e = assertThrows(RuntimeError.class,
                () -> Operators.binary(Value.integer(1), PLUS, Value.string("a")));
        assertEquals("Type error: unsupported operator '+' for Integer 1 and String \"a\"", e.getMessage());

        Value arr = Value.array(List.of(Value.integer(1)));
        assertThrows(RuntimeError.class, () -> Operators.binary(arr, PLUS, arr));
    }

    @Test
    void unaryOperators() {
        assertEquals(-5, Operators.unary(MINUS, Value.integer(5)).asInteger());
        assertFalse(Operators.unary(NOT, Value.bool(true)).asBool());

        RuntimeError neg = assertThrows(RuntimeError.class, () -> Operators.unary(MINUS, Value.floating(1.5)));
        assertEquals("Type error: unsupported unary operator '-' for Float 1.5", neg.getMessage());
        assertThrows(RuntimeError.class, () -> Operators.unary(NOT, Value.integer(1)));
    }
}
