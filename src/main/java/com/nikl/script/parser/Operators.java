package com.nikl.script.parser;

/**
 * Binary and unary operator evaluation.
 *
 * Binary operators are resolved over the pair of operand kinds. Each pairing
 * supports a fixed set of operators; everything else is a type error naming
 * both operands and the operator. Integer arithmetic is overflow checked.
 */
public final class Operators {

    private Operators() {}

    public static Value binary(Value left, Token operator, Value right) {
        TokenType op = operator.type;
        Value.Type l = left.type;
        Value.Type r = right.type;

        if (op == TokenType.SLASH && isNumber(left) && isNumber(right) && isZero(right)) {
            throw new RuntimeError("Division by zero");
        }

        if (l == Value.Type.INTEGER && r == Value.Type.INTEGER) {
            return integers(left.asInteger(), operator, right.asInteger(), left, right);
        }
        if (isNumber(left) && isNumber(right)) {
            // at least one side is Float; promote the other
            return floats(toDouble(left), operator, toDouble(right), left, right);
        }
        if (l == Value.Type.STRING && r == Value.Type.STRING) {
            String a = left.asString();
            String b = right.asString();
            switch (op) {
                case PLUS: return Value.string(a + b);
                case EQUAL_EQUAL: return Value.bool(a.equals(b));
                case BANG_EQUAL: return Value.bool(!a.equals(b));
                default: throw unsupported(left, operator, right);
            }
        }
        if (l == Value.Type.BOOL && r == Value.Type.BOOL) {
            boolean a = left.asBool();
            boolean b = right.asBool();
            switch (op) {
                case AND: return Value.bool(a && b);
                case OR: return Value.bool(a || b);
                case EQUAL_EQUAL: return Value.bool(a == b);
                case BANG_EQUAL: return Value.bool(a != b);
                default: throw unsupported(left, operator, right);
            }
        }
        if ((l == Value.Type.STRING && r == Value.Type.BOOL) || (l == Value.Type.BOOL && r == Value.Type.STRING)) {
            // values of different kinds are never equal
            switch (op) {
                case PLUS: return Value.string(left.toString() + right.toString());
                case EQUAL_EQUAL: return Value.bool(false);
                case BANG_EQUAL: return Value.bool(true);
                default: throw unsupported(left, operator, right);
            }
        }
        throw unsupported(left, operator, right);
    }

    public static Value unary(Token operator, Value operand) {
        if (operator.type == TokenType.MINUS && operand.type == Value.Type.INTEGER) {
            long v = operand.asInteger();
            if (v == Long.MIN_VALUE) throw new RuntimeError("integer overflow");
            return Value.integer(-v);
        }
        if (operator.type == TokenType.NOT && operand.type == Value.Type.BOOL) {
            return Value.bool(!operand.asBool());
        }
        throw new RuntimeError("Type error: unsupported unary operator '" + operator.lexeme + "' for "
                + describe(operand));
    }

    private static Value integers(long a, Token operator, long b, Value left, Value right) {
        try {
            switch (operator.type) {
                case PLUS: return Value.integer(Math.addExact(a, b));
                case MINUS: return Value.integer(Math.subtractExact(a, b));
                case STAR: return Value.integer(Math.multiplyExact(a, b));
                case SLASH:
                    if (a == Long.MIN_VALUE && b == -1) throw new ArithmeticException("long overflow");
                    return Value.integer(a / b);
                case EQUAL_EQUAL: return Value.bool(a == b);
                case BANG_EQUAL: return Value.bool(a != b);
                case LESS: return Value.bool(a < b);
                case LESS_EQUAL: return Value.bool(a <= b);
                case GREATER: return Value.bool(a > b);
                case GREATER_EQUAL: return Value.bool(a >= b);
                default: throw unsupported(left, operator, right);
            }
        } catch (ArithmeticException e) {
            throw new RuntimeError("integer overflow", e);
        }
    }

    private static Value floats(double a, Token operator, double b, Value left, Value right) {
        switch (operator.type) {
            case PLUS: return Value.floating(a + b);
            case MINUS: return Value.floating(a - b);
            case STAR: return Value.floating(a * b);
            case SLASH: return Value.floating(a / b);
            case EQUAL_EQUAL: return Value.bool(a == b);
            case BANG_EQUAL: return Value.bool(a != b);
            case LESS: return Value.bool(a < b);
            case LESS_EQUAL: return Value.bool(a <= b);
            case GREATER: return Value.bool(a > b);
            case GREATER_EQUAL: return Value.bool(a >= b);
            default: throw unsupported(left, operator, right);
        }
    }

    private static boolean isNumber(Value v) {
        return v.type == Value.Type.INTEGER || v.type == Value.Type.FLOAT;
    }

    private static boolean isZero(Value v) {
        return v.type == Value.Type.INTEGER ? v.asInteger() == 0 : v.asFloat() == 0.0;
    }

    private static double toDouble(Value v) {
        return v.type == Value.Type.INTEGER ? (double) v.asInteger() : v.asFloat();
    }

    private static RuntimeError unsupported(Value left, Token operator, Value right) {
        return new RuntimeError("Type error: unsupported operator '" + operator.lexeme + "' for "
                + describe(left) + " and " + describe(right));
    }

    private static String describe(Value v) {
        return v.type == Value.Type.STRING ? "String \"" + v + "\"" : v.typeName() + " " + v;
    }
}
