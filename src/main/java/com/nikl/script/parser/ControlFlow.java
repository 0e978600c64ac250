package com.nikl.script.parser;

/**
 * Result of executing a statement. Anything other than {@link Kind#VALUE}
 * stops the enclosing statement list and travels outward until a loop
 * (break/continue) or a call boundary (return) consumes it.
 */
public final class ControlFlow {

    public enum Kind { VALUE, RETURN, BREAK, CONTINUE }

    public static final ControlFlow NORMAL = new ControlFlow(Kind.VALUE, Value.nil());
    public static final ControlFlow BREAK = new ControlFlow(Kind.BREAK, Value.nil());
    public static final ControlFlow CONTINUE = new ControlFlow(Kind.CONTINUE, Value.nil());

    public final Kind kind;
    public final Value value;

    private ControlFlow(Kind kind, Value value) {
        this.kind = kind;
        this.value = value;
    }

    public static ControlFlow value(Value value) {
        return new ControlFlow(Kind.VALUE, value);
    }

    public static ControlFlow returning(Value value) {
        return new ControlFlow(Kind.RETURN, value);
    }

    public boolean isNormal() {
        return kind == Kind.VALUE;
    }

    @Override
    public String toString() {
        return kind == Kind.VALUE || kind == Kind.RETURN ? kind + "(" + value + ")" : kind.toString();
    }
}
