package com.nikl.script.parser;

import java.util.Collections;
import java.util.List;

/**
 * Parsed form of a parameter or return annotation such as {@code Int},
 * {@code [String]} or {@code (Int, Float)}.
 *
 * Hints are validated while parsing and then dropped; nothing at runtime
 * checks values against them.
 */
public final class TypeHint {

    public enum Shape { PRIMITIVE, NAMED, ARRAY, TUPLE }

    public final Shape shape;
    public final String name;
    public final List<TypeHint> elements;

    private TypeHint(Shape shape, String name, List<TypeHint> elements) {
        this.shape = shape;
        this.name = name;
        this.elements = elements;
    }

    static TypeHint primitive(Token token) {
        return new TypeHint(Shape.PRIMITIVE, token.lexeme, Collections.emptyList());
    }

    static TypeHint named(Token token) {
        return new TypeHint(Shape.NAMED, token.lexeme, Collections.emptyList());
    }

    static TypeHint array(TypeHint element) {
        return new TypeHint(Shape.ARRAY, "Array", Collections.singletonList(element));
    }

    static TypeHint tuple(List<TypeHint> elements) {
        return new TypeHint(Shape.TUPLE, "Tuple", Collections.unmodifiableList(elements));
    }

    @Override
    public String toString() {
        switch (shape) {
            case ARRAY:
                return "[" + elements.get(0) + "]";
            case TUPLE: {
                StringBuilder sb = new StringBuilder("(");
                for (int i = 0; i < elements.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(elements.get(i));
                }
                return sb.append(")").toString();
            }
            default:
                return name;
        }
    }
}
