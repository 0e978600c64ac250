package com.nikl.script.parser;

public enum TokenType {
    // Declaration keywords
    LET, CONST, FN, IMPORT, PUB, AS, RETURN, DEL,

    // Reserved for concurrency, never parsed
    SPAWN, WAIT,

    // Control keywords
    IF, ELIF, ELSE, WHILE, FOR, IN, LOOP, BREAK, CONTINUE,

    // Logical operators
    AND, OR, NOT,

    // Literals
    IDENTIFIER, INTEGER, FLOAT, STRING, BOOLEAN,

    // Primitive type names (annotations only)
    TYPE_INT, TYPE_FLOAT, TYPE_STRING, TYPE_BOOL, TYPE_ARRAY, TYPE_TUPLE, TYPE_HASHMAP,

    // Assignment, comparison and arithmetic
    EQUAL, EQUAL_EQUAL, BANG_EQUAL,
    LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,
    PLUS, MINUS, STAR, SLASH, ARROW,

    // Brackets and punctuation
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE, LEFT_BRACKET, RIGHT_BRACKET,
    COMMA, COLON, DOT,

    EOF;

    public boolean isTypeName() {
        switch (this) {
            case TYPE_INT:
            case TYPE_FLOAT:
            case TYPE_STRING:
            case TYPE_BOOL:
            case TYPE_ARRAY:
            case TYPE_TUPLE:
            case TYPE_HASHMAP:
                return true;
            default:
                return false;
        }
    }
}
