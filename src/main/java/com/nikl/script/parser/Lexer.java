package com.nikl.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.nikl.debug.Debug;

public class Lexer {
    private static final String TAG = "Lexer";

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("let", TokenType.LET);
        map.put("const", TokenType.CONST);
        map.put("fn", TokenType.FN);
        map.put("import", TokenType.IMPORT);
        map.put("pub", TokenType.PUB);
        map.put("as", TokenType.AS);
        map.put("return", TokenType.RETURN);
        map.put("del", TokenType.DEL);
        map.put("spawn", TokenType.SPAWN);
        map.put("wait", TokenType.WAIT);
        map.put("in", TokenType.IN);
        map.put("if", TokenType.IF);
        map.put("elif", TokenType.ELIF);
        map.put("else", TokenType.ELSE);
        map.put("for", TokenType.FOR);
        map.put("while", TokenType.WHILE);
        map.put("loop", TokenType.LOOP);
        map.put("break", TokenType.BREAK);
        map.put("continue", TokenType.CONTINUE);
        map.put("and", TokenType.AND);
        map.put("or", TokenType.OR);
        map.put("not", TokenType.NOT);
        map.put("True", TokenType.BOOLEAN);
        map.put("False", TokenType.BOOLEAN);
        map.put("Int", TokenType.TYPE_INT);
        map.put("Float", TokenType.TYPE_FLOAT);
        map.put("String", TokenType.TYPE_STRING);
        map.put("Bool", TokenType.TYPE_BOOL);
        map.put("Array", TokenType.TYPE_ARRAY);
        map.put("Tuple", TokenType.TYPE_TUPLE);
        map.put("HashMap", TokenType.TYPE_HASHMAP);
        keywords = Collections.unmodifiableMap(map);
    }

    public Lexer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, line, column));
        Debug.get().t(TAG, "produced " + tokens.size() + " tokens");
        return tokens;
    }

    private void scanToken() {
        int c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ':': addToken(TokenType.COLON); break;
            case '.': addToken(TokenType.DOT); break;
            case '+': addToken(TokenType.PLUS); break;
            case '*': addToken(TokenType.STAR); break;
            case '-': addToken(match('>') ? TokenType.ARROW : TokenType.MINUS); break;

            case '/':
                if (match('/')) {
                    while (!isAtEnd() && peek() != '\n') advance();
                } else {
                    addToken(TokenType.SLASH);
                }
                break;
            case '!':
                if (match('=')) addToken(TokenType.BANG_EQUAL);
                else throw error(LexError.Kind.UNEXPECTED_CHARACTER, "!");
                break;
            case '=': addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL); break;
            case '<': addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS); break;
            case '>': addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER); break;
            case ' ': case '\r': case '\t': case '\n':
                break;
            case '"':
                string();
                break;
            default:
                if (isDigit(c)) number();
                else if (isAlpha(c)) identifier();
                else throw error(LexError.Kind.UNEXPECTED_CHARACTER, new String(Character.toChars(c)));
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        if (type == TokenType.BOOLEAN) {
            addToken(type, "True".equals(text));
        } else {
            addToken(type);
        }
    }

    private void number() {
        int dots = 0;
        while (isDigit(peek()) || peek() == '.') {
            if (advance() == '.') dots++;
        }
        String text = source.substring(start, current);
        if (dots > 1) throw error(LexError.Kind.INVALID_NUMBER, text);
        try {
            if (dots == 0) addToken(TokenType.INTEGER, Long.parseLong(text));
            else addToken(TokenType.FLOAT, Double.parseDouble(text));
        } catch (NumberFormatException e) {
            throw error(LexError.Kind.INVALID_NUMBER, text);
        }
    }

    private void string() {
        while (!isAtEnd() && peek() != '"') advance();
        if (isAtEnd()) throw error(LexError.Kind.UNTERMINATED_STRING, "");
        advance();
        String value = source.substring(start + 1, current - 1);
        addToken(TokenType.STRING, value);
    }

    private boolean isAtEnd() { return current >= source.length(); }

    // columns count code points, not UTF-16 units
    private int advance() {
        int c = source.codePointAt(current);
        current += Character.charCount(c);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private int peek() { return isAtEnd() ? '\0' : source.codePointAt(current); }

    private boolean isDigit(int c) { return c >= '0' && c <= '9'; }
    private boolean isAlpha(int c) { return Character.isLetter(c) || c == '_'; }
    private boolean isAlphaNumeric(int c) { return Character.isLetterOrDigit(c) || c == '_'; }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, startLine, startColumn));
    }

    private LexError error(LexError.Kind kind, String text) {
        return new LexError(kind, text, startLine, startColumn);
    }
}
