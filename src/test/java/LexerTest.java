import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.nikl.script.parser.LexError;
import com.nikl.script.parser.Lexer;
import com.nikl.script.parser.Token;
import com.nikl.script.parser.TokenType;

public class LexerTest {

    private static List<Token> lex(String src) {
        return new Lexer(src).tokenize();
    }

    @Test
    void letStatement_tokensAndColumns() {
        List<Token> t = lex("let x = 42");
        assertEquals(5, t.size());
        assertEquals(TokenType.LET, t.get(0).type);
        assertEquals(TokenType.IDENTIFIER, t.get(1).type);
        assertEquals(TokenType.EQUAL, t.get(2).type);
        assertEquals(TokenType.INTEGER, t.get(3).type);
        assertEquals(TokenType.EOF, t.get(4).type);

        assertEquals(1, t.get(0).column);
        assertEquals(5, t.get(1).column);
        assertEquals(7, t.get(2).column);
        assertEquals(9, t.get(3).column);
        assertEquals(42L, t.get(3).literal);
    }

    @Test
    void literals_keepSourceLexeme() {
        List<Token> t = lex("42 3.14 \"hello world\" True False");
        assertEquals("42", t.get(0).lexeme);
        assertEquals("3.14", t.get(1).lexeme);
        assertEquals(3.14, (Double) t.get(1).literal, 0.0);
        assertEquals("\"hello world\"", t.get(2).lexeme);
        assertEquals("hello world", t.get(2).literal);
        assertEquals(TokenType.BOOLEAN, t.get(3).type);
        assertEquals(Boolean.TRUE, t.get(3).literal);
        assertEquals(Boolean.FALSE, t.get(4).literal);
    }

    @Test
    void operators_twoCharacterForms() {
        List<Token> t = lex("a -> b == c != d <= e >= f - g");
        assertEquals(TokenType.ARROW, t.get(1).type);
        assertEquals(TokenType.EQUAL_EQUAL, t.get(3).type);
        assertEquals(TokenType.BANG_EQUAL, t.get(5).type);
        assertEquals(TokenType.LESS_EQUAL, t.get(7).type);
        assertEquals(TokenType.GREATER_EQUAL, t.get(9).type);
        assertEquals(TokenType.MINUS, t.get(11).type);
    }

    @Test
    void keywordsAndTypeNames() {
        List<Token> t = lex("fn import as del elif Int HashMap spawn");
        assertEquals(TokenType.FN, t.get(0).type);
        assertEquals(TokenType.IMPORT, t.get(1).type);
        assertEquals(TokenType.AS, t.get(2).type);
        assertEquals(TokenType.DEL, t.get(3).type);
        assertEquals(TokenType.ELIF, t.get(4).type);
        assertEquals(TokenType.TYPE_INT, t.get(5).type);
        assertEquals(TokenType.TYPE_HASHMAP, t.get(6).type);
        assertEquals(TokenType.SPAWN, t.get(7).type);
    }

    @Test
    void comments_andLinePositions() {
        List<Token> t = lex("// leading comment\nlet a = 1 // trailing\n  a");
        assertEquals(TokenType.LET, t.get(0).type);
        assertEquals(2, t.get(0).line);
        Token last = t.get(4);
        assertEquals("a", last.lexeme);
        assertEquals(3, last.line);
        assertEquals(3, last.column);
    }

    @Test
    void multiLineString_advancesLine() {
        List<Token> t = lex("\"a\nb\" x");
        assertEquals("a\nb", t.get(0).literal);
        assertEquals(1, t.get(0).line);
        assertEquals(2, t.get(1).line);
    }

    @Test
    void unicodeIdentifier() {
        List<Token> t = lex("let café = 1");
        assertEquals(TokenType.IDENTIFIER, t.get(1).type);
        assertEquals("café", t.get(1).lexeme);
    }

    @Test
    void supplementaryCharacters_countAsOneColumn() {
        // U+10400 is a letter outside the Basic Multilingual Plane
        List<Token> t = lex("let \uD801\uDC00x = 1");
        assertEquals(TokenType.IDENTIFIER, t.get(1).type);
        assertEquals("\uD801\uDC00x", t.get(1).lexeme);
        assertEquals(8, t.get(2).column);

        LexError e = assertThrows(LexError.class, () -> lex("a \uD83D\uDE00"));
        assertEquals("\uD83D\uDE00", e.text);
        assertEquals(3, e.column);
    }

    @Test
    void unexpectedCharacter_reportsPosition() {
        LexError e = assertThrows(LexError.class, () -> lex("let a = 5 !"));
        assertEquals(LexError.Kind.UNEXPECTED_CHARACTER, e.kind);
        assertEquals("!", e.text);
        assertEquals(1, e.line);
        assertEquals(11, e.column);
        assertEquals("Unexpected character '!' at line 1, column 11", e.getMessage());
    }

    @Test
    void semicolon_isNotPartOfTheLanguage() {
        LexError e = assertThrows(LexError.class, () -> lex("let a = 1;"));
        assertEquals(LexError.Kind.UNEXPECTED_CHARACTER, e.kind);
        assertEquals(";", e.text);
    }

    @Test
    void unterminatedString_reportsStart() {
        LexError e = assertThrows(LexError.class, () -> lex("let s = \"abc"));
        assertEquals(LexError.Kind.UNTERMINATED_STRING, e.kind);
        assertEquals(1, e.line);
        assertEquals(9, e.column);
        assertTrue(e.getMessage().startsWith("Unterminated string"));
    }

    @Test
    void invalidNumbers() {
        LexError twoDots = assertThrows(LexError.class, () -> lex("1.2.3"));
        assertEquals(LexError.Kind.INVALID_NUMBER, twoDots.kind);
        assertEquals("1.2.3", twoDots.text);

        LexError tooBig = assertThrows(LexError.class, () -> lex("99999999999999999999"));
        assertEquals(LexError.Kind.INVALID_NUMBER, tooBig.kind);
    }
}
