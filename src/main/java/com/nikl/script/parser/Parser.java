package com.nikl.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.nikl.script.parser.Expr.ArrayLiteral;
import com.nikl.script.parser.Expr.Assign;
import com.nikl.script.parser.Expr.Binary;
import com.nikl.script.parser.Expr.GetExpr;
import com.nikl.script.parser.Expr.Literal;
import com.nikl.script.parser.Expr.MapLiteral;
import com.nikl.script.parser.Expr.TupleLiteral;
import com.nikl.script.parser.Expr.Unary;
import com.nikl.script.parser.Expr.Variable;
import com.nikl.script.parser.Statement.ElifBranch;
import com.nikl.script.parser.Statement.ExprStmt;
import com.nikl.script.parser.Statement.FunctionStmt;
import com.nikl.script.parser.Statement.Stmt;

/**
 * Recursive-descent parser. Stops at the first syntax error; no recovery and
 * no partial tree is returned.
 */
public class Parser {
    private final List<Token> tokens;
    private int current = 0;

    public Parser(List<Token> tokens) { this.tokens = tokens; }

    public List<Stmt> parse() {
        List<Stmt> statements = new ArrayList<Stmt>();
        while (!isAtEnd()) {
            statements.add(statement());
        }
        return statements;
    }

    private Stmt statement() {
        if (match(TokenType.LET)) return letDeclaration(false);
        if (match(TokenType.CONST)) return letDeclaration(true);
        if (match(TokenType.FN)) return functionDeclaration();
        if (match(TokenType.IF)) return ifStatement();
        if (match(TokenType.WHILE)) return whileStatement();
        if (match(TokenType.FOR)) return forStatement();
        if (match(TokenType.LOOP)) return new Statement.Loop(block("'loop'"));
        if (match(TokenType.RETURN)) return returnStatement();
        if (match(TokenType.BREAK)) return new Statement.BreakStmt(previous());
        if (match(TokenType.CONTINUE)) return new Statement.ContinueStmt(previous());
        if (match(TokenType.DEL)) return new Statement.DeleteStmt(consume(TokenType.IDENTIFIER, "Expect name after 'del'."));
        if (match(TokenType.IMPORT)) return importStatement();
        return new ExprStmt(expression());
    }

    private Stmt letDeclaration(boolean constant) {
        String keyword = constant ? "'const'" : "'let'";
        Token name = consume(TokenType.IDENTIFIER, "Expect variable name after " + keyword + ".");
        consume(TokenType.EQUAL, "Expect '=' after variable name.");
        Expr.ExprInterface initializer = expression();
        return new Statement.LetStmt(name, initializer, constant);
    }

    private Stmt functionDeclaration() {
        Token name = consume(TokenType.IDENTIFIER, "Expect function name.");
        consume(TokenType.LEFT_PAREN, "Expect '(' after function name.");

        List<Token> params = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                Token param = consume(TokenType.IDENTIFIER, "Expect parameter name.");
                for (Token seen : params) {
                    if (seen.lexeme.equals(param.lexeme)) throw error(param, "Duplicate parameter name '" + param.lexeme + "'.");
                }
                params.add(param);
                if (match(TokenType.COLON)) typeHint();
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after parameters.");
        if (match(TokenType.ARROW)) typeHint();

        List<Stmt> body = block("function body");
        return new FunctionStmt(name, params, body);
    }

    private TypeHint typeHint() {
        Token token = peek();
        if (token.type.isTypeName()) {
            advance();
            return TypeHint.primitive(token);
        }
        if (match(TokenType.IDENTIFIER)) return TypeHint.named(previous());
        if (match(TokenType.LEFT_BRACKET)) {
            TypeHint element = typeHint();
            consume(TokenType.RIGHT_BRACKET, "Expect ']' after array element type.");
            return TypeHint.array(element);
        }
        if (match(TokenType.LEFT_PAREN)) {
            List<TypeHint> elements = new ArrayList<>();
            if (!check(TokenType.RIGHT_PAREN)) {
                do {
                    elements.add(typeHint());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_PAREN, "Expect ')' after tuple element types.");
            return TypeHint.tuple(elements);
        }
        throw error(token, "Expect type annotation.");
    }

    private Stmt ifStatement() {
        Expr.ExprInterface condition = expression();
        List<Stmt> thenBranch = block("'if' body");

        List<ElifBranch> elifs = new ArrayList<>();
        while (match(TokenType.ELIF)) {
            Expr.ExprInterface elifCondition = expression();
            elifs.add(new ElifBranch(elifCondition, block("'elif' body")));
        }

        List<Stmt> elseBranch = null;
        if (match(TokenType.ELSE)) {
            elseBranch = block("'else' body");
        }
        return new Statement.If(condition, thenBranch, elifs, elseBranch);
    }

    private Stmt whileStatement() {
        Expr.ExprInterface condition = expression();
        return new Statement.While(condition, block("'while' body"));
    }

    private Stmt forStatement() {
        Token name = consume(TokenType.IDENTIFIER, "Expect loop variable after 'for'.");
        Token second = null;
        if (match(TokenType.COMMA)) {
            second = consume(TokenType.IDENTIFIER, "Expect second loop variable after ','.");
        }
        consume(TokenType.IN, "Expect 'in' after loop variables.");
        Expr.ExprInterface iterable = expression();
        return new Statement.For(name, second, iterable, block("'for' body"));
    }

    private Stmt returnStatement() {
        Token keyword = previous();
        Expr.ExprInterface value = expression();
        return new Statement.ReturnStmt(keyword, value);
    }

    private Stmt importStatement() {
        Token keyword = previous();
        Token path = consume(TokenType.STRING, "Expect module path string after 'import'.");
        consume(TokenType.AS, "Expect 'as' after module path.");
        Token alias = consume(TokenType.IDENTIFIER, "Expect alias name after 'as'.");
        return new Statement.ImportStmt(keyword, (String) path.literal, alias);
    }

    private List<Stmt> block(String what) {
        consume(TokenType.LEFT_BRACE, "Expect '{' before " + what + ".");
        List<Stmt> statements = new ArrayList<Stmt>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            statements.add(statement());
        }
        consume(TokenType.RIGHT_BRACE, "Expect '}' after " + what + ".");
        return statements;
    }

    private Expr.ExprInterface expression() { return assignment(); }

    private Expr.ExprInterface assignment() {
        Expr.ExprInterface expr = or();

        if (match(TokenType.EQUAL)) {
            Token equals = previous();
            if (expr instanceof Variable) {
                Expr.ExprInterface value = assignment();
                return new Assign(((Variable) expr).name, value);
            }
            throw error(equals, "Invalid assignment target.");
        }

        return expr;
    }

    private Expr.ExprInterface or() {
        Expr.ExprInterface expr = and();
        while (match(TokenType.OR)) {
            Token operator = previous();
            Expr.ExprInterface right = and();
            expr = new Binary(expr, operator, right);
        }
        return expr;
    }

    private Expr.ExprInterface and() {
        Expr.ExprInterface expr = equality();
        while (match(TokenType.AND)) {
            Token operator = previous();
            Expr.ExprInterface right = equality();
            expr = new Binary(expr, operator, right);
        }
        return expr;
    }

    private Expr.ExprInterface equality() {
        Expr.ExprInterface expr = comparison();
        while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL)) {
            Token operator = previous();
            Expr.ExprInterface right = comparison();
            expr = new Binary(expr, operator, right);
        }
        return expr;
    }

    private Expr.ExprInterface comparison() {
        Expr.ExprInterface expr = term();
        while (match(TokenType.LESS, TokenType.LESS_EQUAL, TokenType.GREATER, TokenType.GREATER_EQUAL)) {
            Token operator = previous();
            Expr.ExprInterface right = term();
            expr = new Binary(expr, operator, right);
        }
        return expr;
    }

    private Expr.ExprInterface term() {
        Expr.ExprInterface expr = factor();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token operator = previous();
            Expr.ExprInterface right = factor();
            expr = new Binary(expr, operator, right);
        }
        return expr;
    }

    private Expr.ExprInterface factor() {
        Expr.ExprInterface expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH)) {
            Token operator = previous();
            Expr.ExprInterface right = unary();
            expr = new Binary(expr, operator, right);
        }
        return expr;
    }

    private Expr.ExprInterface unary() {
        if (match(TokenType.MINUS, TokenType.NOT)) {
            Token operator = previous();
            Expr.ExprInterface right = unary();
            return new Unary(operator, right);
        }
        return call();
    }

    private Expr.ExprInterface call() {
        Expr.ExprInterface expr = primary();

        while (true) {
            if (match(TokenType.LEFT_PAREN)) {
                expr = finishCall(expr);
            } else if (match(TokenType.DOT)) {
                Token name = consume(TokenType.IDENTIFIER, "Expect property name after '.'.");
                expr = new GetExpr(expr, name);
            } else {
                break;
            }
        }

        return expr;
    }

    private Expr.ExprInterface finishCall(Expr.ExprInterface callee) {
        List<Expr.ExprInterface> arguments = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                arguments.add(expression());
            } while (match(TokenType.COMMA));
        }
        Token paren = consume(TokenType.RIGHT_PAREN, "Expect ')' after arguments.");
        return new Expr.Call(callee, paren, arguments);
    }

    private Expr.ExprInterface primary() {
        if (match(TokenType.INTEGER, TokenType.FLOAT, TokenType.STRING, TokenType.BOOLEAN)) {
            return new Literal(previous().literal);
        }
        if (match(TokenType.IDENTIFIER)) return new Variable(previous());

        // () is the empty tuple, (e) is grouping, (e, ...) is a tuple
        if (match(TokenType.LEFT_PAREN)) {
            if (match(TokenType.RIGHT_PAREN)) return new TupleLiteral(new ArrayList<>());
            Expr.ExprInterface first = expression();
            if (!check(TokenType.COMMA)) {
                consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
                return first;
            }
            List<Expr.ExprInterface> items = new ArrayList<>();
            items.add(first);
            while (match(TokenType.COMMA)) {
                items.add(expression());
            }
            consume(TokenType.RIGHT_PAREN, "Expect ')' after tuple elements.");
            return new TupleLiteral(items);
        }

        if (match(TokenType.LEFT_BRACKET)) {
            List<Expr.ExprInterface> items = new ArrayList<Expr.ExprInterface>();
            if (!check(TokenType.RIGHT_BRACKET)) {
                do {
                    items.add(expression());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_BRACKET, "Expect ']' after array literal.");
            return new ArrayLiteral(items);
        }

        if (match(TokenType.LEFT_BRACE)) {
            List<Expr.ExprInterface> keys = new ArrayList<>();
            List<Expr.ExprInterface> values = new ArrayList<>();
            if (!check(TokenType.RIGHT_BRACE)) {
                do {
                    keys.add(expression());
                    consume(TokenType.COLON, "Expect ':' after map key.");
                    values.add(expression());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_BRACE, "Expect '}' after map literal.");
            return new MapLiteral(keys, values);
        }

        throw error(peek(), "Expect expression.");
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private ParseError error(Token token, String message) {
        return new ParseError(token, message);
    }
}
