package com.nikl.script.parser;

import java.util.List;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitLiteralExpr(Literal expr);
        R visitVariableExpr(Variable expr);
        R visitAssignExpr(Assign expr);
        R visitBinaryExpr(Binary expr);
        R visitUnaryExpr(Unary expr);
        R visitCallExpr(Call expr);
        R visitGetExpr(GetExpr expr);
        R visitArrayLiteralExpr(ArrayLiteral expr);
        R visitTupleLiteralExpr(TupleLiteral expr);
        R visitMapLiteralExpr(MapLiteral expr);
    }

    /** Integer (Long), Float (Double), Bool (Boolean) or String literal. */
    public static final class Literal implements ExprInterface {
        public final Object value;

        public Literal(Object value) {
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }
    }

    public static final class Variable implements ExprInterface {
        public final Token name;

        public Variable(Token name) {
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariableExpr(this);
        }
    }

    public static final class Assign implements ExprInterface {
        public final Token name;
        public final ExprInterface value;

        public Assign(Token name, ExprInterface value) {
            this.name = name;
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitAssignExpr(this);
        }
    }

    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }
    }

    public static final class Unary implements ExprInterface {
        public final Token operator;
        public final ExprInterface right;

        public Unary(Token operator, ExprInterface right) {
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }
    }

    public static final class Call implements ExprInterface {
        public final ExprInterface callee;
        public final Token paren;
        public final List<ExprInterface> arguments;

        public Call(ExprInterface callee, Token paren, List<ExprInterface> arguments) {
            this.callee = callee;
            this.paren = paren;
            this.arguments = arguments;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }
    }

    /** {@code object.name} */
    public static final class GetExpr implements ExprInterface {
        public final ExprInterface object;
        public final Token name;

        public GetExpr(ExprInterface object, Token name) {
            this.object = object;
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitGetExpr(this);
        }
    }

    public static final class ArrayLiteral implements ExprInterface {
        public final List<ExprInterface> elements;

        public ArrayLiteral(List<ExprInterface> elements) {
            this.elements = elements;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitArrayLiteralExpr(this);
        }
    }

    public static final class TupleLiteral implements ExprInterface {
        public final List<ExprInterface> elements;

        public TupleLiteral(List<ExprInterface> elements) {
            this.elements = elements;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitTupleLiteralExpr(this);
        }
    }

    /** Key/value pairs in source order. Keys are arbitrary expressions and may repeat. */
    public static final class MapLiteral implements ExprInterface {
        public final List<ExprInterface> keys;
        public final List<ExprInterface> values;

        public MapLiteral(List<ExprInterface> keys, List<ExprInterface> values) {
            this.keys = keys;
            this.values = values;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitMapLiteralExpr(this);
        }
    }
}
