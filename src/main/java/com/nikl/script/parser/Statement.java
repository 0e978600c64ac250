package com.nikl.script.parser;

import java.util.List;

public class Statement {

    public interface Stmt {
        <R> R accept(StmtVisitor<R> visitor);
    }

    public interface StmtVisitor<R> {
        R visitExprStmt(ExprStmt stmt);
        R visitLetStmt(LetStmt stmt);
        R visitFunctionStmt(FunctionStmt stmt);
        R visitIfStmt(If stmt);
        R visitWhileStmt(While stmt);
        R visitForStmt(For stmt);
        R visitLoopStmt(Loop stmt);
        R visitReturnStmt(ReturnStmt stmt);
        R visitBreakStmt(BreakStmt stmt);
        R visitContinueStmt(ContinueStmt stmt);
        R visitDeleteStmt(DeleteStmt stmt);
        R visitImportStmt(ImportStmt stmt);
    }

    public static final class ExprStmt implements Stmt {
        public final Expr.ExprInterface expression;
        ExprStmt(Expr.ExprInterface expression) { this.expression = expression; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitExprStmt(this); }
    }

    /** {@code let name = init} or {@code const name = init}. */
    public static final class LetStmt implements Stmt {
        public final Token name;
        public final Expr.ExprInterface initializer;
        public final boolean constant;
        LetStmt(Token name, Expr.ExprInterface initializer, boolean constant) {
            this.name = name;
            this.initializer = initializer;
            this.constant = constant;
        }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitLetStmt(this); }
    }

    public static final class FunctionStmt implements Stmt {
        public final Token name;
        public final List<Token> params;
        public final List<Stmt> body;

        FunctionStmt(Token name, List<Token> params, List<Stmt> body) {
            this.name = name;
            this.params = params;
            this.body = body;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitFunctionStmt(this); }
    }

    public static final class ElifBranch {
        public final Expr.ExprInterface condition;
        public final List<Stmt> body;
        ElifBranch(Expr.ExprInterface condition, List<Stmt> body) {
            this.condition = condition;
            this.body = body;
        }
    }

    public static final class If implements Stmt {
        public final Expr.ExprInterface condition;
        public final List<Stmt> thenBranch;
        public final List<ElifBranch> elifs;
        public final List<Stmt> elseBranch; // may be null
        If(Expr.ExprInterface condition, List<Stmt> thenBranch, List<ElifBranch> elifs, List<Stmt> elseBranch) {
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elifs = elifs;
            this.elseBranch = elseBranch;
        }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitIfStmt(this); }
    }

    public static final class While implements Stmt {
        public final Expr.ExprInterface condition;
        public final List<Stmt> body;
        While(Expr.ExprInterface condition, List<Stmt> body) {
            this.condition = condition;
            this.body = body;
        }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitWhileStmt(this); }
    }

    public static final class For implements Stmt {
        public final Token name;
        public final Token secondName; // may be null
        public final Expr.ExprInterface iterable;
        public final List<Stmt> body;
        For(Token name, Token secondName, Expr.ExprInterface iterable, List<Stmt> body) {
            this.name = name;
            this.secondName = secondName;
            this.iterable = iterable;
            this.body = body;
        }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitForStmt(this); }
    }

    public static final class Loop implements Stmt {
        public final List<Stmt> body;
        Loop(List<Stmt> body) { this.body = body; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitLoopStmt(this); }
    }

    public static final class ReturnStmt implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface value;

        ReturnStmt(Token keyword, Expr.ExprInterface value) {
            this.keyword = keyword;
            this.value = value;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitReturnStmt(this); }
    }

    public static final class BreakStmt implements Stmt {
        public final Token keyword;
        BreakStmt(Token keyword) { this.keyword = keyword; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitBreakStmt(this); }
    }

    public static final class ContinueStmt implements Stmt {
        public final Token keyword;
        ContinueStmt(Token keyword) { this.keyword = keyword; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitContinueStmt(this); }
    }

    public static final class DeleteStmt implements Stmt {
        public final Token name;
        DeleteStmt(Token name) { this.name = name; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitDeleteStmt(this); }
    }

    public static final class ImportStmt implements Stmt {
        public final Token keyword;
        public final String path;
        public final Token alias;
        ImportStmt(Token keyword, String path, Token alias) {
            this.keyword = keyword;
            this.path = path;
            this.alias = alias;
        }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitImportStmt(this); }
    }
}
