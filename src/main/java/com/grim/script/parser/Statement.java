package com.grim.script.parser;

import java.util.List;

public class Statement {

    public interface Stmt {
        void accept(StmtVisitor visitor);
        StatementKind kind();
    }

    public interface StmtVisitor {
        void visitVarStmt(VarStmt stmt);
        void visitAssignStmt(AssignStmt stmt);
        void visitIfStmt(If stmt);
        void visitIfElseStmt(IfElse stmt);
        void visitWhileStmt(While stmt);
        void visitFunctionStmt(FunctionStmt stmt);
        void visitReturnStmt(ReturnStmt stmt);
        void visitPrintStmt(PrintStmt stmt);
        void visitInputStmt(InputStmt stmt);
    }

    public static final class VarStmt implements Stmt {
        public final String name;
        public final Expr.ExprInterface initializer;

        public VarStmt(String name, Expr.ExprInterface initializer) {
            this.name = name;
            this.initializer = initializer;
        }

        public void accept(StmtVisitor visitor) { visitor.visitVarStmt(this); }
        public StatementKind kind() { return StatementKind.VARIABLE_DECLARATION; }
    }

    public static final class AssignStmt implements Stmt {
        public final String name;
        public final Expr.ExprInterface value;

        public AssignStmt(String name, Expr.ExprInterface value) {
            this.name = name;
            this.value = value;
        }

        public void accept(StmtVisitor visitor) { visitor.visitAssignStmt(this); }
        public StatementKind kind() { return StatementKind.ASSIGNMENT; }
    }

    public static final class If implements Stmt {
        public final Expr.ExprInterface condition;
        public final List<Stmt> thenBranch;

        public If(Expr.ExprInterface condition, List<Stmt> thenBranch) {
            this.condition = condition;
            this.thenBranch = List.copyOf(thenBranch);
        }

        public void accept(StmtVisitor visitor) { visitor.visitIfStmt(this); }
        public StatementKind kind() { return StatementKind.IF; }
    }

    public static final class IfElse implements Stmt {
        public final Expr.ExprInterface condition;
        public final List<Stmt> thenBranch;
        public final List<Stmt> elseBranch;

        public IfElse(Expr.ExprInterface condition, List<Stmt> thenBranch, List<Stmt> elseBranch) {
            this.condition = condition;
            this.thenBranch = List.copyOf(thenBranch);
            this.elseBranch = List.copyOf(elseBranch);
        }

        public void accept(StmtVisitor visitor) { visitor.visitIfElseStmt(this); }
        public StatementKind kind() { return StatementKind.IF_ELSE; }
    }

    public static final class While implements Stmt {
        public final Expr.ExprInterface condition;
        public final List<Stmt> body;

        public While(Expr.ExprInterface condition, List<Stmt> body) {
            this.condition = condition;
            this.body = List.copyOf(body);
        }

        public void accept(StmtVisitor visitor) { visitor.visitWhileStmt(this); }
        public StatementKind kind() { return StatementKind.WHILE; }
    }

    public static final class FunctionStmt implements Stmt {
        public final String name;
        public final List<String> params;
        public final List<Stmt> body;

        public FunctionStmt(String name, List<String> params, List<Stmt> body) {
            this.name = name;
            this.params = List.copyOf(params);
            this.body = List.copyOf(body);
        }

        public void accept(StmtVisitor visitor) { visitor.visitFunctionStmt(this); }
        public StatementKind kind() { return StatementKind.FUNCTION_DECLARATION; }
    }

    public static final class ReturnStmt implements Stmt {
        public final Expr.ExprInterface value;

        public ReturnStmt(Expr.ExprInterface value) {
            this.value = value;
        }

        public void accept(StmtVisitor visitor) { visitor.visitReturnStmt(this); }
        public StatementKind kind() { return StatementKind.RETURN; }
    }

    public static final class PrintStmt implements Stmt {
        public final Expr.ExprInterface content;

        public PrintStmt(Expr.ExprInterface content) {
            this.content = content;
        }

        public void accept(StmtVisitor visitor) { visitor.visitPrintStmt(this); }
        public StatementKind kind() { return StatementKind.PRINT; }
    }

    public static final class InputStmt implements Stmt {
        public final String name;

        public InputStmt(String name) {
            this.name = name;
        }

        public void accept(StmtVisitor visitor) { visitor.visitInputStmt(this); }
        public StatementKind kind() { return StatementKind.INPUT; }
    }
}
