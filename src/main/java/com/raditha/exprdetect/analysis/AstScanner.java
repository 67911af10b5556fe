package com.raditha.exprdetect.analysis;

import com.raditha.exprdetect.model.Expr;
import com.raditha.exprdetect.model.Stmt;
import com.raditha.exprdetect.model.VarDecl;

import java.util.function.Consumer;

/**
 * Exhaustive pre-order walks over a statement subtree. Unlike the selection
 * traversal these walks descend into every nested statement, including the
 * branches of an {@code if} and the bodies of loops, and visit case label
 * values and variable initializers alike.
 */
public final class AstScanner {

    private AstScanner() {
    }

    /**
     * Visit every expression node under {@code stmt} in pre-order.
     */
    public static void forEachExpr(Stmt stmt, Consumer<Expr> visitor) {
        forEachStmt(stmt, s -> {
            for (VarDecl variable : s.declarations()) {
                forEachExpr(variable.getInitializer(), visitor);
            }
            forEachExpr(s.expression(), visitor);
            forEachExpr(s.increment(), visitor);
        });
    }

    /**
     * Visit {@code expr} and all of its descendants in pre-order.
     */
    public static void forEachExpr(Expr expr, Consumer<Expr> visitor) {
        if (expr == null) {
            return;
        }
        visitor.accept(expr);
        for (Expr child : expr.children()) {
            forEachExpr(child, visitor);
        }
    }

    /**
     * Visit {@code stmt} and every statement nested in it in pre-order.
     */
    public static void forEachStmt(Stmt stmt, Consumer<Stmt> visitor) {
        if (stmt == null) {
            return;
        }
        visitor.accept(stmt);
        forEachStmt(stmt.initializer(), visitor);
        for (Stmt child : stmt.statements()) {
            forEachStmt(child, visitor);
        }
        forEachStmt(stmt.body(), visitor);
        forEachStmt(stmt.elseBranch(), visitor);
    }
}
