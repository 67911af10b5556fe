package com.raditha.exprdetect.analysis;

import com.raditha.exprdetect.model.Expr;
import com.raditha.exprdetect.model.ExprKind;
import com.raditha.exprdetect.model.Stmt;
import com.raditha.exprdetect.model.UnaryOperator;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Collects the expressions of a statement that are written to or whose
 * address is taken: operands of increment, decrement and address-of, and the
 * left-hand sides of simple and compound assignments. Each is recorded with
 * parentheses and implicit conversions stripped.
 * <p>
 * Replacing such an operand with a temporary would redirect the write to the
 * temporary, e.g. {@code x++} would become an increment of the copy.
 */
public class WriteContextScanner {

    /**
     * @return identity set of the excluded expressions
     */
    public Set<Expr> scan(Stmt stmt) {
        Set<Expr> excluded = Collections.newSetFromMap(new IdentityHashMap<>());
        AstScanner.forEachExpr(stmt, e -> {
            if (e.kind() == ExprKind.UNARY) {
                UnaryOperator op = e.unaryOperator();
                if (op.isIncrementDecrement() || op == UnaryOperator.ADDR_OF) {
                    excluded.add(e.child(0).ignoreParenImpCasts());
                }
            } else if (e.kind() == ExprKind.COMPOUND_ASSIGN
                    || (e.kind() == ExprKind.BINARY && e.binaryOperator().isAssignment())) {
                excluded.add(e.child(0).ignoreParenImpCasts());
            }
        });
        return excluded;
    }
}
