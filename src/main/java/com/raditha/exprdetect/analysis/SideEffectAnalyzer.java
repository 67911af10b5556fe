package com.raditha.exprdetect.analysis;

import com.raditha.exprdetect.model.Expr;

/**
 * Answers whether evaluating an expression may have an observable effect.
 * Calls, assignments, increments and decrements count as effects, and so do
 * reads of volatile objects. Operands of {@code sizeof} are not evaluated.
 */
public class SideEffectAnalyzer {

    public boolean hasSideEffects(Expr e) {
        if (e == null) {
            return false;
        }
        switch (e.kind()) {
            case CALL, COMPOUND_ASSIGN -> {
                return true;
            }
            case SIZEOF -> {
                return false;
            }
            case BINARY -> {
                if (e.binaryOperator().isAssignment()) {
                    return true;
                }
            }
            case UNARY -> {
                if (e.unaryOperator().isIncrementDecrement()) {
                    return true;
                }
            }
            case NAME_REF, MEMBER, SUBSCRIPT -> {
                if (e.type().isVolatile()) {
                    return true;
                }
            }
            default -> {
                // structural kinds: decided by the children
            }
        }
        for (Expr child : e.children()) {
            if (hasSideEffects(child)) {
                return true;
            }
        }
        return false;
    }
}
