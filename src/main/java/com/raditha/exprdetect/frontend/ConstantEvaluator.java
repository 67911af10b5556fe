package com.raditha.exprdetect.frontend;

import com.raditha.exprdetect.model.EnumConstantDecl;
import com.raditha.exprdetect.model.Expr;

import java.math.BigInteger;

/**
 * Folds integer constant expressions such as enumerator values and array
 * bounds. Results are mathematical integers; no wraparound is modelled.
 */
final class ConstantEvaluator {

    private ConstantEvaluator() {
    }

    /**
     * @return the value, or {@code null} when {@code e} is not a foldable
     *         integer constant expression
     */
    static BigInteger evaluate(Expr e) {
        switch (e.kind()) {
            case INTEGER_LITERAL, CHARACTER_LITERAL -> {
                return e.integerValue();
            }
            case PAREN, IMPLICIT_CAST -> {
                return evaluate(e.child(0));
            }
            case CAST -> {
                return e.type().isInteger() ? evaluate(e.child(0)) : null;
            }
            case NAME_REF -> {
                return e.declaration() instanceof EnumConstantDecl constant ? constant.getValue() : null;
            }
            case UNARY -> {
                BigInteger v = evaluate(e.child(0));
                if (v == null) {
                    return null;
                }
                return switch (e.unaryOperator()) {
                    case PLUS -> v;
                    case MINUS -> v.negate();
                    case NOT -> v.not();
                    case LOGICAL_NOT -> truth(v.signum() == 0);
                    default -> null;
                };
            }
            case BINARY -> {
                return evaluateBinary(e);
            }
            case CONDITIONAL -> {
                BigInteger c = evaluate(e.child(0));
                if (c == null) {
                    return null;
                }
                return evaluate(c.signum() != 0 ? e.child(1) : e.child(2));
            }
            default -> {
                return null;
            }
        }
    }

    private static BigInteger evaluateBinary(Expr e) {
        BigInteger l = evaluate(e.child(0));
        BigInteger r = evaluate(e.child(1));
        if (l == null || r == null) {
            return null;
        }
        return switch (e.binaryOperator()) {
            case ADD -> l.add(r);
            case SUB -> l.subtract(r);
            case MUL -> l.multiply(r);
            case DIV -> r.signum() == 0 ? null : l.divide(r);
            case REM -> r.signum() == 0 ? null : l.remainder(r);
            case SHL -> l.shiftLeft(r.intValue());
            case SHR -> l.shiftRight(r.intValue());
            case BIT_AND -> l.and(r);
            case BIT_OR -> l.or(r);
            case BIT_XOR -> l.xor(r);
            case LT -> truth(l.compareTo(r) < 0);
            case GT -> truth(l.compareTo(r) > 0);
            case LE -> truth(l.compareTo(r) <= 0);
            case GE -> truth(l.compareTo(r) >= 0);
            case EQ -> truth(l.equals(r));
            case NE -> truth(!l.equals(r));
            case LOGICAL_AND -> truth(l.signum() != 0 && r.signum() != 0);
            case LOGICAL_OR -> truth(l.signum() != 0 || r.signum() != 0);
            case COMMA -> r;
            default -> null;
        };
    }

    private static BigInteger truth(boolean value) {
        return value ? BigInteger.ONE : BigInteger.ZERO;
    }
}
