package com.raditha.exprdetect.similarity;

import com.raditha.exprdetect.analysis.SideEffectAnalyzer;
import com.raditha.exprdetect.model.Expr;

import java.util.Arrays;
import java.util.List;

/**
 * Decides whether two expressions are structurally identical: same node
 * kinds, pairwise identical children and matching per-kind payload, after
 * parentheses and implicit conversions are stripped.
 * <p>
 * An expression with side effects is identical to nothing, not even to itself.
 * For pure expressions the relation is reflexive and symmetric.
 */
public class StructuralIdentity {

    private final SideEffectAnalyzer sideEffects;

    public StructuralIdentity() {
        this(new SideEffectAnalyzer());
    }

    public StructuralIdentity(SideEffectAnalyzer sideEffects) {
        this.sideEffects = sideEffects;
    }

    /**
     * @param first  an expression or {@code null}
     * @param second an expression or {@code null}
     * @return true if both are null or both denote the same computation
     */
    public boolean identical(Expr first, Expr second) {
        if (first == null || second == null) {
            return first == null && second == null;
        }
        Expr e1 = first.ignoreParenImpCasts();
        Expr e2 = second.ignoreParenImpCasts();
        if (e1.kind() != e2.kind()) {
            return false;
        }
        if (sideEffects.hasSideEffects(e1) || sideEffects.hasSideEffects(e2)) {
            return false;
        }
        List<Expr> c1 = e1.children();
        List<Expr> c2 = e2.children();
        if (c1.size() != c2.size()) {
            return false;
        }
        for (int i = 0; i < c1.size(); i++) {
            if (!identical(c1.get(i), c2.get(i))) {
                return false;
            }
        }
        return switch (e1.kind()) {
            case SUBSCRIPT, CALL -> true;
            case CAST -> e1.writtenType().equals(e2.writtenType());
            case MEMBER -> e1.member() == e2.member();
            case NAME_REF -> e1.declaration() == e2.declaration();
            case BINARY, COMPOUND_ASSIGN -> e1.binaryOperator() == e2.binaryOperator();
            case UNARY -> e1.unaryOperator() == e2.unaryOperator();
            case CHARACTER_LITERAL -> e1.integerValue().equals(e2.integerValue());
            case STRING_LITERAL -> Arrays.equals(e1.literalBytes(), e2.literalBytes());
            case INTEGER_LITERAL -> e1.type().kind().bitWidth() == e2.type().kind().bitWidth()
                    && e1.integerValue().equals(e2.integerValue());
            case FLOATING_LITERAL -> e1.type().kind() == e2.type().kind()
                    && e1.floatingValue().compareTo(e2.floatingValue()) == 0;
            default -> false;
        };
    }
}
