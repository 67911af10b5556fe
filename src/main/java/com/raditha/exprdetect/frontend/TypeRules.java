package com.raditha.exprdetect.frontend;

import com.raditha.exprdetect.model.CType;
import com.raditha.exprdetect.model.Expr;
import com.raditha.exprdetect.model.TypeKind;

import java.math.BigInteger;

/**
 * C conversion rules for an LP64 target.
 */
final class TypeRules {

    private TypeRules() {
    }

    /**
     * Integer promotion: types ranked below {@code int} and enums become
     * {@code int}; everything else loses its qualifiers.
     */
    static CType promote(CType type) {
        CType t = type.unqualified();
        if (t.isInteger() && (t.kind() == TypeKind.ENUM || t.kind().rank() < TypeKind.INT.rank())) {
            return CType.INT;
        }
        return t;
    }

    /**
     * Common type of the usual arithmetic conversions.
     */
    static CType commonType(CType a, CType b) {
        CType left = promote(a);
        CType right = promote(b);
        if (left.isFloating() || right.isFloating()) {
            if (!right.isFloating()) {
                return left;
            }
            if (!left.isFloating()) {
                return right;
            }
            return left.kind().rank() >= right.kind().rank() ? left : right;
        }
        if (left.equals(right)) {
            return left;
        }
        TypeKind l = left.kind();
        TypeKind r = right.kind();
        if (l.isUnsigned() == r.isUnsigned()) {
            return l.rank() >= r.rank() ? left : right;
        }
        TypeKind unsigned = l.isUnsigned() ? l : r;
        TypeKind signed = l.isUnsigned() ? r : l;
        if (unsigned.rank() >= signed.rank()) {
            return CType.builtin(unsigned);
        }
        if (signed.bitWidth() > unsigned.bitWidth()) {
            return CType.builtin(signed);
        }
        return CType.builtin(signed.toUnsigned());
    }

    /**
     * Wrap {@code e} in an implicit conversion when its arithmetic type differs
     * from the arithmetic {@code target}.
     */
    static Expr convert(Expr e, CType target) {
        CType from = e.type();
        if (from == null || target == null || !from.isArithmetic() || !target.isArithmetic()) {
            return e;
        }
        CType to = target.unqualified();
        if (from.unqualified().equals(to)) {
            return e;
        }
        return Expr.implicitCast(to, e);
    }

    /**
     * Type of an unsuffixed or suffixed integer constant with the given value.
     */
    static CType integerConstantType(BigInteger value, boolean decimal, boolean unsignedSuffix,
            int longSuffixes) {
        TypeKind[] candidates;
        if (longSuffixes >= 2) {
            candidates = unsignedSuffix || !decimal
                    ? kinds(unsignedSuffix, TypeKind.LONG_LONG, TypeKind.UNSIGNED_LONG_LONG)
                    : new TypeKind[] { TypeKind.LONG_LONG };
        } else if (longSuffixes == 1) {
            candidates = decimal && !unsignedSuffix
                    ? new TypeKind[] { TypeKind.LONG, TypeKind.LONG_LONG }
                    : kinds(unsignedSuffix, TypeKind.LONG, TypeKind.UNSIGNED_LONG, TypeKind.LONG_LONG,
                            TypeKind.UNSIGNED_LONG_LONG);
        } else if (decimal && !unsignedSuffix) {
            candidates = new TypeKind[] { TypeKind.INT, TypeKind.LONG, TypeKind.LONG_LONG };
        } else {
            candidates = kinds(unsignedSuffix, TypeKind.INT, TypeKind.UNSIGNED_INT, TypeKind.LONG,
                    TypeKind.UNSIGNED_LONG, TypeKind.LONG_LONG, TypeKind.UNSIGNED_LONG_LONG);
        }
        for (TypeKind kind : candidates) {
            if (fits(value, kind)) {
                return CType.builtin(kind);
            }
        }
        return CType.builtin(TypeKind.UNSIGNED_LONG_LONG);
    }

    private static TypeKind[] kinds(boolean unsignedOnly, TypeKind... all) {
        if (!unsignedOnly) {
            return all;
        }
        return java.util.Arrays.stream(all).filter(TypeKind::isUnsigned).toArray(TypeKind[]::new);
    }

    private static boolean fits(BigInteger value, TypeKind kind) {
        int bits = kind.isUnsigned() ? kind.bitWidth() : kind.bitWidth() - 1;
        return value.bitLength() <= bits;
    }
}
