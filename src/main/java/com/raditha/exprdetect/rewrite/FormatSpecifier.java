package com.raditha.exprdetect.rewrite;

import com.raditha.exprdetect.model.CType;

/**
 * printf conversion for the value of a captured expression.
 */
final class FormatSpecifier {

    private FormatSpecifier() {
    }

    /**
     * Conversion letters, without the {@code %}, for the unqualified type of a
     * value.
     *
     * @throws IllegalStateException for types that are not integer or floating
     */
    static String of(CType type) {
        return switch (type.unqualified().kind()) {
            case BOOL, UNSIGNED_CHAR, UNSIGNED_SHORT, UNSIGNED_INT -> "u";
            case CHAR, SIGNED_CHAR, SHORT, INT, ENUM -> "d";
            case UNSIGNED_LONG -> "lu";
            case LONG -> "ld";
            case UNSIGNED_LONG_LONG -> "llu";
            case LONG_LONG -> "lld";
            case FLOAT, DOUBLE -> "f";
            case LONG_DOUBLE -> "Lf";
            default -> throw new IllegalStateException("No printf conversion for type " + type.spelling());
        };
    }
}
