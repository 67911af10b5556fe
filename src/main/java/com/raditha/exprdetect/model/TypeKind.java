package com.raditha.exprdetect.model;

/**
 * Closed set of C type constructors known to the front end.
 */
public enum TypeKind {
    VOID("void", 0),
    BOOL("_Bool", 1),
    CHAR("char", 2),
    SIGNED_CHAR("signed char", 2),
    UNSIGNED_CHAR("unsigned char", 2),
    SHORT("short", 3),
    UNSIGNED_SHORT("unsigned short", 3),
    INT("int", 4),
    UNSIGNED_INT("unsigned int", 4),
    LONG("long", 5),
    UNSIGNED_LONG("unsigned long", 5),
    LONG_LONG("long long", 6),
    UNSIGNED_LONG_LONG("unsigned long long", 6),
    FLOAT("float", 1),
    DOUBLE("double", 2),
    LONG_DOUBLE("long double", 3),
    /** Enumerated type; arithmetic behaves like int */
    ENUM("enum", 4),
    POINTER("*", 0),
    ARRAY("[]", 0),
    FUNCTION("()", 0),
    STRUCT("struct", 0),
    UNION("union", 0);

    private final String spelling;
    private final int rank;

    TypeKind(String spelling, int rank) {
        this.spelling = spelling;
        this.rank = rank;
    }

    public String spelling() {
        return spelling;
    }

    /**
     * Conversion rank among integer kinds, or among floating kinds.
     * Zero for non-arithmetic kinds.
     */
    public int rank() {
        return rank;
    }

    public boolean isInteger() {
        return switch (this) {
            case BOOL, CHAR, SIGNED_CHAR, UNSIGNED_CHAR, SHORT, UNSIGNED_SHORT, INT, UNSIGNED_INT,
                    LONG, UNSIGNED_LONG, LONG_LONG, UNSIGNED_LONG_LONG, ENUM -> true;
            default -> false;
        };
    }

    public boolean isFloating() {
        return this == FLOAT || this == DOUBLE || this == LONG_DOUBLE;
    }

    public boolean isUnsigned() {
        return switch (this) {
            case BOOL, UNSIGNED_CHAR, UNSIGNED_SHORT, UNSIGNED_INT, UNSIGNED_LONG, UNSIGNED_LONG_LONG -> true;
            default -> false;
        };
    }

    /**
     * Storage size in bits on an LP64 target.
     */
    public int bitWidth() {
        return switch (this) {
            case BOOL, CHAR, SIGNED_CHAR, UNSIGNED_CHAR -> 8;
            case SHORT, UNSIGNED_SHORT -> 16;
            case INT, UNSIGNED_INT, ENUM, FLOAT -> 32;
            case LONG, UNSIGNED_LONG, LONG_LONG, UNSIGNED_LONG_LONG, DOUBLE, POINTER -> 64;
            case LONG_DOUBLE -> 128;
            default -> 0;
        };
    }

    /**
     * The unsigned kind with the same rank as this signed integer kind.
     */
    public TypeKind toUnsigned() {
        return switch (this) {
            case CHAR, SIGNED_CHAR -> UNSIGNED_CHAR;
            case SHORT -> UNSIGNED_SHORT;
            case INT, ENUM -> UNSIGNED_INT;
            case LONG -> UNSIGNED_LONG;
            case LONG_LONG -> UNSIGNED_LONG_LONG;
            default -> this;
        };
    }
}
