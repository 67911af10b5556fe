package com.raditha.exprdetect.model;

/**
 * Binary operator codes, including assignment and comma.
 */
public enum BinaryOperator {
    MUL("*", 10),
    DIV("/", 10),
    REM("%", 10),
    ADD("+", 9),
    SUB("-", 9),
    SHL("<<", 8),
    SHR(">>", 8),
    LT("<", 7),
    GT(">", 7),
    LE("<=", 7),
    GE(">=", 7),
    EQ("==", 6),
    NE("!=", 6),
    BIT_AND("&", 5),
    BIT_XOR("^", 4),
    BIT_OR("|", 3),
    LOGICAL_AND("&&", 2),
    LOGICAL_OR("||", 1),
    ASSIGN("=", 0),
    MUL_ASSIGN("*=", 0),
    DIV_ASSIGN("/=", 0),
    REM_ASSIGN("%=", 0),
    ADD_ASSIGN("+=", 0),
    SUB_ASSIGN("-=", 0),
    SHL_ASSIGN("<<=", 0),
    SHR_ASSIGN(">>=", 0),
    AND_ASSIGN("&=", 0),
    XOR_ASSIGN("^=", 0),
    OR_ASSIGN("|=", 0),
    COMMA(",", -1);

    private final String spelling;
    private final int precedence;

    BinaryOperator(String spelling, int precedence) {
        this.spelling = spelling;
        this.precedence = precedence;
    }

    public String spelling() {
        return spelling;
    }

    /**
     * Binding strength of infix operators (higher binds tighter).
     * Assignment reports 0 and comma -1.
     */
    public int precedence() {
        return precedence;
    }

    public boolean isAssignment() {
        return precedence == 0;
    }

    public boolean isCompoundAssignment() {
        return isAssignment() && this != ASSIGN;
    }

    public boolean isComparison() {
        return this == LT || this == GT || this == LE || this == GE || this == EQ || this == NE;
    }

    public boolean isLogical() {
        return this == LOGICAL_AND || this == LOGICAL_OR;
    }

    public boolean isShift() {
        return this == SHL || this == SHR || this == SHL_ASSIGN || this == SHR_ASSIGN;
    }

    /**
     * Infix operator with the given spelling among the precedence-climbing
     * operators, or {@code null}.
     */
    public static BinaryOperator infix(String spelling) {
        for (BinaryOperator op : values()) {
            if (op.precedence > 0 && op.spelling.equals(spelling)) {
                return op;
            }
        }
        return null;
    }

    /**
     * Assignment operator with the given spelling, or {@code null}.
     */
    public static BinaryOperator assignment(String spelling) {
        for (BinaryOperator op : values()) {
            if (op.isAssignment() && op.spelling.equals(spelling)) {
                return op;
            }
        }
        return null;
    }
}
