package com.raditha.exprdetect.model;

/**
 * Unary operator codes.
 */
public enum UnaryOperator {
    POST_INC("++", true),
    POST_DEC("--", true),
    PRE_INC("++", false),
    PRE_DEC("--", false),
    ADDR_OF("&", false),
    DEREF("*", false),
    PLUS("+", false),
    MINUS("-", false),
    NOT("~", false),
    LOGICAL_NOT("!", false);

    private final String spelling;
    private final boolean postfix;

    UnaryOperator(String spelling, boolean postfix) {
        this.spelling = spelling;
        this.postfix = postfix;
    }

    public String spelling() {
        return spelling;
    }

    public boolean isPostfix() {
        return postfix;
    }

    public boolean isIncrementDecrement() {
        return this == POST_INC || this == POST_DEC || this == PRE_INC || this == PRE_DEC;
    }

    /**
     * Prefix operator with the given spelling, or {@code null}.
     */
    public static UnaryOperator prefix(String spelling) {
        for (UnaryOperator op : values()) {
            if (!op.postfix && op.spelling.equals(spelling)) {
                return op;
            }
        }
        return null;
    }
}
