package com.raditha.exprdetect.model;

/**
 * Statement kinds.
 */
public enum StmtKind {
    COMPOUND,
    EXPRESSION,
    DECLARATION,
    IF,
    FOR,
    WHILE,
    DO,
    SWITCH,
    CASE,
    DEFAULT,
    LABEL,
    RETURN,
    BREAK,
    CONTINUE,
    GOTO,
    NULL;

    public boolean isLoop() {
        return this == FOR || this == WHILE || this == DO;
    }
}
