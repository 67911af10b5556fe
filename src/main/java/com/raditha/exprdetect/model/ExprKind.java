package com.raditha.exprdetect.model;

/**
 * Structural kind of an expression node.
 * <p>
 * Child order per kind: subscript (base, index), binary and compound assignment
 * (lhs, rhs), call (callee, arguments...), member (base), unary, cast, implicit
 * cast and paren (operand), conditional (condition, then, else), sizeof of an
 * expression (operand), initializer list (elements...). Literals, name
 * references and sizeof of a type have no children.
 */
public enum ExprKind {
    SUBSCRIPT,
    /** Arithmetic, relational, logical, bitwise, simple assignment and comma */
    BINARY,
    /** {@code +=}, {@code -=} and the other compound assignments */
    COMPOUND_ASSIGN,
    CALL,
    NAME_REF,
    MEMBER,
    UNARY,
    INTEGER_LITERAL,
    FLOATING_LITERAL,
    CHARACTER_LITERAL,
    STRING_LITERAL,
    /** Cast written in the source */
    CAST,
    /** Conversion inserted by the front end */
    IMPLICIT_CAST,
    PAREN,
    CONDITIONAL,
    SIZEOF,
    INIT_LIST
}
