package com.raditha.exprdetect.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

/**
 * Expression node. Nodes compare by identity; structural comparison lives in
 * {@code StructuralIdentity}.
 */
public final class Expr {

    private final ExprKind kind;
    private final Range range;
    private final CType type;
    private final List<Expr> children;

    private BinaryOperator binaryOperator;
    private UnaryOperator unaryOperator;
    private Decl declaration;
    private FieldDecl member;
    private boolean arrow;
    private CType writtenType;
    private BigInteger integerValue;
    private BigDecimal floatingValue;
    private byte[] literalBytes;

    private Expr(ExprKind kind, Range range, CType type, List<Expr> children) {
        this.kind = kind;
        this.range = range;
        this.type = type;
        this.children = List.copyOf(children);
    }

    public static Expr subscript(Range range, CType type, Expr base, Expr index) {
        return new Expr(ExprKind.SUBSCRIPT, range, type, List.of(base, index));
    }

    /**
     * Binary operator node; compound assignments get {@link ExprKind#COMPOUND_ASSIGN}.
     */
    public static Expr binary(Range range, CType type, BinaryOperator op, Expr lhs, Expr rhs) {
        ExprKind kind = op.isCompoundAssignment() ? ExprKind.COMPOUND_ASSIGN : ExprKind.BINARY;
        Expr e = new Expr(kind, range, type, List.of(lhs, rhs));
        e.binaryOperator = op;
        return e;
    }

    public static Expr unary(Range range, CType type, UnaryOperator op, Expr operand) {
        Expr e = new Expr(ExprKind.UNARY, range, type, List.of(operand));
        e.unaryOperator = op;
        return e;
    }

    public static Expr call(Range range, CType type, Expr callee, List<Expr> arguments) {
        Expr[] all = new Expr[arguments.size() + 1];
        all[0] = callee;
        for (int i = 0; i < arguments.size(); i++) {
            all[i + 1] = arguments.get(i);
        }
        return new Expr(ExprKind.CALL, range, type, List.of(all));
    }

    public static Expr nameRef(Range range, CType type, Decl declaration) {
        Expr e = new Expr(ExprKind.NAME_REF, range, type, List.of());
        e.declaration = declaration;
        return e;
    }

    public static Expr member(Range range, CType type, Expr base, FieldDecl member, boolean arrow) {
        Expr e = new Expr(ExprKind.MEMBER, range, type, List.of(base));
        e.member = member;
        e.arrow = arrow;
        return e;
    }

    public static Expr integerLiteral(Range range, CType type, BigInteger value) {
        Expr e = new Expr(ExprKind.INTEGER_LITERAL, range, type, List.of());
        e.integerValue = value;
        return e;
    }

    public static Expr floatingLiteral(Range range, CType type, BigDecimal value) {
        Expr e = new Expr(ExprKind.FLOATING_LITERAL, range, type, List.of());
        e.floatingValue = value;
        return e;
    }

    public static Expr characterLiteral(Range range, CType type, int value) {
        Expr e = new Expr(ExprKind.CHARACTER_LITERAL, range, type, List.of());
        e.integerValue = BigInteger.valueOf(value);
        return e;
    }

    public static Expr stringLiteral(Range range, CType type, byte[] bytes) {
        Expr e = new Expr(ExprKind.STRING_LITERAL, range, type, List.of());
        e.literalBytes = bytes.clone();
        return e;
    }

    public static Expr cast(Range range, CType writtenType, Expr operand) {
        Expr e = new Expr(ExprKind.CAST, range, writtenType, List.of(operand));
        e.writtenType = writtenType;
        return e;
    }

    /**
     * Conversion of {@code operand} to {@code type}; shares the operand's range.
     */
    public static Expr implicitCast(CType type, Expr operand) {
        return new Expr(ExprKind.IMPLICIT_CAST, operand.range, type, List.of(operand));
    }

    public static Expr paren(Range range, Expr inner) {
        return new Expr(ExprKind.PAREN, range, inner.type, List.of(inner));
    }

    public static Expr conditional(Range range, CType type, Expr condition, Expr then, Expr otherwise) {
        return new Expr(ExprKind.CONDITIONAL, range, type, List.of(condition, then, otherwise));
    }

    public static Expr sizeofExpr(Range range, Expr operand) {
        return new Expr(ExprKind.SIZEOF, range, CType.UNSIGNED_LONG, List.of(operand));
    }

    public static Expr sizeofType(Range range, CType argument) {
        Expr e = new Expr(ExprKind.SIZEOF, range, CType.UNSIGNED_LONG, List.of());
        e.writtenType = argument;
        return e;
    }

    public static Expr initList(Range range, CType type, List<Expr> elements) {
        return new Expr(ExprKind.INIT_LIST, range, type, elements);
    }

    public ExprKind kind() {
        return kind;
    }

    public Range range() {
        return range;
    }

    public CType type() {
        return type;
    }

    public List<Expr> children() {
        return children;
    }

    public Expr child(int index) {
        return children.get(index);
    }

    public BinaryOperator binaryOperator() {
        return binaryOperator;
    }

    public UnaryOperator unaryOperator() {
        return unaryOperator;
    }

    /**
     * Resolved declaration of a name reference.
     */
    public Decl declaration() {
        return declaration;
    }

    /**
     * Resolved member of a member access.
     */
    public FieldDecl member() {
        return member;
    }

    public boolean isArrow() {
        return arrow;
    }

    /**
     * Target type of a cast, or the type operand of {@code sizeof(type)}.
     */
    public CType writtenType() {
        return writtenType;
    }

    /**
     * Value of an integer or character literal.
     */
    public BigInteger integerValue() {
        return integerValue;
    }

    public BigDecimal floatingValue() {
        return floatingValue;
    }

    public byte[] literalBytes() {
        return literalBytes == null ? null : literalBytes.clone();
    }

    /**
     * Strip parentheses and implicit conversions.
     */
    public Expr ignoreParenImpCasts() {
        Expr e = this;
        while (e.kind == ExprKind.PAREN || e.kind == ExprKind.IMPLICIT_CAST) {
            e = e.children.get(0);
        }
        return e;
    }

    /**
     * Strip parentheses and all casts, written or implicit.
     */
    public Expr ignoreParenCasts() {
        Expr e = this;
        while (e.kind == ExprKind.PAREN || e.kind == ExprKind.IMPLICIT_CAST || e.kind == ExprKind.CAST) {
            e = e.children.get(0);
        }
        return e;
    }

    /**
     * Name reference to a variable, or {@code null}.
     */
    public VarDecl referencedVariable() {
        if (kind == ExprKind.NAME_REF && declaration instanceof VarDecl variable) {
            return variable;
        }
        return null;
    }

    /**
     * The function named directly by the callee of a call, or {@code null}.
     */
    public FunctionDecl directCallee() {
        if (kind != ExprKind.CALL) {
            return null;
        }
        Expr callee = children.get(0).ignoreParenImpCasts();
        if (callee.kind == ExprKind.NAME_REF && callee.declaration instanceof FunctionDecl function) {
            return function;
        }
        return null;
    }

    @Override
    public String toString() {
        return kind + "@" + range;
    }
}
