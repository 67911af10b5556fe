package com.raditha.exprdetect.model;

import java.util.List;

/**
 * Statement node. Nodes compare by identity; they key the per-statement caches
 * of the selection pass.
 * <p>
 * Field use per kind:
 * <ul>
 * <li>COMPOUND: {@link #statements()}</li>
 * <li>EXPRESSION, RETURN: {@link #expression()} (RETURN may have none)</li>
 * <li>DECLARATION: {@link #declarations()}, {@link #declaresTag()}</li>
 * <li>IF: {@link #expression()} condition, {@link #body()} then, {@link #elseBranch()}</li>
 * <li>WHILE, DO, SWITCH: {@link #expression()} condition, {@link #body()}</li>
 * <li>FOR: {@link #initializer()}, {@link #expression()} condition, {@link #increment()}, {@link #body()}</li>
 * <li>CASE: {@link #expression()} label value, {@link #body()}; DEFAULT: {@link #body()}</li>
 * <li>LABEL: {@link #label()}, {@link #body()}; GOTO: {@link #label()}</li>
 * </ul>
 */
public final class Stmt {

    private final StmtKind kind;
    private final Range range;
    private List<Stmt> statements = List.of();
    private List<VarDecl> declarations = List.of();
    private boolean declaresTag;
    private Expr expression;
    private Stmt initializer;
    private Expr increment;
    private Stmt body;
    private Stmt elseBranch;
    private String label;

    private Stmt(StmtKind kind, Range range) {
        this.kind = kind;
        this.range = range;
    }

    public static Stmt compound(Range range, List<Stmt> statements) {
        Stmt s = new Stmt(StmtKind.COMPOUND, range);
        s.statements = List.copyOf(statements);
        return s;
    }

    public static Stmt expression(Range range, Expr expression) {
        Stmt s = new Stmt(StmtKind.EXPRESSION, range);
        s.expression = expression;
        return s;
    }

    public static Stmt declaration(Range range, List<VarDecl> declarations) {
        return declaration(range, declarations, false);
    }

    /**
     * @param declaresTag whether the statement also declares a struct, union
     *                    or enum tag, as {@code struct T { int f; } t;} does
     */
    public static Stmt declaration(Range range, List<VarDecl> declarations, boolean declaresTag) {
        Stmt s = new Stmt(StmtKind.DECLARATION, range);
        s.declarations = List.copyOf(declarations);
        s.declaresTag = declaresTag;
        return s;
    }

    public static Stmt ifStmt(Range range, Expr condition, Stmt then, Stmt elseBranch) {
        Stmt s = new Stmt(StmtKind.IF, range);
        s.expression = condition;
        s.body = then;
        s.elseBranch = elseBranch;
        return s;
    }

    public static Stmt forStmt(Range range, Stmt initializer, Expr condition, Expr increment, Stmt body) {
        Stmt s = new Stmt(StmtKind.FOR, range);
        s.initializer = initializer;
        s.expression = condition;
        s.increment = increment;
        s.body = body;
        return s;
    }

    public static Stmt whileStmt(Range range, Expr condition, Stmt body) {
        Stmt s = new Stmt(StmtKind.WHILE, range);
        s.expression = condition;
        s.body = body;
        return s;
    }

    public static Stmt doStmt(Range range, Stmt body, Expr condition) {
        Stmt s = new Stmt(StmtKind.DO, range);
        s.expression = condition;
        s.body = body;
        return s;
    }

    public static Stmt switchStmt(Range range, Expr condition, Stmt body) {
        Stmt s = new Stmt(StmtKind.SWITCH, range);
        s.expression = condition;
        s.body = body;
        return s;
    }

    public static Stmt caseStmt(Range range, Expr value, Stmt body) {
        Stmt s = new Stmt(StmtKind.CASE, range);
        s.expression = value;
        s.body = body;
        return s;
    }

    public static Stmt defaultStmt(Range range, Stmt body) {
        Stmt s = new Stmt(StmtKind.DEFAULT, range);
        s.body = body;
        return s;
    }

    public static Stmt labelStmt(Range range, String label, Stmt body) {
        Stmt s = new Stmt(StmtKind.LABEL, range);
        s.label = label;
        s.body = body;
        return s;
    }

    public static Stmt returnStmt(Range range, Expr value) {
        Stmt s = new Stmt(StmtKind.RETURN, range);
        s.expression = value;
        return s;
    }

    public static Stmt gotoStmt(Range range, String label) {
        Stmt s = new Stmt(StmtKind.GOTO, range);
        s.label = label;
        return s;
    }

    /**
     * {@code break;}, {@code continue;} or the empty statement.
     */
    public static Stmt simple(StmtKind kind, Range range) {
        if (kind != StmtKind.BREAK && kind != StmtKind.CONTINUE && kind != StmtKind.NULL) {
            throw new IllegalArgumentException("Not a simple statement kind: " + kind);
        }
        return new Stmt(kind, range);
    }

    public StmtKind kind() {
        return kind;
    }

    public Range range() {
        return range;
    }

    public List<Stmt> statements() {
        return statements;
    }

    public List<VarDecl> declarations() {
        return declarations;
    }

    public boolean declaresTag() {
        return declaresTag;
    }

    public Expr expression() {
        return expression;
    }

    public Stmt initializer() {
        return initializer;
    }

    public Expr increment() {
        return increment;
    }

    public Stmt body() {
        return body;
    }

    public Stmt elseBranch() {
        return elseBranch;
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return kind + "@" + range;
    }
}
