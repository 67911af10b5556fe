package com.raditha.exprdetect.analysis;

import com.raditha.exprdetect.model.BinaryOperator;
import com.raditha.exprdetect.model.CType;
import com.raditha.exprdetect.model.Decl;
import com.raditha.exprdetect.model.Expr;
import com.raditha.exprdetect.model.ExprKind;
import com.raditha.exprdetect.model.FunctionDecl;
import com.raditha.exprdetect.model.Stmt;
import com.raditha.exprdetect.model.StmtKind;
import com.raditha.exprdetect.model.UnaryOperator;
import com.raditha.exprdetect.model.VarDecl;
import com.raditha.exprdetect.similarity.StructuralIdentity;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Decides whether an expression, seen while {@code stmt} is the current
 * statement, is an instance worth instrumenting.
 * <p>
 * The check is stateful: an accepted expression is remembered for its
 * statement so that later structurally identical expressions in the same
 * statement are rejected. Callers must therefore ask exactly once per visited
 * node, in traversal order.
 */
public class EligibilityFilter {

    /** Function whose argument lists are never instrumented. */
    public static final String REPORTING_FUNCTION = "printf";

    private static final Set<ExprKind> CANDIDATE_KINDS = EnumSet.of(
            ExprKind.SUBSCRIPT, ExprKind.BINARY, ExprKind.CALL,
            ExprKind.NAME_REF, ExprKind.MEMBER, ExprKind.UNARY);

    private final NamingConvention naming;
    private final StructuralIdentity identity;
    private final WriteContextScanner writeContextScanner;
    private final TemporaryReferenceCollector temporaryCollector;

    public EligibilityFilter(NamingConvention naming) {
        this(naming, new StructuralIdentity());
    }

    public EligibilityFilter(NamingConvention naming, StructuralIdentity identity) {
        this.naming = naming;
        this.identity = identity;
        this.writeContextScanner = new WriteContextScanner();
        this.temporaryCollector = new TemporaryReferenceCollector(naming);
    }

    /**
     * Kind and type pre-check: subscripts, binary operators (including simple
     * assignment and comma), calls, name references, member accesses and unary
     * operators of integer or floating type.
     */
    public boolean isCandidate(Expr e) {
        return CANDIDATE_KINDS.contains(e.kind())
                && e.type() != null
                && e.type().classify() != CType.Classification.OTHER;
    }

    /**
     * Full eligibility check of {@code e} under statement {@code stmt}.
     *
     * @param stmt   the current statement of the traversal
     * @param e      the visited expression
     * @param caches per-function memo tables
     * @return true if {@code e} counts as an instance
     */
    public boolean isEligible(Stmt stmt, Expr e, EligibilityCaches caches) {
        if (!isCandidate(e)) {
            return false;
        }
        if (stmt.kind().isLoop()) {
            return false;
        }
        if (stmt.kind() == StmtKind.EXPRESSION && stmt.expression().ignoreParenCasts() == e) {
            return false;
        }
        if (stmt.kind() == StmtKind.DECLARATION && !isInstrumentableDeclaration(stmt)) {
            return false;
        }
        if (isGuardTest(stmt, e) || isReferenceCheck(stmt, e)) {
            return false;
        }
        if (e.kind() == ExprKind.NAME_REF && isExcludedReference(stmt, e)) {
            return false;
        }
        if (caches.writeContextsOf(stmt, writeContextScanner::scan).contains(e)) {
            return false;
        }
        List<Expr> accepted = caches.acceptedFor(stmt);
        for (Expr previous : accepted) {
            if (identity.identical(previous, e)) {
                return false;
            }
        }
        accepted.add(e);
        for (VarDecl temporary : caches.temporariesIn(stmt, temporaryCollector::collect)) {
            Expr init = caches.initializerOf(temporary);
            if (init != null && identity.identical(init, e)) {
                return false;
            }
        }
        return true;
    }

    /**
     * A declaration statement qualifies when it declares one named,
     * non-reserved variable and nothing else; a tag declared alongside the
     * variable makes it a group. Declarations of types or functions only
     * contain no visited expressions.
     */
    private boolean isInstrumentableDeclaration(Stmt stmt) {
        List<VarDecl> declared = stmt.declarations();
        if (declared.size() + (stmt.declaresTag() ? 1 : 0) > 1) {
            return false;
        }
        if (declared.isEmpty()) {
            return true;
        }
        String name = declared.get(0).getName();
        return name != null && !naming.isReserved(name);
    }

    /**
     * {@code !guard}, and {@code guard == N} as the condition of an {@code if}.
     */
    private boolean isGuardTest(Stmt stmt, Expr e) {
        if (e.kind() == ExprKind.UNARY && e.unaryOperator() == UnaryOperator.LOGICAL_NOT) {
            return isGuardReference(e.child(0));
        }
        return stmt.kind() == StmtKind.IF
                && e.kind() == ExprKind.BINARY
                && e.binaryOperator() == BinaryOperator.EQ
                && isGuardReference(e.child(0));
    }

    private boolean isGuardReference(Expr e) {
        Expr stripped = e.ignoreParenCasts();
        return stripped.kind() == ExprKind.NAME_REF && naming.isGuard(stripped.declaration().getName());
    }

    /**
     * {@code temp != literal} as the condition of an {@code if}, and the
     * negated literal on its right.
     */
    private boolean isReferenceCheck(Stmt stmt, Expr e) {
        if (stmt.kind() != StmtKind.IF) {
            return false;
        }
        if (isReferenceComparison(e)) {
            return true;
        }
        if (e.kind() != ExprKind.UNARY || !isLiteral(e)) {
            return false;
        }
        Expr condition = stmt.expression().ignoreParenCasts();
        return isReferenceComparison(condition) && condition.child(1).ignoreParenCasts() == e;
    }

    private boolean isReferenceComparison(Expr e) {
        if (e.kind() != ExprKind.BINARY || e.binaryOperator() != BinaryOperator.NE) {
            return false;
        }
        Expr lhs = e.child(0).ignoreParenCasts();
        Expr rhs = e.child(1).ignoreParenCasts();
        return lhs.kind() == ExprKind.NAME_REF
                && naming.isTemporary(lhs.declaration().getName())
                && isLiteral(rhs);
    }

    private static boolean isLiteral(Expr e) {
        if (e.kind() == ExprKind.UNARY && e.unaryOperator() == UnaryOperator.MINUS) {
            e = e.child(0).ignoreParenCasts();
        }
        return e.kind() == ExprKind.INTEGER_LITERAL || e.kind() == ExprKind.FLOATING_LITERAL;
    }

    private boolean isExcludedReference(Stmt stmt, Expr e) {
        Decl decl = e.declaration();
        if (naming.isReserved(decl) || decl.isImplicit()) {
            return true;
        }
        if (stmt.kind() == StmtKind.EXPRESSION && stmt.expression().kind() == ExprKind.CALL) {
            FunctionDecl callee = stmt.expression().directCallee();
            return callee != null && REPORTING_FUNCTION.equals(callee.getName());
        }
        return false;
    }
}
