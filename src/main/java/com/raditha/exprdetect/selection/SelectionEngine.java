package com.raditha.exprdetect.selection;

import com.raditha.exprdetect.analysis.AstScanner;
import com.raditha.exprdetect.analysis.EligibilityCaches;
import com.raditha.exprdetect.analysis.EligibilityFilter;
import com.raditha.exprdetect.analysis.NamingConvention;
import com.raditha.exprdetect.model.Dialect;
import com.raditha.exprdetect.model.Expr;
import com.raditha.exprdetect.model.FunctionDecl;
import com.raditha.exprdetect.model.Stmt;
import com.raditha.exprdetect.model.StmtKind;
import com.raditha.exprdetect.model.TranslationUnit;
import com.raditha.exprdetect.model.VarDecl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Counts the eligible instances of a translation unit and captures the one
 * with the requested ordinal.
 * <p>
 * Function definitions are walked in declaration order and expressions in
 * pre-order. Each direct child of a compound statement becomes the current
 * statement while its expressions are visited; {@code if}, loop and
 * {@code switch} statements are current for their own conditions and header
 * clauses, and their bodies are visited as statements in turn. Case label
 * values are not visited. Counting always runs to the end of the unit.
 */
public class SelectionEngine {

    private static final Logger logger = LoggerFactory.getLogger(SelectionEngine.class);

    private final EligibilityFilter filter;
    private final NamingConvention naming;

    public SelectionEngine(NamingConvention naming) {
        this(new EligibilityFilter(naming), naming);
    }

    public SelectionEngine(EligibilityFilter filter, NamingConvention naming) {
        this.filter = filter;
        this.naming = naming;
    }

    /**
     * Run the counting pass.
     *
     * @param unit   the parsed unit
     * @param target 1-based ordinal of the instance to capture
     * @return the count and, if the ordinal was reached, the captured instance
     */
    public SelectionResult select(TranslationUnit unit, int target) {
        if (target < 1) {
            throw new IllegalArgumentException("Instance ordinal must be at least 1, got " + target);
        }
        if (unit.getDialect() == Dialect.CXX) {
            logger.warn("Skipping C++ unit {}", unit.getFileName());
            return new SelectionResult(0, target, Optional.empty());
        }
        SelectionContext context = new SelectionContext(target);
        for (FunctionDecl function : unit.functionDefinitions()) {
            context.enterFunction(function);
            registerTemporaries(function, context.caches());
            visitAsStatement(function.getBody(), false, context);
            logger.debug("{}: {} eligible so far, {} temporaries, {} statement scans",
                    function.getName(), context.count(), context.caches().temporaryCount(),
                    context.caches().scanCount());
            context.leaveFunction();
        }
        return new SelectionResult(context.count(), target, Optional.ofNullable(context.captured()));
    }

    private void registerTemporaries(FunctionDecl function, EligibilityCaches caches) {
        AstScanner.forEachStmt(function.getBody(), s -> {
            for (VarDecl variable : s.declarations()) {
                if (naming.isTemporary(variable.getName())) {
                    caches.registerTemporary(variable);
                }
            }
        });
    }

    /**
     * Visit a statement in statement position: compound statements hand the
     * role of current statement to each child, anything else takes it.
     */
    private void visitAsStatement(Stmt stmt, boolean unbraced, SelectionContext context) {
        if (stmt == null) {
            return;
        }
        if (stmt.kind() == StmtKind.COMPOUND) {
            for (Stmt child : stmt.statements()) {
                visitAsStatement(child, false, context);
            }
            return;
        }
        context.setCurrentStatement(stmt, unbraced);
        traverse(stmt, unbraced, context);
    }

    private void traverse(Stmt stmt, boolean unbraced, SelectionContext context) {
        switch (stmt.kind()) {
            case IF -> {
                visitExpr(stmt.expression(), context);
                visitAsStatement(stmt.body(), true, context);
                visitAsStatement(stmt.elseBranch(), true, context);
            }
            case FOR -> {
                Stmt init = stmt.initializer();
                if (init != null) {
                    for (VarDecl variable : init.declarations()) {
                        visitExpr(variable.getInitializer(), context);
                    }
                    visitExpr(init.expression(), context);
                }
                visitExpr(stmt.expression(), context);
                visitExpr(stmt.increment(), context);
                visitAsStatement(stmt.body(), true, context);
            }
            case WHILE, SWITCH -> {
                visitExpr(stmt.expression(), context);
                visitAsStatement(stmt.body(), true, context);
            }
            case DO -> {
                visitAsStatement(stmt.body(), true, context);
                context.setCurrentStatement(stmt, unbraced);
                visitExpr(stmt.expression(), context);
            }
            case CASE, DEFAULT, LABEL -> visitAsStatement(stmt.body(), true, context);
            case EXPRESSION, RETURN -> visitExpr(stmt.expression(), context);
            case DECLARATION -> {
                for (VarDecl variable : stmt.declarations()) {
                    visitExpr(variable.getInitializer(), context);
                }
            }
            case COMPOUND, BREAK, CONTINUE, GOTO, NULL -> {
                // no expressions of their own
            }
        }
    }

    private void visitExpr(Expr expr, SelectionContext context) {
        if (expr == null) {
            return;
        }
        if (filter.isEligible(context.currentStatement(), expr, context.caches())
                && context.countEligible(expr)) {
            logger.debug("Captured instance {} at {}", context.count(), expr.range().toDisplayString());
        }
        for (Expr child : expr.children()) {
            visitExpr(child, context);
        }
    }
}
