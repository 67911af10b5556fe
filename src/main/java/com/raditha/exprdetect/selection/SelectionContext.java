package com.raditha.exprdetect.selection;

import com.raditha.exprdetect.analysis.EligibilityCaches;
import com.raditha.exprdetect.model.Expr;
import com.raditha.exprdetect.model.FunctionDecl;
import com.raditha.exprdetect.model.Stmt;

/**
 * Mutable state of one selection pass: the running count, the capture, and
 * the current function and statement of the walk.
 */
class SelectionContext {

    private final int target;
    private final EligibilityCaches caches = new EligibilityCaches();
    private int count;
    private CapturedInstance captured;
    private FunctionDecl currentFunction;
    private Stmt currentStatement;
    private boolean currentUnbraced;

    SelectionContext(int target) {
        this.target = target;
    }

    void enterFunction(FunctionDecl function) {
        currentFunction = function;
        currentStatement = null;
        currentUnbraced = false;
    }

    void leaveFunction() {
        caches.clear();
        currentFunction = null;
        currentStatement = null;
    }

    void setCurrentStatement(Stmt statement, boolean unbraced) {
        currentStatement = statement;
        currentUnbraced = unbraced;
    }

    Stmt currentStatement() {
        return currentStatement;
    }

    EligibilityCaches caches() {
        return caches;
    }

    /**
     * Count an eligible expression and capture it when it is the target.
     *
     * @return true if this expression was captured
     */
    boolean countEligible(Expr expression) {
        count++;
        if (count == target) {
            captured = new CapturedInstance(currentFunction, currentStatement, expression, currentUnbraced);
            return true;
        }
        return false;
    }

    int count() {
        return count;
    }

    CapturedInstance captured() {
        return captured;
    }
}
