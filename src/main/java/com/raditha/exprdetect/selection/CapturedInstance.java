package com.raditha.exprdetect.selection;

import com.raditha.exprdetect.model.Expr;
import com.raditha.exprdetect.model.FunctionDecl;
import com.raditha.exprdetect.model.Stmt;

/**
 * The instance selected for instrumentation.
 *
 * @param function   function definition containing it
 * @param statement  statement that was current when it was visited
 * @param expression the selected expression
 * @param unbraced   whether {@code statement} is the unbraced body of a
 *                   control statement or the sub-statement of a label
 */
public record CapturedInstance(
        FunctionDecl function,
        Stmt statement,
        Expr expression,
        boolean unbraced) {

    /**
     * @throws IllegalStateException when any part of the triple is missing
     */
    public CapturedInstance {
        if (function == null || statement == null || expression == null) {
            throw new IllegalStateException("Incomplete selection: function=" + function
                    + ", statement=" + statement + ", expression=" + expression);
        }
    }
}
