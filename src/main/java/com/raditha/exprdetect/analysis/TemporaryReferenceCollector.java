package com.raditha.exprdetect.analysis;

import com.raditha.exprdetect.model.Stmt;
import com.raditha.exprdetect.model.VarDecl;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds the temporaries an earlier instrumentation run introduced that a
 * statement refers to.
 */
public class TemporaryReferenceCollector {

    private final NamingConvention naming;

    public TemporaryReferenceCollector(NamingConvention naming) {
        this.naming = naming;
    }

    /**
     * Variables referenced in {@code stmt} whose name carries the temporary
     * prefix, in visiting order and with repetitions.
     */
    public List<VarDecl> collect(Stmt stmt) {
        List<VarDecl> temporaries = new ArrayList<>();
        AstScanner.forEachExpr(stmt, e -> {
            VarDecl variable = e.referencedVariable();
            if (variable != null && naming.isTemporary(variable.getName())) {
                temporaries.add(variable);
            }
        });
        return temporaries;
    }
}
