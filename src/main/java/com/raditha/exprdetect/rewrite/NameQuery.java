package com.raditha.exprdetect.rewrite;

import com.raditha.exprdetect.analysis.AstScanner;
import com.raditha.exprdetect.model.FunctionDecl;
import com.raditha.exprdetect.model.VarDecl;

/**
 * Finds the numbers already used for generated variable names in a function,
 * so that a new name never collides with one from an earlier run.
 */
public class NameQuery {

    /**
     * Largest numeric suffix among the parameters and local variables of
     * {@code function} whose name starts with {@code prefix}; 0 if there is
     * none. Names with a non-numeric suffix are ignored.
     */
    public int maxSuffix(FunctionDecl function, String prefix) {
        int[] max = {0};
        for (VarDecl parameter : function.getParameters()) {
            max[0] = Math.max(max[0], suffixOf(parameter.getName(), prefix));
        }
        AstScanner.forEachStmt(function.getBody(), s -> {
            for (VarDecl variable : s.declarations()) {
                max[0] = Math.max(max[0], suffixOf(variable.getName(), prefix));
            }
        });
        return max[0];
    }

    static int suffixOf(String name, String prefix) {
        if (name == null || !name.startsWith(prefix) || name.length() == prefix.length()) {
            return 0;
        }
        String suffix = name.substring(prefix.length());
        for (int i = 0; i < suffix.length(); i++) {
            if (!Character.isDigit(suffix.charAt(i))) {
                return 0;
            }
        }
        try {
            return Integer.parseInt(suffix);
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
