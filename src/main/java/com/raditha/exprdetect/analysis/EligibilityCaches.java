package com.raditha.exprdetect.analysis;

import com.raditha.exprdetect.model.Expr;
import com.raditha.exprdetect.model.Stmt;
import com.raditha.exprdetect.model.VarDecl;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Memo tables of one selection pass over one function. All maps are keyed by
 * node identity; two structurally equal statements never share an entry.
 */
public class EligibilityCaches {

    private final Map<Stmt, Set<Expr>> writeContexts = new IdentityHashMap<>();
    private final Map<Stmt, List<Expr>> accepted = new IdentityHashMap<>();
    private final Map<Stmt, List<VarDecl>> temporaryReferences = new IdentityHashMap<>();
    private final Map<VarDecl, Expr> temporaryInitializers = new IdentityHashMap<>();
    private int scans;

    /**
     * Write-context exclusions of {@code stmt}, computed on first request.
     */
    public Set<Expr> writeContextsOf(Stmt stmt, Function<Stmt, Set<Expr>> scanner) {
        return writeContexts.computeIfAbsent(stmt, s -> {
            scans++;
            return scanner.apply(s);
        });
    }

    /**
     * Temporaries referenced in {@code stmt}, computed on first request.
     */
    public List<VarDecl> temporariesIn(Stmt stmt, Function<Stmt, List<VarDecl>> collector) {
        return temporaryReferences.computeIfAbsent(stmt, s -> {
            scans++;
            return collector.apply(s);
        });
    }

    /**
     * Mutable list of the expressions already accepted for {@code stmt}.
     */
    public List<Expr> acceptedFor(Stmt stmt) {
        return accepted.computeIfAbsent(stmt, s -> new ArrayList<>());
    }

    /**
     * Remember a temporary's initializer with parentheses and implicit
     * conversions stripped. Temporaries without initializer are ignored.
     */
    public void registerTemporary(VarDecl temporary) {
        Expr init = temporary.getInitializer();
        if (init != null) {
            temporaryInitializers.put(temporary, init.ignoreParenImpCasts());
        }
    }

    /**
     * Recorded initializer of a temporary, or {@code null}.
     */
    public Expr initializerOf(VarDecl temporary) {
        return temporaryInitializers.get(temporary);
    }

    public int temporaryCount() {
        return temporaryInitializers.size();
    }

    /**
     * Number of statement scans performed since the last {@link #clear()}.
     */
    public int scanCount() {
        return scans;
    }

    public void clear() {
        writeContexts.clear();
        accepted.clear();
        temporaryReferences.clear();
        temporaryInitializers.clear();
        scans = 0;
    }
}
