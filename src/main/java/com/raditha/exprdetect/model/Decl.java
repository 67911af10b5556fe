package com.raditha.exprdetect.model;

/**
 * A named declaration. Declarations compare by identity, so they can key
 * identity-based maps and be shared between the nodes that reference them.
 */
public abstract class Decl {

    private final String name;
    private final Range range;

    protected Decl(String name, Range range) {
        this.name = name;
        this.range = range;
    }

    /**
     * Declared name; {@code null} for anonymous declarations.
     */
    public String getName() {
        return name;
    }

    /**
     * Range from the first declaration specifier to the end of the declarator.
     * {@code null} for implicit declarations.
     */
    public Range getRange() {
        return range;
    }

    public boolean isImplicit() {
        return range == null;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + name + ")";
    }
}
