package com.raditha.exprdetect.model;

/**
 * Member of a struct or union.
 */
public class FieldDecl extends Decl {

    private final CType type;

    public FieldDecl(String name, Range range, CType type) {
        super(name, range);
        this.type = type;
    }

    public CType getType() {
        return type;
    }
}
