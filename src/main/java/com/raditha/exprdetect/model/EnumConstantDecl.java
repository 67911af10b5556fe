package com.raditha.exprdetect.model;

import java.math.BigInteger;

/**
 * Enumerator. References to it are name references of type {@code int}.
 */
public class EnumConstantDecl extends Decl {

    private final BigInteger value;

    public EnumConstantDecl(String name, Range range, BigInteger value) {
        super(name, range);
        this.value = value;
    }

    public BigInteger getValue() {
        return value;
    }

    public CType getType() {
        return CType.INT;
    }
}
