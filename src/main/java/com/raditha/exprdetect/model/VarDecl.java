package com.raditha.exprdetect.model;

/**
 * Variable or parameter declaration.
 */
public class VarDecl extends Decl {

    private final CType type;
    private final boolean parameter;
    private final boolean fileScope;
    private final boolean staticStorage;
    private Expr initializer;

    public VarDecl(String name, Range range, CType type, boolean parameter, boolean fileScope,
            boolean staticStorage) {
        super(name, range);
        this.type = type;
        this.parameter = parameter;
        this.fileScope = fileScope;
        this.staticStorage = staticStorage;
    }

    public CType getType() {
        return type;
    }

    public boolean isParameter() {
        return parameter;
    }

    public boolean isFileScope() {
        return fileScope;
    }

    public boolean isStatic() {
        return staticStorage;
    }

    /**
     * Initializer as written, or {@code null}.
     */
    public Expr getInitializer() {
        return initializer;
    }

    /**
     * Attach the initializer once it has been parsed; the variable is already in
     * scope while its own initializer is parsed.
     */
    public void setInitializer(Expr initializer) {
        if (this.initializer != null) {
            throw new IllegalStateException("Initializer already set for " + getName());
        }
        this.initializer = initializer;
    }
}
