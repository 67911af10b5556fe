package com.raditha.exprdetect.model;

import java.util.List;

/**
 * Function declaration or definition.
 */
public class FunctionDecl extends Decl {

    private final CType type;
    private final List<VarDecl> parameters;
    private Stmt body;

    public FunctionDecl(String name, Range range, CType type, List<VarDecl> parameters) {
        super(name, range);
        if (!type.isFunction()) {
            throw new IllegalArgumentException("Function declaration needs a function type: " + type);
        }
        this.type = type;
        this.parameters = List.copyOf(parameters);
    }

    public CType getType() {
        return type;
    }

    public CType getReturnType() {
        return type.element();
    }

    public List<VarDecl> getParameters() {
        return parameters;
    }

    /**
     * Compound body, or {@code null} for a prototype.
     */
    public Stmt getBody() {
        return body;
    }

    public void setBody(Stmt body) {
        if (body.kind() != StmtKind.COMPOUND) {
            throw new IllegalArgumentException("Function body must be a compound statement");
        }
        this.body = body;
    }

    public boolean isDefinition() {
        return body != null;
    }
}
