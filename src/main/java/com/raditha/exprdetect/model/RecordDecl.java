package com.raditha.exprdetect.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Struct or union tag. Starts incomplete; members are added when the
 * definition body is parsed.
 */
public class RecordDecl extends Decl {

    private final boolean union;
    private final List<FieldDecl> fields = new ArrayList<>();
    private boolean complete;

    public RecordDecl(String name, Range range, boolean union) {
        super(name, range);
        this.union = union;
    }

    public boolean isUnion() {
        return union;
    }

    public List<FieldDecl> getFields() {
        return Collections.unmodifiableList(fields);
    }

    public void complete(List<FieldDecl> members) {
        if (complete) {
            throw new IllegalStateException("Redefinition of " + (union ? "union " : "struct ") + getName());
        }
        fields.addAll(members);
        complete = true;
    }

    public boolean isComplete() {
        return complete;
    }

    /**
     * Look up a member by name, descending into anonymous struct/union members.
     */
    public FieldDecl findField(String name) {
        for (FieldDecl field : fields) {
            if (name.equals(field.getName())) {
                return field;
            }
        }
        for (FieldDecl field : fields) {
            if (field.getName() == null && field.getType().isRecord()) {
                FieldDecl nested = field.getType().record().findField(name);
                if (nested != null) {
                    return nested;
                }
            }
        }
        return null;
    }
}
