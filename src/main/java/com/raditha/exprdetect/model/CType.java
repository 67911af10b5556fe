package com.raditha.exprdetect.model;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Static type of a C expression or declaration.
 * Instances are immutable; builtin arithmetic types are shared.
 */
public final class CType {

    /**
     * The only distinction the instrumentation core draws between types.
     */
    public enum Classification {
        INTEGER,
        FLOATING,
        OTHER
    }

    private static final Map<TypeKind, CType> BUILTINS = new EnumMap<>(TypeKind.class);

    static {
        for (TypeKind kind : TypeKind.values()) {
            if (kind.isInteger() && kind != TypeKind.ENUM || kind.isFloating() || kind == TypeKind.VOID) {
                BUILTINS.put(kind, new CType(kind, null, null, null, null, false, false, List.of(), false, -1));
            }
        }
    }

    public static final CType VOID = BUILTINS.get(TypeKind.VOID);
    public static final CType INT = BUILTINS.get(TypeKind.INT);
    public static final CType UNSIGNED_LONG = BUILTINS.get(TypeKind.UNSIGNED_LONG);
    public static final CType DOUBLE = BUILTINS.get(TypeKind.DOUBLE);
    public static final CType CHAR = BUILTINS.get(TypeKind.CHAR);

    private final TypeKind kind;
    private final CType element;
    private final RecordDecl record;
    private final String tag;
    private final String typedefName;
    private final boolean constQualified;
    private final boolean volatileQualified;
    private final List<CType> parameters;
    private final boolean variadic;
    private final long arrayLength;

    private CType(TypeKind kind, CType element, RecordDecl record, String tag, String typedefName,
            boolean constQualified, boolean volatileQualified, List<CType> parameters,
            boolean variadic, long arrayLength) {
        this.kind = kind;
        this.element = element;
        this.record = record;
        this.tag = tag;
        this.typedefName = typedefName;
        this.constQualified = constQualified;
        this.volatileQualified = volatileQualified;
        this.parameters = parameters;
        this.variadic = variadic;
        this.arrayLength = arrayLength;
    }

    /**
     * Shared instance of a builtin arithmetic type or void.
     */
    public static CType builtin(TypeKind kind) {
        CType type = BUILTINS.get(kind);
        if (type == null) {
            throw new IllegalArgumentException("Not a builtin type kind: " + kind);
        }
        return type;
    }

    public static CType pointerTo(CType pointee) {
        return new CType(TypeKind.POINTER, pointee, null, null, null, false, false, List.of(), false, -1);
    }

    /**
     * @param length declared length, or -1 when unspecified
     */
    public static CType arrayOf(CType element, long length) {
        return new CType(TypeKind.ARRAY, element, null, null, null, false, false, List.of(), false, length);
    }

    public static CType function(CType returnType, List<CType> parameters, boolean variadic) {
        return new CType(TypeKind.FUNCTION, returnType, null, null, null, false, false,
                List.copyOf(parameters), variadic, -1);
    }

    public static CType record(RecordDecl record) {
        TypeKind kind = record.isUnion() ? TypeKind.UNION : TypeKind.STRUCT;
        return new CType(kind, null, record, record.getName(), null, false, false, List.of(), false, -1);
    }

    public static CType enumeration(String tag) {
        return new CType(TypeKind.ENUM, null, null, tag, null, false, false, List.of(), false, -1);
    }

    public TypeKind kind() {
        return kind;
    }

    public Classification classify() {
        if (kind.isInteger()) {
            return Classification.INTEGER;
        }
        if (kind.isFloating()) {
            return Classification.FLOATING;
        }
        return Classification.OTHER;
    }

    public boolean isInteger() {
        return kind.isInteger();
    }

    public boolean isFloating() {
        return kind.isFloating();
    }

    public boolean isArithmetic() {
        return kind.isInteger() || kind.isFloating();
    }

    public boolean isScalar() {
        return isArithmetic() || kind == TypeKind.POINTER;
    }

    public boolean isPointer() {
        return kind == TypeKind.POINTER;
    }

    public boolean isArray() {
        return kind == TypeKind.ARRAY;
    }

    public boolean isFunction() {
        return kind == TypeKind.FUNCTION;
    }

    public boolean isRecord() {
        return kind == TypeKind.STRUCT || kind == TypeKind.UNION;
    }

    public boolean isVoid() {
        return kind == TypeKind.VOID;
    }

    /**
     * Pointee, array element or function return type.
     */
    public CType element() {
        return element;
    }

    public RecordDecl record() {
        return record;
    }

    public String typedefName() {
        return typedefName;
    }

    public boolean isConst() {
        return constQualified;
    }

    public boolean isVolatile() {
        return volatileQualified;
    }

    public List<CType> parameters() {
        return parameters;
    }

    public boolean isVariadic() {
        return variadic;
    }

    public long arrayLength() {
        return arrayLength;
    }

    public CType withQualifiers(boolean isConst, boolean isVolatile) {
        if (isConst == constQualified && isVolatile == volatileQualified) {
            return this;
        }
        return new CType(kind, element, record, tag, typedefName, isConst, isVolatile, parameters, variadic,
                arrayLength);
    }

    /**
     * The same type spelled through a typedef name.
     */
    public CType withTypedefName(String name) {
        return new CType(kind, element, record, tag, name, constQualified, volatileQualified, parameters,
                variadic, arrayLength);
    }

    /**
     * Drop qualifiers and typedef sugar.
     */
    public CType unqualified() {
        if (!constQualified && !volatileQualified && typedefName == null) {
            return this;
        }
        if (BUILTINS.containsKey(kind)) {
            return BUILTINS.get(kind);
        }
        return new CType(kind, element, record, tag, null, false, false, parameters, variadic, arrayLength);
    }

    /**
     * Array-to-pointer and function-to-pointer decay.
     */
    public CType decay() {
        if (kind == TypeKind.ARRAY) {
            return pointerTo(element);
        }
        if (kind == TypeKind.FUNCTION) {
            return pointerTo(this);
        }
        return this;
    }

    /**
     * Spelling usable as the type of a variable declaration, e.g.
     * {@code unsigned long}, {@code const int}, {@code size_t}, {@code struct node *}.
     */
    public String spelling() {
        StringBuilder sb = new StringBuilder();
        if (constQualified) {
            sb.append("const ");
        }
        if (volatileQualified) {
            sb.append("volatile ");
        }
        if (typedefName != null) {
            return sb.append(typedefName).toString();
        }
        switch (kind) {
            case POINTER, ARRAY -> {
                String inner = element.spelling();
                return sb.append(inner).append(inner.endsWith("*") ? "*" : " *").toString();
            }
            case FUNCTION -> {
                return sb.append(element.spelling()).append(" (*)()").toString();
            }
            case STRUCT, UNION, ENUM -> {
                sb.append(kind.spelling());
                if (tag != null) {
                    sb.append(' ').append(tag);
                }
                return sb.toString();
            }
            default -> {
                return sb.append(kind.spelling()).toString();
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CType other)) {
            return false;
        }
        return kind == other.kind
                && constQualified == other.constQualified
                && volatileQualified == other.volatileQualified
                && variadic == other.variadic
                && arrayLength == other.arrayLength
                && record == other.record
                && Objects.equals(tag, other.tag)
                && Objects.equals(typedefName, other.typedefName)
                && Objects.equals(element, other.element)
                && parameters.equals(other.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, constQualified, volatileQualified, tag, typedefName, element, arrayLength);
    }

    @Override
    public String toString() {
        return spelling();
    }
}
