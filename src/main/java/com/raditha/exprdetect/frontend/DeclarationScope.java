package com.raditha.exprdetect.frontend;

import com.raditha.exprdetect.model.CType;
import com.raditha.exprdetect.model.Decl;
import com.raditha.exprdetect.model.RecordDecl;
import com.raditha.exprdetect.model.TypeKind;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Block-structured symbol table with the two C name spaces the parser needs:
 * ordinary identifiers (declarations and typedef names) and tags.
 */
class DeclarationScope {

    /** A typedef name in the ordinary name space. */
    record TypedefName(CType type) {
    }

    private final Deque<Map<String, Object>> ordinary = new ArrayDeque<>();
    private final Deque<Map<String, Object>> tags = new ArrayDeque<>();

    DeclarationScope() {
        push();
        predefineTypedefs();
    }

    void push() {
        ordinary.push(new HashMap<>());
        tags.push(new HashMap<>());
    }

    void pop() {
        if (ordinary.size() == 1) {
            throw new IllegalStateException("Cannot pop the file scope");
        }
        ordinary.pop();
        tags.pop();
    }

    boolean isFileScope() {
        return ordinary.size() == 1;
    }

    void declare(String name, Decl decl) {
        ordinary.peek().put(name, decl);
    }

    void declareInFileScope(String name, Decl decl) {
        ordinary.peekLast().put(name, decl);
    }

    void declareTypedef(String name, CType type) {
        ordinary.peek().put(name, new TypedefName(type));
    }

    /**
     * Innermost declaration of an ordinary identifier, or {@code null}.
     */
    Decl lookup(String name) {
        Object found = find(ordinary, name);
        return found instanceof Decl decl ? decl : null;
    }

    /**
     * Type named by a typedef, or {@code null} when the innermost binding of
     * the name is not a typedef.
     */
    CType lookupTypedef(String name) {
        Object found = find(ordinary, name);
        return found instanceof TypedefName typedef ? typedef.type() : null;
    }

    boolean isTypedefName(String name) {
        return lookupTypedef(name) != null;
    }

    /**
     * Tag binding: a {@link RecordDecl} or an enum {@link CType}.
     */
    Object lookupTag(String tag) {
        return find(tags, tag);
    }

    Object lookupTagInCurrentScope(String tag) {
        return tags.peek().get(tag);
    }

    void declareTag(String tag, Object binding) {
        tags.peek().put(tag, binding);
    }

    private static Object find(Deque<Map<String, Object>> scopes, String name) {
        Iterator<Map<String, Object>> it = scopes.iterator();
        while (it.hasNext()) {
            Object found = it.next().get(name);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    /**
     * Typedefs from the standard headers that reduced test cases commonly use
     * without their declarations. Definitions in the source replace them.
     */
    private void predefineTypedefs() {
        typedef("size_t", TypeKind.UNSIGNED_LONG);
        typedef("ssize_t", TypeKind.LONG);
        typedef("ptrdiff_t", TypeKind.LONG);
        typedef("intptr_t", TypeKind.LONG);
        typedef("uintptr_t", TypeKind.UNSIGNED_LONG);
        typedef("int8_t", TypeKind.SIGNED_CHAR);
        typedef("int16_t", TypeKind.SHORT);
        typedef("int32_t", TypeKind.INT);
        typedef("int64_t", TypeKind.LONG);
        typedef("uint8_t", TypeKind.UNSIGNED_CHAR);
        typedef("uint16_t", TypeKind.UNSIGNED_SHORT);
        typedef("uint32_t", TypeKind.UNSIGNED_INT);
        typedef("uint64_t", TypeKind.UNSIGNED_LONG);
        typedef("wchar_t", TypeKind.INT);
        typedef("bool", TypeKind.BOOL);
        RecordDecl file = new RecordDecl("_IO_FILE", null, false);
        declareTypedef("FILE", CType.record(file).withTypedefName("FILE"));
        CType vaList = CType.pointerTo(CType.CHAR);
        declareTypedef("va_list", vaList.withTypedefName("va_list"));
        declareTypedef("__builtin_va_list", vaList.withTypedefName("__builtin_va_list"));
    }

    private void typedef(String name, TypeKind kind) {
        declareTypedef(name, CType.builtin(kind).withTypedefName(name));
    }
}
