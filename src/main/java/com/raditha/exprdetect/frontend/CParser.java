package com.raditha.exprdetect.frontend;

import com.raditha.exprdetect.model.BinaryOperator;
import com.raditha.exprdetect.model.CType;
import com.raditha.exprdetect.model.Decl;
import com.raditha.exprdetect.model.Dialect;
import com.raditha.exprdetect.model.EnumConstantDecl;
import com.raditha.exprdetect.model.Expr;
import com.raditha.exprdetect.model.FieldDecl;
import com.raditha.exprdetect.model.FunctionDecl;
import com.raditha.exprdetect.model.InclusionDirective;
import com.raditha.exprdetect.model.Range;
import com.raditha.exprdetect.model.RecordDecl;
import com.raditha.exprdetect.model.Stmt;
import com.raditha.exprdetect.model.StmtKind;
import com.raditha.exprdetect.model.TranslationUnit;
import com.raditha.exprdetect.model.TypeKind;
import com.raditha.exprdetect.model.UnaryOperator;
import com.raditha.exprdetect.model.VarDecl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterC;

import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parser for C. tree-sitter supplies the syntax tree; this class resolves
 * names and computes expression types while walking it, inserting implicit
 * conversions where C requires them.
 * <p>
 * tree-sitter does not know which identifiers are typedef names, so a few
 * shapes it reads as declarations or casts are re-read as expressions when
 * the would-be type name is not a typedef: {@code a * b;}, {@code f (x);},
 * {@code (a) - 1} and {@code sizeof (a)}.
 * <p>
 * A parser instance handles one translation unit and is not reusable.
 */
public class CParser {

    private static final Logger logger = LoggerFactory.getLogger(CParser.class);

    private static final Set<String> PREDEFINED_NAMES = Set.of(
            "__func__", "__FUNCTION__", "__PRETTY_FUNCTION__");

    private static final Set<String> TYPE_SPECIFIERS = Set.of(
            "primitive_type", "sized_type_specifier", "type_identifier", "struct_specifier",
            "union_specifier", "enum_specifier", "macro_type_specifier");
    private static final Set<String> MODIFIERS = Set.of(
            "storage_class_specifier", "type_qualifier", "attribute_specifier", "attribute_declaration",
            "ms_declspec_modifier", "ms_call_modifier", "gnu_asm_expression", "bitfield_clause", "comment");
    private static final Set<String> PREPROCESSOR_BRANCHES = Set.of(
            "preproc_if", "preproc_ifdef", "preproc_else", "preproc_elif", "preproc_elifdef");

    private static final Map<String, TypeKind> BUILTIN_TYPES = Map.of(
            "void", TypeKind.VOID,
            "char", TypeKind.CHAR,
            "int", TypeKind.INT,
            "float", TypeKind.FLOAT,
            "double", TypeKind.DOUBLE,
            "_Bool", TypeKind.BOOL);

    /**
     * Operators of a unary operand that turn {@code (name) op x} into a binary
     * expression when {@code name} is not a type.
     */
    private static final Map<String, BinaryOperator> CAST_AMBIGUOUS = Map.of(
            "-", BinaryOperator.SUB,
            "+", BinaryOperator.ADD,
            "*", BinaryOperator.MUL,
            "&", BinaryOperator.BIT_AND);

    private final String fileName;
    private final String source;
    private final SourceText text;
    private final List<InclusionDirective> inclusions = new ArrayList<>();
    private final DeclarationScope scope = new DeclarationScope();
    private FunctionDecl currentFunction;

    public CParser(String fileName, String source) {
        this.fileName = fileName;
        this.source = source;
        this.text = new SourceText(source);
    }

    /**
     * Parse the whole input.
     *
     * @throws SourceParseException on input outside the supported C subset
     */
    public TranslationUnit parse() {
        TSParser parser = new TSParser();
        parser.setLanguage(new TreeSitterC());
        TSTree tree = parser.parseString(null, source);
        TSNode root = tree.getRootNode();
        if (root.hasError()) {
            throw syntaxError(root);
        }

        List<Decl> declarations = new ArrayList<>();
        for (Item item : items(root, 0)) {
            if (item.isBareSpecifiers()) {
                bareSpec(item.specifiers());
                continue;
            }
            TSNode node = item.node();
            switch (node.getType()) {
                case "function_definition" -> parseFunctionDefinition(node, declarations);
                case "declaration" -> parseExternalDeclaration(node, declarations);
                case "type_definition" -> parseTypedef(node);
                case "static_assert_declaration" -> {
                }
                case "expression_statement" -> {
                    TSNode inner = firstNamedChild(node);
                    if (inner != null && !inner.getType().equals("gnu_asm_expression")) {
                        throw error(node, "Expected declaration");
                    }
                }
                default -> throw error(node, "Expected declaration");
            }
        }
        logger.debug("Parsed {}: {} top-level declarations, {} inclusions",
                fileName, declarations.size(), inclusions.size());
        return new TranslationUnit(fileName, source, Dialect.C, declarations, inclusions);
    }

    private SourceParseException syntaxError(TSNode root) {
        TSNode bad = root;
        boolean descended = true;
        while (descended && !bad.getType().equals("ERROR") && !bad.isMissing()) {
            descended = false;
            for (int i = 0; i < bad.getChildCount(); i++) {
                TSNode child = bad.getChild(i);
                if (child.hasError() || child.isMissing()) {
                    bad = child;
                    descended = true;
                    break;
                }
            }
        }
        if (bad.isMissing()) {
            return error(bad, "Expected '" + bad.getType() + "'");
        }
        String near = text.text(bad);
        int newline = near.indexOf('\n');
        if (newline >= 0) {
            near = near.substring(0, newline);
        }
        if (near.length() > 20) {
            near = near.substring(0, 20);
        }
        return error(bad, near.isBlank() ? "Syntax error" : "Syntax error near '" + near.strip() + "'");
    }

    // ---------------------------------------------------------------- block items

    /**
     * A declaration or statement of a block, or the specifiers of a
     * declaration without declarators, which has no node of its own.
     */
    private record Item(TSNode node, List<TSNode> specifiers, int startByte, int endByte) {
        boolean isBareSpecifiers() {
            return node == null;
        }
    }

    private List<Item> items(TSNode parent, int from) {
        List<Item> items = new ArrayList<>();
        List<TSNode> pending = new ArrayList<>();
        for (int i = from; i < parent.getChildCount(); i++) {
            TSNode child = parent.getChild(i);
            String type = child.getType();
            if (TYPE_SPECIFIERS.contains(type)
                    || (!pending.isEmpty() || isBareSpecifierStart(parent, i)) && MODIFIERS.contains(type)) {
                pending.add(child);
            } else if (type.equals(";") && !pending.isEmpty()) {
                items.add(new Item(null, List.copyOf(pending), pending.get(0).getStartByte(), child.getEndByte()));
                pending.clear();
            } else if (PREPROCESSOR_BRANCHES.contains(type)) {
                items.addAll(items(child, branchStart(child)));
            } else if (type.equals("preproc_include")) {
                recordInclusion(child);
            } else if (child.isNamed() && !type.startsWith("preproc_") && !type.equals("comment")) {
                items.add(new Item(child, List.of(), child.getStartByte(), child.getEndByte()));
            }
        }
        return items;
    }

    private static boolean isBareSpecifierStart(TSNode parent, int index) {
        for (int i = index; i < parent.getChildCount(); i++) {
            String type = parent.getChild(i).getType();
            if (TYPE_SPECIFIERS.contains(type)) {
                return true;
            }
            if (!MODIFIERS.contains(type)) {
                return false;
            }
        }
        return false;
    }

    private static int branchStart(TSNode branch) {
        if (branch.getType().equals("preproc_else")) {
            return 0;
        }
        for (int i = 0; i < branch.getChildCount(); i++) {
            if (branch.getChild(i).isNamed()) {
                return i + 1;
            }
        }
        return branch.getChildCount();
    }

    private void recordInclusion(TSNode directive) {
        TSNode path = directive.getChildByFieldName("path");
        if (path.isNull()) {
            return;
        }
        String spelled = text.text(path);
        boolean angled = path.getType().equals("system_lib_string");
        String name = spelled.length() >= 2 ? spelled.substring(1, spelled.length() - 1) : spelled;
        inclusions.add(new InclusionDirective(name, angled,
                text.range(directive.getStartByte(), path.getEndByte())));
    }

    // ---------------------------------------------------------------- declarations

    private static final class DeclSpec {
        CType type;
        boolean isStatic;
        boolean declaresTag;
    }

    private static final class Declarator {
        String name;
        List<VarDecl> parameters;
    }

    private record ParameterList(List<VarDecl> declarations, List<CType> types, boolean variadic) {
    }

    private void parseFunctionDefinition(TSNode node, List<Decl> out) {
        for (TSNode child : namedChildren(node)) {
            if (child.getType().equals("declaration")) {
                throw error(child, "Identifier-list parameters are not supported");
            }
        }
        DeclSpec spec = declSpec(node);
        TSNode declaratorNode = node.getChildByFieldName("declarator");
        Declarator d = new Declarator();
        CType type = declare(declaratorNode, spec.type, d);
        if (!type.isFunction()) {
            throw error(declaratorNode, "Expected function declarator");
        }
        List<VarDecl> params = d.parameters != null ? d.parameters : List.of();
        FunctionDecl function = new FunctionDecl(d.name,
                text.range(node.getStartByte(), declaratorNode.getEndByte()), type, params);
        scope.declare(d.name, function);
        out.add(function);
        parseFunctionBody(function, node.getChildByFieldName("body"));
    }

    private void parseFunctionBody(FunctionDecl function, TSNode body) {
        FunctionDecl enclosing = currentFunction;
        currentFunction = function;
        scope.push();
        for (VarDecl param : function.getParameters()) {
            if (param.getName() != null) {
                scope.declare(param.getName(), param);
            }
        }
        function.setBody(compound(body, false));
        scope.pop();
        currentFunction = enclosing;
    }

    private void parseExternalDeclaration(TSNode node, List<Decl> out) {
        DeclSpec spec = declSpec(node);
        for (TSNode declaratorNode : declarators(node)) {
            Declarator d = new Declarator();
            CType type = declare(declaratorNode, spec.type, d);
            Range range = text.range(node.getStartByte(), declaratorEnd(declaratorNode));
            if (type.isFunction()) {
                List<VarDecl> params = d.parameters != null ? d.parameters : List.of();
                FunctionDecl function = new FunctionDecl(d.name, range, type, params);
                scope.declare(d.name, function);
                out.add(function);
                continue;
            }
            VarDecl variable = new VarDecl(d.name, range, type, false, true, spec.isStatic);
            scope.declare(d.name, variable);
            out.add(variable);
            TSNode value = declaratorNode.getChildByFieldName("value");
            if (declaratorNode.getType().equals("init_declarator") && !value.isNull()) {
                variable.setInitializer(initializer(value, type));
            }
        }
    }

    private void parseTypedef(TSNode node) {
        DeclSpec spec = declSpec(node);
        for (TSNode declaratorNode : declarators(node)) {
            Declarator d = new Declarator();
            CType type = declare(declaratorNode, spec.type, d);
            scope.declareTypedef(d.name, type.withTypedefName(d.name));
        }
    }

    private DeclSpec declSpec(TSNode owner) {
        return declSpec(owner.getChildByFieldName("type"), namedChildren(owner));
    }

    private DeclSpec bareSpec(List<TSNode> specifiers) {
        TSNode typeNode = specifiers.stream()
                .filter(s -> TYPE_SPECIFIERS.contains(s.getType()))
                .findFirst()
                .orElseThrow();
        return declSpec(typeNode, specifiers);
    }

    private DeclSpec declSpec(TSNode typeNode, List<TSNode> modifiers) {
        DeclSpec spec = new DeclSpec();
        boolean isConst = false;
        boolean isVolatile = false;
        for (TSNode modifier : modifiers) {
            switch (modifier.getType()) {
                case "storage_class_specifier" -> spec.isStatic |= text.text(modifier).equals("static");
                case "type_qualifier" -> {
                    String q = text.text(modifier);
                    isConst |= q.endsWith("const");
                    isVolatile |= q.contains("volatile");
                }
                default -> {
                }
            }
        }
        CType base = typeSpecifier(typeNode, spec);
        if (isConst || isVolatile) {
            base = base.withQualifiers(base.isConst() || isConst, base.isVolatile() || isVolatile);
        }
        spec.type = base;
        return spec;
    }

    private CType typeSpecifier(TSNode node, DeclSpec spec) {
        return switch (node.getType()) {
            case "primitive_type", "type_identifier" -> namedType(node);
            case "sized_type_specifier" -> sizedType(node);
            case "struct_specifier", "union_specifier" -> recordSpecifier(node, spec);
            case "enum_specifier" -> enumSpecifier(node, spec);
            default -> throw error(node, "Unsupported type specifier");
        };
    }

    private CType namedType(TSNode node) {
        String name = text.text(node);
        CType typedef = scope.lookupTypedef(name);
        if (typedef != null) {
            return typedef;
        }
        TypeKind kind = BUILTIN_TYPES.get(name);
        if (kind == null) {
            throw error(node, "Unknown type name '" + name + "'");
        }
        return CType.builtin(kind);
    }

    private CType sizedType(TSNode node) {
        int longs = 0;
        boolean signed = false;
        boolean unsigned = false;
        boolean isShort = false;
        for (int i = 0; i < node.getChildCount(); i++) {
            switch (node.getChild(i).getType()) {
                case "long" -> longs++;
                case "short" -> isShort = true;
                case "signed", "__signed", "__signed__" -> signed = true;
                case "unsigned" -> unsigned = true;
                default -> {
                }
            }
        }
        TSNode base = node.getChildByFieldName("type");
        String basic = base.isNull() ? null : text.text(base);
        if (isShort) {
            basic = "short";
        }
        return CType.builtin(basicKind(basic, longs, signed, unsigned));
    }

    private static TypeKind basicKind(String basic, int longs, boolean signed, boolean unsigned) {
        if (basic == null) {
            basic = "int";
        }
        return switch (basic) {
            case "void" -> TypeKind.VOID;
            case "_Bool" -> TypeKind.BOOL;
            case "char" -> signed ? TypeKind.SIGNED_CHAR : unsigned ? TypeKind.UNSIGNED_CHAR : TypeKind.CHAR;
            case "short" -> unsigned ? TypeKind.UNSIGNED_SHORT : TypeKind.SHORT;
            case "float" -> TypeKind.FLOAT;
            case "double" -> longs > 0 ? TypeKind.LONG_DOUBLE : TypeKind.DOUBLE;
            default -> {
                if (longs >= 2) {
                    yield unsigned ? TypeKind.UNSIGNED_LONG_LONG : TypeKind.LONG_LONG;
                }
                if (longs == 1) {
                    yield unsigned ? TypeKind.UNSIGNED_LONG : TypeKind.LONG;
                }
                yield unsigned ? TypeKind.UNSIGNED_INT : TypeKind.INT;
            }
        };
    }

    private CType recordSpecifier(TSNode node, DeclSpec spec) {
        boolean union = node.getType().equals("union_specifier");
        TSNode nameNode = node.getChildByFieldName("name");
        TSNode body = node.getChildByFieldName("body");
        String tag = nameNode.isNull() ? null : text.text(nameNode);
        Range keyword = text.range(node.getChild(0));
        if (!body.isNull()) {
            spec.declaresTag = true;
            RecordDecl record = null;
            if (tag != null && scope.lookupTagInCurrentScope(tag) instanceof RecordDecl existing
                    && !existing.isComplete() && existing.isUnion() == union) {
                record = existing;
            }
            if (record == null) {
                record = new RecordDecl(tag, keyword, union);
                if (tag != null) {
                    scope.declareTag(tag, record);
                }
            }
            List<FieldDecl> fields = new ArrayList<>();
            for (Item member : items(body, 0)) {
                if (!member.isBareSpecifiers() && member.node().getType().equals("field_declaration")) {
                    parseMember(member.node(), fields);
                }
            }
            record.complete(fields);
            return CType.record(record);
        }
        if (tag == null) {
            throw error(node, "Expected " + (union ? "union" : "struct") + " tag or body");
        }
        if (scope.lookupTag(tag) instanceof RecordDecl existing) {
            return CType.record(existing);
        }
        RecordDecl record = new RecordDecl(tag, keyword, union);
        scope.declareTag(tag, record);
        return CType.record(record);
    }

    private void parseMember(TSNode member, List<FieldDecl> fields) {
        DeclSpec spec = declSpec(member);
        List<TSNode> declarators = declarators(member);
        if (declarators.isEmpty()) {
            if (spec.type.isRecord() && !hasNamedChild(member, "bitfield_clause")) {
                fields.add(new FieldDecl(null, text.range(member), spec.type));
            }
            return;
        }
        for (TSNode declaratorNode : declarators) {
            Declarator d = new Declarator();
            CType type = declare(declaratorNode, spec.type, d);
            fields.add(new FieldDecl(d.name, text.range(member.getStartByte(), declaratorNode.getEndByte()), type));
        }
    }

    private CType enumSpecifier(TSNode node, DeclSpec spec) {
        TSNode nameNode = node.getChildByFieldName("name");
        TSNode body = node.getChildByFieldName("body");
        String tag = nameNode.isNull() ? null : text.text(nameNode);
        CType type = tag != null && scope.lookupTag(tag) instanceof CType existing
                ? existing
                : CType.enumeration(tag);
        if (!body.isNull()) {
            spec.declaresTag = true;
            if (tag != null) {
                scope.declareTag(tag, type);
            }
            BigInteger value = BigInteger.ZERO;
            for (TSNode enumerator : namedChildren(body)) {
                if (!enumerator.getType().equals("enumerator")) {
                    continue;
                }
                TSNode name = enumerator.getChildByFieldName("name");
                TSNode init = enumerator.getChildByFieldName("value");
                if (!init.isNull()) {
                    BigInteger constant = ConstantEvaluator.evaluate(expression(init));
                    if (constant == null) {
                        throw error(name, "Enumerator value of '" + text.text(name)
                                + "' is not an integer constant");
                    }
                    value = constant;
                }
                scope.declare(text.text(name), new EnumConstantDecl(text.text(name), text.range(name), value));
                value = value.add(BigInteger.ONE);
            }
        } else if (tag != null && scope.lookupTag(tag) == null) {
            scope.declareTag(tag, type);
        }
        return type;
    }

    /**
     * Apply a declarator to its base type, outermost derivation first, and
     * record the declared name in {@code out}.
     */
    private CType declare(TSNode node, CType type, Declarator out) {
        if (node == null || node.isNull()) {
            return type;
        }
        switch (node.getType()) {
            case "identifier", "field_identifier", "type_identifier", "primitive_type" -> {
                out.name = text.text(node);
                return type;
            }
            case "init_declarator" -> {
                return declare(node.getChildByFieldName("declarator"), type, out);
            }
            case "pointer_declarator", "abstract_pointer_declarator" -> {
                boolean isConst = false;
                boolean isVolatile = false;
                for (TSNode child : namedChildren(node)) {
                    if (child.getType().equals("type_qualifier")) {
                        String q = text.text(child);
                        isConst |= q.endsWith("const");
                        isVolatile |= q.contains("volatile");
                    }
                }
                CType pointer = CType.pointerTo(type).withQualifiers(isConst, isVolatile);
                return declare(node.getChildByFieldName("declarator"), pointer, out);
            }
            case "array_declarator", "abstract_array_declarator" -> {
                TSNode size = node.getChildByFieldName("size");
                long length = -1;
                if (!size.isNull() && size.isNamed()) {
                    BigInteger n = ConstantEvaluator.evaluate(expression(size));
                    length = n != null ? n.longValue() : -1;
                }
                return declare(node.getChildByFieldName("declarator"), CType.arrayOf(type, length), out);
            }
            case "function_declarator", "abstract_function_declarator" -> {
                ParameterList list = parameterList(node.getChildByFieldName("parameters"));
                out.parameters = list.declarations();
                CType function = CType.function(type, list.types(), list.variadic());
                return declare(node.getChildByFieldName("declarator"), function, out);
            }
            case "parenthesized_declarator", "abstract_parenthesized_declarator", "attributed_declarator" -> {
                return declare(firstNamedChild(node), type, out);
            }
            default -> throw error(node, "Unsupported declarator");
        }
    }

    private ParameterList parameterList(TSNode node) {
        List<VarDecl> declarations = new ArrayList<>();
        List<CType> types = new ArrayList<>();
        boolean variadic = false;
        List<TSNode> params = namedChildren(node);
        if (params.isEmpty() && !hasChild(node, "...")) {
            return new ParameterList(declarations, types, true);
        }
        if (params.size() == 1 && isVoidParameter(params.get(0))) {
            return new ParameterList(declarations, types, false);
        }
        scope.push();
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode p = node.getChild(i);
            switch (p.getType()) {
                case "...", "variadic_parameter" -> variadic = true;
                case "parameter_declaration" -> {
                    DeclSpec spec = declSpec(p);
                    Declarator d = new Declarator();
                    CType type = adjustParameterType(declare(p.getChildByFieldName("declarator"), spec.type, d));
                    VarDecl param = new VarDecl(d.name, text.range(p), type, true, false, false);
                    if (d.name != null) {
                        scope.declare(d.name, param);
                    }
                    declarations.add(param);
                    types.add(type);
                }
                case "identifier" -> throw error(p, "Identifier-list parameters are not supported");
                default -> {
                    if (p.isNamed() && !MODIFIERS.contains(p.getType())) {
                        throw error(p, "Unsupported parameter");
                    }
                }
            }
        }
        scope.pop();
        return new ParameterList(declarations, types, variadic);
    }

    private boolean isVoidParameter(TSNode p) {
        if (!p.getType().equals("parameter_declaration") || !p.getChildByFieldName("declarator").isNull()) {
            return false;
        }
        TSNode type = p.getChildByFieldName("type");
        return type.getType().equals("primitive_type") && text.text(type).equals("void")
                && namedChildren(p).size() == 1;
    }

    private static CType adjustParameterType(CType type) {
        if (type.isArray()) {
            return CType.pointerTo(type.element());
        }
        if (type.isFunction()) {
            return CType.pointerTo(type);
        }
        return type;
    }

    private CType typeDescriptor(TSNode node) {
        DeclSpec spec = declSpec(node);
        return declare(node.getChildByFieldName("declarator"), spec.type, new Declarator());
    }

    private List<TSNode> declarators(TSNode owner) {
        TSNode typeNode = owner.getChildByFieldName("type");
        List<TSNode> result = new ArrayList<>();
        for (TSNode child : namedChildren(owner)) {
            if (!sameNode(child, typeNode) && !MODIFIERS.contains(child.getType())) {
                result.add(child);
            }
        }
        return result;
    }

    private static int declaratorEnd(TSNode declaratorNode) {
        if (declaratorNode.getType().equals("init_declarator")) {
            return declaratorNode.getChildByFieldName("declarator").getEndByte();
        }
        return declaratorNode.getEndByte();
    }

    private Expr initializer(TSNode value, CType type) {
        if (value.getType().equals("initializer_list")) {
            return initList(value, type, text.range(value));
        }
        return TypeRules.convert(expression(value), type);
    }

    private Expr initList(TSNode node, CType type, Range range) {
        CType elementType = type != null && type.isArray() ? type.element() : type;
        List<Expr> elements = new ArrayList<>();
        for (TSNode child : namedChildren(node)) {
            TSNode value = child.getType().equals("initializer_pair") ? child.getChildByFieldName("value") : child;
            elements.add(value.getType().equals("initializer_list")
                    ? initList(value, elementType, text.range(value))
                    : TypeRules.convert(expression(value), elementType));
        }
        return Expr.initList(range, type != null ? type : CType.VOID, elements);
    }

    // ---------------------------------------------------------------- statements

    private Stmt compound(TSNode node, boolean newScope) {
        if (newScope) {
            scope.push();
        }
        List<Stmt> statements = blockStatements(node, 0);
        if (newScope) {
            scope.pop();
        }
        return Stmt.compound(text.range(node), statements);
    }

    private List<Stmt> blockStatements(TSNode parent, int from) {
        List<Stmt> statements = new ArrayList<>();
        for (Item item : items(parent, from)) {
            if (item.isBareSpecifiers()) {
                DeclSpec spec = bareSpec(item.specifiers());
                statements.add(Stmt.declaration(text.range(item.startByte(), item.endByte()),
                        List.of(), spec.declaresTag));
            } else if (item.node().getType().equals("case_statement")) {
                statements.addAll(caseStatement(item.node()));
            } else {
                statements.add(statement(item.node()));
            }
        }
        return statements;
    }

    private Stmt statement(TSNode node) {
        Range range = text.range(node);
        switch (node.getType()) {
            case "compound_statement":
                return compound(node, true);
            case "declaration":
                return declarationStatement(node);
            case "type_definition":
                parseTypedef(node);
                return Stmt.declaration(range, List.of());
            case "static_assert_declaration":
                return Stmt.declaration(range, List.of());
            case "expression_statement": {
                TSNode inner = firstNamedChild(node);
                if (inner == null || inner.getType().equals("gnu_asm_expression")) {
                    return Stmt.simple(StmtKind.NULL, range);
                }
                return Stmt.expression(range, expression(inner));
            }
            case "if_statement": {
                Expr condition = condition(node.getChildByFieldName("condition"));
                Stmt then = statement(node.getChildByFieldName("consequence"));
                TSNode alternative = node.getChildByFieldName("alternative");
                Stmt otherwise = null;
                if (!alternative.isNull()) {
                    otherwise = statement(alternative.getType().equals("else_clause")
                            ? firstNamedChild(alternative)
                            : alternative);
                }
                return Stmt.ifStmt(range, condition, then, otherwise);
            }
            case "while_statement": {
                Expr condition = condition(node.getChildByFieldName("condition"));
                return Stmt.whileStmt(range, condition, statement(node.getChildByFieldName("body")));
            }
            case "do_statement": {
                Stmt body = statement(node.getChildByFieldName("body"));
                return Stmt.doStmt(range, body, condition(node.getChildByFieldName("condition")));
            }
            case "for_statement":
                return forStatement(node);
            case "switch_statement": {
                Expr condition = condition(node.getChildByFieldName("condition"));
                return Stmt.switchStmt(range, condition, statement(node.getChildByFieldName("body")));
            }
            case "case_statement":
                return caseStatement(node).get(0);
            case "labeled_statement": {
                TSNode label = node.getChildByFieldName("label");
                TSNode inner = null;
                for (TSNode child : namedChildren(node)) {
                    if (!sameNode(child, label)) {
                        inner = child;
                    }
                }
                Stmt body = inner != null ? statement(inner) : Stmt.simple(StmtKind.NULL, range);
                return Stmt.labelStmt(range, text.text(label), body);
            }
            case "attributed_statement": {
                List<TSNode> children = namedChildren(node);
                return statement(children.get(children.size() - 1));
            }
            case "return_statement": {
                TSNode valueNode = firstNamedChild(node);
                Expr value = null;
                if (valueNode != null) {
                    value = expression(valueNode);
                    if (currentFunction != null) {
                        value = TypeRules.convert(value, currentFunction.getReturnType());
                    }
                }
                return Stmt.returnStmt(range, value);
            }
            case "break_statement":
                return Stmt.simple(StmtKind.BREAK, range);
            case "continue_statement":
                return Stmt.simple(StmtKind.CONTINUE, range);
            case "goto_statement":
                return Stmt.gotoStmt(range, text.text(node.getChildByFieldName("label")));
            case "function_definition":
                throw error(node, "Nested function definitions are not supported");
            default:
                throw error(node, "Unsupported statement");
        }
    }

    /**
     * A case or default label and the statements after it. The first one
     * becomes the label's sub-statement, the rest follow as siblings.
     */
    private List<Stmt> caseStatement(TSNode node) {
        int colon = 0;
        while (colon < node.getChildCount() && !node.getChild(colon).getType().equals(":")) {
            colon++;
        }
        List<Stmt> body = blockStatements(node, colon + 1);
        Stmt first = body.isEmpty()
                ? Stmt.simple(StmtKind.NULL, text.range(node.getChild(Math.min(colon, node.getChildCount() - 1))))
                : body.get(0);
        Range range = Range.span(text.range(node), first.range());
        TSNode value = node.getChildByFieldName("value");
        List<Stmt> result = new ArrayList<>();
        result.add(value.isNull()
                ? Stmt.defaultStmt(range, first)
                : Stmt.caseStmt(range, expression(value), first));
        if (body.size() > 1) {
            result.addAll(body.subList(1, body.size()));
        }
        return result;
    }

    private Stmt forStatement(TSNode node) {
        scope.push();
        TSNode init = node.getChildByFieldName("initializer");
        Stmt initializer = null;
        if (!init.isNull()) {
            initializer = init.getType().equals("declaration")
                    ? declarationStatement(init)
                    : Stmt.expression(text.range(init), expression(init));
        }
        TSNode conditionNode = node.getChildByFieldName("condition");
        Expr condition = conditionNode.isNull() ? null : expression(conditionNode);
        TSNode updateNode = node.getChildByFieldName("update");
        Expr increment = updateNode.isNull() ? null : expression(updateNode);
        Stmt body = statement(node.getChildByFieldName("body"));
        scope.pop();
        return Stmt.forStmt(text.range(node), initializer, condition, increment, body);
    }

    private Expr condition(TSNode node) {
        if (node.getType().equals("parenthesized_expression")) {
            TSNode inner = firstNamedChild(node);
            if (inner.getType().equals("compound_statement")) {
                throw error(node, "Statement expressions are not supported");
            }
            return expression(inner);
        }
        return expression(node);
    }

    private Stmt declarationStatement(TSNode node) {
        Range range = text.range(node);
        List<TSNode> declarators = declarators(node);
        Expr reread = rereadDeclaration(node, declarators);
        if (reread != null) {
            return Stmt.expression(range, reread);
        }
        DeclSpec spec = declSpec(node);
        List<VarDecl> variables = new ArrayList<>();
        for (TSNode declaratorNode : declarators) {
            Declarator d = new Declarator();
            CType type = declare(declaratorNode, spec.type, d);
            Range declared = text.range(node.getStartByte(), declaratorEnd(declaratorNode));
            if (type.isFunction()) {
                List<VarDecl> params = d.parameters != null ? d.parameters : List.of();
                scope.declare(d.name, new FunctionDecl(d.name, declared, type, params));
                continue;
            }
            VarDecl variable = new VarDecl(d.name, declared, type, false, false, spec.isStatic);
            scope.declare(d.name, variable);
            TSNode value = declaratorNode.getChildByFieldName("value");
            if (declaratorNode.getType().equals("init_declarator") && !value.isNull()) {
                variable.setInitializer(initializer(value, type));
            }
            variables.add(variable);
        }
        return Stmt.declaration(range, variables, spec.declaresTag);
    }

    /**
     * {@code a * b;} and {@code f (x);} where {@code a} or {@code f} is not a
     * typedef name are a product and a call.
     */
    private Expr rereadDeclaration(TSNode node, List<TSNode> declarators) {
        TSNode typeNode = node.getChildByFieldName("type");
        if (!typeNode.getType().equals("type_identifier") || scope.isTypedefName(text.text(typeNode))
                || declarators.size() != 1 || namedChildren(node).size() != 2) {
            return null;
        }
        TSNode d = declarators.get(0);
        TSNode inner = firstNamedChild(d);
        if (inner == null || !inner.getType().equals("identifier")) {
            return null;
        }
        Range range = text.range(node.getStartByte(), d.getEndByte());
        switch (d.getType()) {
            case "pointer_declarator" -> {
                Expr left = nameRef(typeNode, false);
                return makeBinary(range, BinaryOperator.MUL, left, nameRef(inner, false));
            }
            case "parenthesized_declarator" -> {
                Expr callee = nameRef(typeNode, true);
                return makeCall(range, callee, List.of(nameRef(inner, false)));
            }
            default -> {
                return null;
            }
        }
    }

    // ---------------------------------------------------------------- expressions

    private Expr expression(TSNode node) {
        Range range = text.range(node);
        switch (node.getType()) {
            case "identifier", "true", "false", "null":
                return nameRef(node, false);
            case "number_literal":
                return numberLiteral(node);
            case "char_literal":
                return Expr.characterLiteral(range, CType.INT, Literals.characterValue(text.text(node)));
            case "string_literal", "concatenated_string":
                return stringLiteral(node);
            case "parenthesized_expression": {
                TSNode inner = firstNamedChild(node);
                if (inner.getType().equals("compound_statement")) {
                    throw error(node, "Statement expressions are not supported");
                }
                return Expr.paren(range, expression(inner));
            }
            case "comma_expression": {
                Expr left = expression(node.getChildByFieldName("left"));
                Expr right = expression(node.getChildByFieldName("right"));
                return Expr.binary(range, right.type(), BinaryOperator.COMMA, left, right);
            }
            case "assignment_expression":
                return assignment(node);
            case "binary_expression":
                return operatorChain(node);
            case "conditional_expression":
                return conditional(node);
            case "unary_expression", "pointer_expression": {
                UnaryOperator op = UnaryOperator.prefix(text.text(node.getChildByFieldName("operator")));
                return makeUnary(range, op, expression(node.getChildByFieldName("argument")));
            }
            case "update_expression": {
                TSNode opNode = node.getChildByFieldName("operator");
                TSNode argumentNode = node.getChildByFieldName("argument");
                Expr operand = expression(argumentNode);
                String spelled = text.text(opNode);
                UnaryOperator op;
                if (opNode.getStartByte() < argumentNode.getStartByte()) {
                    op = UnaryOperator.prefix(spelled);
                } else {
                    op = spelled.equals("++") ? UnaryOperator.POST_INC : UnaryOperator.POST_DEC;
                }
                return Expr.unary(range, operand.type(), op, operand);
            }
            case "cast_expression":
                return cast(node);
            case "compound_literal_expression":
                return initList(node.getChildByFieldName("value"),
                        typeDescriptor(node.getChildByFieldName("type")), range);
            case "sizeof_expression":
                return sizeof(node);
            case "alignof_expression":
                return Expr.sizeofType(range, typeDescriptor(node.getChildByFieldName("type")));
            case "subscript_expression":
                return makeSubscript(range, expression(node.getChildByFieldName("argument")),
                        expression(node.getChildByFieldName("index")));
            case "call_expression":
                return call(node);
            case "field_expression": {
                Expr base = expression(node.getChildByFieldName("argument"));
                boolean arrow = text.text(node.getChildByFieldName("operator")).equals("->");
                return makeMember(range, base, node.getChildByFieldName("field"), arrow);
            }
            default:
                throw error(node, "Unsupported expression");
        }
    }

    /**
     * Rebuild a run of binary operators by precedence. Operands that
     * tree-sitter read as casts of a non-type name are split into the
     * parenthesized name and the binary operator they really are.
     */
    private Expr operatorChain(TSNode node) {
        List<Expr> operands = new ArrayList<>();
        List<BinaryOperator> operators = new ArrayList<>();
        flatten(node, operands, operators);
        Deque<Expr> values = new ArrayDeque<>();
        Deque<BinaryOperator> pending = new ArrayDeque<>();
        values.push(operands.get(0));
        for (int i = 0; i < operators.size(); i++) {
            BinaryOperator op = operators.get(i);
            while (!pending.isEmpty() && pending.peek().precedence() >= op.precedence()) {
                reduce(values, pending);
            }
            pending.push(op);
            values.push(operands.get(i + 1));
        }
        while (!pending.isEmpty()) {
            reduce(values, pending);
        }
        return values.pop();
    }

    private void reduce(Deque<Expr> values, Deque<BinaryOperator> pending) {
        Expr right = values.pop();
        Expr left = values.pop();
        values.push(makeBinary(Range.span(left.range(), right.range()), pending.pop(), left, right));
    }

    private void flatten(TSNode node, List<Expr> operands, List<BinaryOperator> operators) {
        if (node.getType().equals("binary_expression")) {
            flatten(node.getChildByFieldName("left"), operands, operators);
            operators.add(BinaryOperator.infix(text.text(node.getChildByFieldName("operator"))));
            flatten(node.getChildByFieldName("right"), operands, operators);
        } else if (isMisreadCast(node)) {
            TSNode unary = node.getChildByFieldName("value");
            operands.add(parenthesizedName(node));
            operators.add(CAST_AMBIGUOUS.get(text.text(unary.getChildByFieldName("operator"))));
            flatten(unary.getChildByFieldName("argument"), operands, operators);
        } else {
            operands.add(expression(node));
        }
    }

    /**
     * {@code (name)} followed by an operand, where {@code name} is not a type.
     */
    private boolean isValueInParens(TSNode descriptor) {
        TSNode type = descriptor.getChildByFieldName("type");
        return type.getType().equals("type_identifier")
                && descriptor.getChildByFieldName("declarator").isNull()
                && namedChildren(descriptor).size() == 1
                && !scope.isTypedefName(text.text(type));
    }

    private boolean isMisreadCast(TSNode node) {
        if (!node.getType().equals("cast_expression") || !isValueInParens(node.getChildByFieldName("type"))) {
            return false;
        }
        TSNode value = node.getChildByFieldName("value");
        if (!value.getType().equals("unary_expression") && !value.getType().equals("pointer_expression")) {
            return false;
        }
        return CAST_AMBIGUOUS.containsKey(text.text(value.getChildByFieldName("operator")));
    }

    private Expr parenthesizedName(TSNode cast) {
        TSNode name = cast.getChildByFieldName("type").getChildByFieldName("type");
        int close = name.getEndByte();
        for (int i = 0; i < cast.getChildCount(); i++) {
            if (cast.getChild(i).getType().equals(")")) {
                close = cast.getChild(i).getEndByte();
                break;
            }
        }
        return Expr.paren(text.range(cast.getStartByte(), close), nameRef(name, false));
    }

    private Expr cast(TSNode node) {
        if (isMisreadCast(node)) {
            return operatorChain(node);
        }
        TSNode descriptor = node.getChildByFieldName("type");
        TSNode valueNode = node.getChildByFieldName("value");
        if (isValueInParens(descriptor) && valueNode.getType().equals("parenthesized_expression")) {
            Expr callee = parenthesizedName(node);
            List<Expr> arguments = new ArrayList<>();
            TSNode inner = firstNamedChild(valueNode);
            while (inner.getType().equals("comma_expression")) {
                arguments.add(0, expression(inner.getChildByFieldName("right")));
                inner = inner.getChildByFieldName("left");
            }
            arguments.add(0, expression(inner));
            return makeCall(text.range(node), callee, arguments);
        }
        CType type = typeDescriptor(descriptor);
        return Expr.cast(text.range(node), type, expression(valueNode));
    }

    private Expr sizeof(TSNode node) {
        Range range = text.range(node);
        TSNode descriptor = node.getChildByFieldName("type");
        if (descriptor.isNull()) {
            return Expr.sizeofExpr(range, expression(node.getChildByFieldName("value")));
        }
        if (isValueInParens(descriptor)) {
            TSNode name = descriptor.getChildByFieldName("type");
            int open = node.getStartByte();
            int close = name.getEndByte();
            for (int i = 0; i < node.getChildCount(); i++) {
                String type = node.getChild(i).getType();
                if (type.equals("(")) {
                    open = node.getChild(i).getStartByte();
                } else if (type.equals(")")) {
                    close = node.getChild(i).getEndByte();
                }
            }
            return Expr.sizeofExpr(range, Expr.paren(text.range(open, close), nameRef(name, false)));
        }
        return Expr.sizeofType(range, typeDescriptor(descriptor));
    }

    private Expr assignment(TSNode node) {
        BinaryOperator op = BinaryOperator.assignment(text.text(node.getChildByFieldName("operator")));
        Expr lhs = expression(node.getChildByFieldName("left"));
        Expr rhs = expression(node.getChildByFieldName("right"));
        CType type = lhs.type().unqualified();
        if (op == BinaryOperator.ASSIGN) {
            rhs = TypeRules.convert(rhs, type);
        }
        return Expr.binary(text.range(node), type, op, lhs, rhs);
    }

    private Expr conditional(TSNode node) {
        Expr condition = expression(node.getChildByFieldName("condition"));
        TSNode consequence = node.getChildByFieldName("consequence");
        if (consequence.isNull()) {
            throw error(node, "Conditionals without a middle operand are not supported");
        }
        Expr then = expression(consequence);
        Expr otherwise = expression(node.getChildByFieldName("alternative"));
        CType type;
        if (then.type().isArithmetic() && otherwise.type().isArithmetic()) {
            type = TypeRules.commonType(then.type(), otherwise.type());
            then = TypeRules.convert(then, type);
            otherwise = TypeRules.convert(otherwise, type);
        } else if (then.type().decay().isPointer() || !otherwise.type().decay().isPointer()) {
            type = then.type().decay();
        } else {
            type = otherwise.type().decay();
        }
        return Expr.conditional(text.range(node), type, condition, then, otherwise);
    }

    private Expr makeBinary(Range range, BinaryOperator op, Expr left, Expr right) {
        CType lt = left.type().decay();
        CType rt = right.type().decay();
        boolean arithmetic = lt.isArithmetic() && rt.isArithmetic();
        if (op.isLogical()) {
            return Expr.binary(range, CType.INT, op, left, right);
        }
        if (op.isComparison()) {
            if (arithmetic) {
                CType common = TypeRules.commonType(lt, rt);
                left = TypeRules.convert(left, common);
                right = TypeRules.convert(right, common);
            }
            return Expr.binary(range, CType.INT, op, left, right);
        }
        if (op.isShift() && arithmetic) {
            CType type = TypeRules.promote(lt);
            return Expr.binary(range, type, op, TypeRules.convert(left, type),
                    TypeRules.convert(right, TypeRules.promote(rt)));
        }
        if (arithmetic) {
            CType common = TypeRules.commonType(lt, rt);
            return Expr.binary(range, common, op, TypeRules.convert(left, common),
                    TypeRules.convert(right, common));
        }
        if (op == BinaryOperator.ADD || op == BinaryOperator.SUB) {
            if (lt.isPointer() && rt.isInteger()) {
                return Expr.binary(range, lt, op, left, right);
            }
            if (op == BinaryOperator.ADD && lt.isInteger() && rt.isPointer()) {
                return Expr.binary(range, rt, op, left, right);
            }
            if (op == BinaryOperator.SUB && lt.isPointer() && rt.isPointer()) {
                return Expr.binary(range, CType.builtin(TypeKind.LONG), op, left, right);
            }
        }
        throw new SourceParseException("Invalid operands to binary '" + op.spelling() + "' ("
                + left.type() + " and " + right.type() + ")", range.startLine(), range.startColumn());
    }

    private Expr makeUnary(Range range, UnaryOperator op, Expr operand) {
        CType type = operand.type();
        switch (op) {
            case ADDR_OF -> {
                return Expr.unary(range, CType.pointerTo(type), op, operand);
            }
            case DEREF -> {
                CType pointer = type.decay();
                if (!pointer.isPointer()) {
                    throw new SourceParseException("Indirection requires pointer operand (" + type + ")",
                            range.startLine(), range.startColumn());
                }
                return Expr.unary(range, pointer.element(), op, operand);
            }
            case LOGICAL_NOT -> {
                return Expr.unary(range, CType.INT, op, operand);
            }
            default -> {
                CType promoted = type.isArithmetic() ? TypeRules.promote(type) : type;
                return Expr.unary(range, promoted, op, TypeRules.convert(operand, promoted));
            }
        }
    }

    private Expr makeSubscript(Range range, Expr base, Expr index) {
        CType bt = base.type().decay();
        CType it = index.type().decay();
        CType element;
        if (bt.isPointer()) {
            element = bt.element();
        } else if (it.isPointer()) {
            element = it.element();
        } else {
            throw new SourceParseException("Subscripted value is not an array or pointer",
                    range.startLine(), range.startColumn());
        }
        return Expr.subscript(range, element, base, index);
    }

    private Expr call(TSNode node) {
        TSNode function = node.getChildByFieldName("function");
        Expr callee = function.getType().equals("identifier") ? nameRef(function, true) : expression(function);
        List<Expr> arguments = new ArrayList<>();
        for (TSNode argument : namedChildren(node.getChildByFieldName("arguments"))) {
            arguments.add(expression(argument));
        }
        return makeCall(text.range(node), callee, arguments);
    }

    private Expr makeCall(Range range, Expr callee, List<Expr> arguments) {
        CType ct = callee.type();
        CType function = null;
        if (ct.isFunction()) {
            function = ct;
        } else if (ct.isPointer() && ct.element().isFunction()) {
            function = ct.element();
        }
        if (function == null) {
            throw new SourceParseException("Called object is not a function (" + ct + ")",
                    range.startLine(), range.startColumn());
        }
        List<CType> params = function.parameters();
        List<Expr> converted = new ArrayList<>(arguments.size());
        for (int i = 0; i < arguments.size(); i++) {
            Expr arg = arguments.get(i);
            if (i < params.size()) {
                converted.add(TypeRules.convert(arg, params.get(i)));
            } else if (arg.type().isFloating() && arg.type().kind() == TypeKind.FLOAT) {
                converted.add(TypeRules.convert(arg, CType.DOUBLE));
            } else if (arg.type().isInteger()) {
                converted.add(TypeRules.convert(arg, TypeRules.promote(arg.type())));
            } else {
                converted.add(arg);
            }
        }
        return Expr.call(range, function.element(), callee, converted);
    }

    private Expr makeMember(Range range, Expr base, TSNode name, boolean arrow) {
        CType recordType = base.type();
        if (arrow) {
            CType pointer = recordType.decay();
            recordType = pointer.isPointer() ? pointer.element() : null;
        }
        if (recordType == null || !recordType.isRecord()) {
            throw error(name, "Member reference base type is not a structure or union");
        }
        FieldDecl field = recordType.record().findField(text.text(name));
        if (field == null) {
            throw error(name, "No member named '" + text.text(name) + "' in " + recordType);
        }
        return Expr.member(range, field.getType(), base, field, arrow);
    }

    private Expr nameRef(TSNode name, boolean callee) {
        String spelled = text.text(name);
        Decl decl = scope.lookup(spelled);
        if (decl == null) {
            decl = callee ? implicitFunction(name) : implicitVariable(name);
        }
        CType type;
        if (decl instanceof VarDecl variable) {
            type = variable.getType();
        } else if (decl instanceof FunctionDecl function) {
            type = function.getType();
        } else if (decl instanceof EnumConstantDecl constant) {
            type = constant.getType();
        } else {
            throw error(name, "'" + spelled + "' does not name a value");
        }
        return Expr.nameRef(text.range(name), type, decl);
    }

    private FunctionDecl implicitFunction(TSNode name) {
        String spelled = text.text(name);
        logger.warn("{}:{}: implicit declaration of function '{}'", fileName, position(name), spelled);
        FunctionDecl function = new FunctionDecl(spelled, null,
                CType.function(CType.INT, List.of(), true), List.of());
        scope.declareInFileScope(spelled, function);
        return function;
    }

    private VarDecl implicitVariable(TSNode name) {
        String spelled = text.text(name);
        CType type = CType.INT;
        if (PREDEFINED_NAMES.contains(spelled)) {
            type = CType.arrayOf(CType.CHAR.withQualifiers(true, false), -1);
        } else {
            logger.warn("{}:{}: undeclared identifier '{}' treated as int", fileName, position(name), spelled);
        }
        VarDecl variable = new VarDecl(spelled, null, type, false, true, false);
        scope.declareInFileScope(spelled, variable);
        return variable;
    }

    private Expr numberLiteral(TSNode node) {
        String spelled = text.text(node);
        boolean hex = spelled.startsWith("0x") || spelled.startsWith("0X");
        boolean floating = hex
                ? spelled.indexOf('.') >= 0 || spelled.indexOf('p') >= 0 || spelled.indexOf('P') >= 0
                : spelled.indexOf('.') >= 0 || spelled.indexOf('e') >= 0 || spelled.indexOf('E') >= 0;
        return floating ? floatingLiteral(node, spelled) : integerLiteral(node, spelled);
    }

    private Expr integerLiteral(TSNode node, String spelled) {
        int end = spelled.length();
        boolean unsigned = false;
        int longs = 0;
        while (end > 0 && "uUlL".indexOf(spelled.charAt(end - 1)) >= 0) {
            char c = spelled.charAt(end - 1);
            if (c == 'u' || c == 'U') {
                unsigned = true;
            } else {
                longs++;
            }
            end--;
        }
        String digits = spelled.substring(0, end);
        int radix = 10;
        if (digits.startsWith("0x") || digits.startsWith("0X")) {
            radix = 16;
            digits = digits.substring(2);
        } else if (digits.startsWith("0b") || digits.startsWith("0B")) {
            radix = 2;
            digits = digits.substring(2);
        } else if (digits.length() > 1 && digits.startsWith("0")) {
            radix = 8;
        }
        BigInteger value;
        try {
            value = new BigInteger(digits.replace("'", ""), radix);
        } catch (NumberFormatException e) {
            throw error(node, "Invalid integer constant '" + spelled + "'");
        }
        CType type = TypeRules.integerConstantType(value, radix == 10, unsigned, longs);
        return Expr.integerLiteral(text.range(node), type, value);
    }

    private Expr floatingLiteral(TSNode node, String spelled) {
        CType type = CType.DOUBLE;
        String digits = spelled;
        char last = spelled.charAt(spelled.length() - 1);
        if (last == 'f' || last == 'F') {
            type = CType.builtin(TypeKind.FLOAT);
            digits = spelled.substring(0, spelled.length() - 1);
        } else if (last == 'l' || last == 'L') {
            type = CType.builtin(TypeKind.LONG_DOUBLE);
            digits = spelled.substring(0, spelled.length() - 1);
        }
        BigDecimal value;
        try {
            value = Literals.floatingValue(digits, type.kind());
        } catch (NumberFormatException e) {
            throw error(node, "Invalid floating constant '" + spelled + "'");
        }
        return Expr.floatingLiteral(text.range(node), type, value);
    }

    private Expr stringLiteral(TSNode node) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        List<TSNode> parts = node.getType().equals("concatenated_string") ? namedChildren(node) : List.of(node);
        for (TSNode part : parts) {
            if (!part.getType().equals("string_literal")) {
                throw error(part, "Unsupported string concatenation");
            }
            byte[] decoded = Literals.decode(text.text(part));
            bytes.write(decoded, 0, decoded.length);
        }
        byte[] all = bytes.toByteArray();
        return Expr.stringLiteral(text.range(node), CType.arrayOf(CType.CHAR, all.length + 1L), all);
    }

    // ---------------------------------------------------------------- node helpers

    private static List<TSNode> namedChildren(TSNode node) {
        List<TSNode> children = new ArrayList<>();
        if (node == null || node.isNull()) {
            return children;
        }
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            TSNode child = node.getNamedChild(i);
            if (!child.getType().equals("comment")) {
                children.add(child);
            }
        }
        return children;
    }

    private static TSNode firstNamedChild(TSNode node) {
        List<TSNode> children = namedChildren(node);
        return children.isEmpty() ? null : children.get(0);
    }

    private static boolean hasChild(TSNode node, String type) {
        for (int i = 0; i < node.getChildCount(); i++) {
            if (node.getChild(i).getType().equals(type)) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasNamedChild(TSNode node, String type) {
        return namedChildren(node).stream().anyMatch(c -> c.getType().equals(type));
    }

    private static boolean sameNode(TSNode a, TSNode b) {
        return b != null && !b.isNull()
                && a.getStartByte() == b.getStartByte()
                && a.getEndByte() == b.getEndByte()
                && a.getType().equals(b.getType());
    }

    private String position(TSNode node) {
        int offset = text.offset(node.getStartByte());
        return text.line(offset) + ":" + text.column(offset);
    }

    private SourceParseException error(TSNode node, String message) {
        int offset = text.offset(node.getStartByte());
        return new SourceParseException(message, text.line(offset), text.column(offset));
    }
}
