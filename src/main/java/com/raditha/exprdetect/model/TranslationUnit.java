package com.raditha.exprdetect.model;

import java.util.List;
import java.util.Optional;

/**
 * A parsed main file: its text, dialect, top-level declarations in source
 * order and the {@code #include} directives it contains.
 */
public final class TranslationUnit {

    private final String fileName;
    private final String source;
    private final Dialect dialect;
    private final List<Decl> declarations;
    private final List<InclusionDirective> inclusions;

    public TranslationUnit(String fileName, String source, Dialect dialect, List<Decl> declarations,
            List<InclusionDirective> inclusions) {
        this.fileName = fileName;
        this.source = source;
        this.dialect = dialect;
        this.declarations = List.copyOf(declarations);
        this.inclusions = List.copyOf(inclusions);
    }

    public String getFileName() {
        return fileName;
    }

    public String getSource() {
        return source;
    }

    public Dialect getDialect() {
        return dialect;
    }

    public List<Decl> getDeclarations() {
        return declarations;
    }

    public List<InclusionDirective> getInclusions() {
        return inclusions;
    }

    /**
     * Function definitions in declaration order.
     */
    public List<FunctionDecl> functionDefinitions() {
        return declarations.stream()
                .filter(FunctionDecl.class::isInstance)
                .map(FunctionDecl.class::cast)
                .filter(FunctionDecl::isDefinition)
                .toList();
    }

    /**
     * First declaration or definition of a function with the given name.
     * Implicit declarations do not count.
     */
    public Optional<FunctionDecl> firstFunctionNamed(String name) {
        return declarations.stream()
                .filter(FunctionDecl.class::isInstance)
                .map(FunctionDecl.class::cast)
                .filter(f -> !f.isImplicit() && name.equals(f.getName()))
                .findFirst();
    }

    /**
     * First {@code #include} of the given header in the main file.
     */
    public Optional<InclusionDirective> firstInclusionOf(String headerName) {
        return inclusions.stream()
                .filter(i -> i.headerName().equals(headerName))
                .findFirst();
    }

    /**
     * Exact source text covered by a range.
     */
    public String textOf(Range range) {
        return source.substring(range.startOffset(), range.endOffset());
    }

    /**
     * Line terminator of the source: CRLF when the first line ends with one,
     * LF otherwise.
     */
    public String lineSeparator() {
        int newline = source.indexOf('\n');
        return newline > 0 && source.charAt(newline - 1) == '\r' ? "\r\n" : "\n";
    }

    /**
     * Leading whitespace of the line containing {@code offset}.
     */
    public String indentationAt(int offset) {
        int lineStart = source.lastIndexOf('\n', Math.max(0, offset - 1)) + 1;
        if (offset == 0) {
            lineStart = 0;
        }
        int end = lineStart;
        while (end < offset && (source.charAt(end) == ' ' || source.charAt(end) == '\t')) {
            end++;
        }
        return source.substring(lineStart, end);
    }
}
