package com.raditha.exprdetect.model;

/**
 * An {@code #include} line of the main file.
 *
 * @param headerName file name between the delimiters, e.g. {@code stdio.h}
 * @param angled     whether written with {@code <...>}
 * @param range      range of the directive line, starting at {@code #}
 */
public record InclusionDirective(
        String headerName,
        boolean angled,
        Range range) {
}
