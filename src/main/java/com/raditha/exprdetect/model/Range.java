package com.raditha.exprdetect.model;

/**
 * A span of the main source file.
 * Offsets index into the source text (0-based, end exclusive); lines and
 * columns are 1-based and point at the first and last character.
 *
 * @param startOffset offset of the first character
 * @param endOffset   offset one past the last character
 * @param startLine   starting line number
 * @param startColumn starting column number
 * @param endLine     ending line number (inclusive)
 * @param endColumn   ending column number (inclusive)
 */
public record Range(
        int startOffset,
        int endOffset,
        int startLine,
        int startColumn,
        int endLine,
        int endColumn) {

    public Range {
        if (startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException(
                    "Invalid range offsets: " + startOffset + ".." + endOffset);
        }
    }

    /**
     * Create the range covering both {@code first} and {@code last}.
     */
    public static Range span(Range first, Range last) {
        return new Range(
                first.startOffset,
                last.endOffset,
                first.startLine,
                first.startColumn,
                last.endLine,
                last.endColumn);
    }

    /**
     * Whether this range starts strictly before {@code other} starts.
     */
    public boolean isBefore(Range other) {
        return startOffset < other.startOffset;
    }

    /**
     * Format as "L45-52" for display.
     */
    public String toDisplayString() {
        if (startLine == endLine) {
            return "L" + startLine;
        }
        return "L" + startLine + "-" + endLine;
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
