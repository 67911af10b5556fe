package com.raditha.exprdetect.rewrite;

import com.raditha.exprdetect.model.Range;

/**
 * The edits that instrument one selected instance.
 *
 * @param temporaryName  name of the temporary holding the value, or null in
 *                       replace mode
 * @param guardName      name of the static guard counter, or null in replace
 *                       mode
 * @param prototype      support function prototype to prepend to the file, or
 *                       null when it is already visible
 * @param blockOffset    where the block goes: the start of the statement
 * @param block          the inserted lines, ending with the newline and
 *                       indentation that precede the statement
 * @param braced         whether the block and the statement are wrapped in
 *                       a new compound statement
 * @param statementEnd   offset one past the end of the statement
 * @param replacedRange  range of the selected expression
 * @param replacement    text that takes the place of the expression
 * @param lineSeparator  line terminator of the source, used after the
 *                       prototype
 */
public record InstrumentationPlan(
        String temporaryName,
        String guardName,
        String prototype,
        int blockOffset,
        String block,
        boolean braced,
        int statementEnd,
        Range replacedRange,
        String replacement,
        String lineSeparator) {

    static InstrumentationPlan replacementOnly(Range range, String replacement) {
        return new InstrumentationPlan(null, null, null, range.startOffset(), "", false,
                range.endOffset(), range, replacement, "\n");
    }

    public boolean addsPrototype() {
        return prototype != null;
    }

    /**
     * Record every edit of this plan in {@code buffer}.
     */
    public void applyTo(RewriteBuffer buffer) {
        if (prototype != null) {
            buffer.insert(0, prototype + ";" + lineSeparator);
        }
        if (!block.isEmpty()) {
            buffer.insert(blockOffset, braced ? "{ " + block : block);
        }
        buffer.replace(replacedRange, replacement);
        if (braced) {
            buffer.insert(statementEnd, " }");
        }
    }
}
