package com.raditha.exprdetect.rewrite;

import com.raditha.exprdetect.model.Range;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Text edits against the original source, addressed by offsets into that
 * source. Nothing is applied until {@link #render()}.
 * <p>
 * Insertions at the same offset keep the order in which they were made and
 * all come before a replacement starting at that offset.
 */
public class RewriteBuffer {

    private record Edit(int start, int end, String text, int sequence) {
        boolean isInsertion() {
            return start == end;
        }
    }

    private static final Comparator<Edit> ORDER = Comparator
            .comparingInt(Edit::start)
            .thenComparing(e -> e.isInsertion() ? 0 : 1)
            .thenComparingInt(Edit::sequence);

    private final String source;
    private final List<Edit> edits = new ArrayList<>();

    public RewriteBuffer(String source) {
        this.source = source;
    }

    public void insert(int offset, String text) {
        checkOffset(offset);
        edits.add(new Edit(offset, offset, text, edits.size()));
    }

    /**
     * Replace the text covered by {@code range}.
     *
     * @throws IllegalStateException if it overlaps an earlier replacement
     */
    public void replace(Range range, String text) {
        checkOffset(range.endOffset());
        for (Edit e : edits) {
            if (!e.isInsertion() && e.start() < range.endOffset() && range.startOffset() < e.end()) {
                throw new IllegalStateException("Overlapping replacement at offset " + range.startOffset());
            }
        }
        edits.add(new Edit(range.startOffset(), range.endOffset(), text, edits.size()));
    }

    public boolean isModified() {
        return !edits.isEmpty();
    }

    /**
     * The source with every edit applied.
     *
     * @throws IllegalStateException if an insertion falls inside a replaced span
     */
    public String render() {
        List<Edit> ordered = new ArrayList<>(edits);
        ordered.sort(ORDER);
        StringBuilder out = new StringBuilder(source.length() + 256);
        int cursor = 0;
        for (Edit e : ordered) {
            if (e.start() < cursor) {
                throw new IllegalStateException("Edit at offset " + e.start() + " falls inside a replaced span");
            }
            out.append(source, cursor, e.start()).append(e.text());
            cursor = e.end();
        }
        return out.append(source, cursor, source.length()).toString();
    }

    private void checkOffset(int offset) {
        if (offset < 0 || offset > source.length()) {
            throw new IllegalArgumentException("Offset " + offset + " is outside the source");
        }
    }
}
