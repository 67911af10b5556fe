package com.raditha.exprdetect.frontend;

import com.raditha.exprdetect.model.Range;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps the UTF-8 byte offsets of tree-sitter nodes back to offsets, lines and
 * columns of the string that was parsed.
 * <p>
 * Sources read as ISO-8859-1 hold one char per file byte, but tree-sitter sees
 * them UTF-8 encoded, where every char above U+007F takes two bytes.
 */
final class SourceText {

    private final String source;
    private final int[] charAtByte;
    private final int[] lineStarts;

    SourceText(String source) {
        this.source = source;
        this.charAtByte = buildByteMap(source);
        this.lineStarts = buildLineStarts(source);
    }

    private static int[] buildByteMap(String source) {
        int length = 0;
        for (int i = 0; i < source.length(); ) {
            int cp = source.codePointAt(i);
            length += utf8Width(cp);
            i += Character.charCount(cp);
        }
        int[] map = new int[length + 1];
        int b = 0;
        for (int i = 0; i < source.length(); ) {
            int cp = source.codePointAt(i);
            int width = utf8Width(cp);
            for (int k = 0; k < width; k++) {
                map[b + k] = i;
            }
            b += width;
            i += Character.charCount(cp);
        }
        map[length] = source.length();
        return map;
    }

    private static int utf8Width(int cp) {
        if (cp < 0x80) {
            return 1;
        }
        if (cp < 0x800) {
            return 2;
        }
        return cp < 0x10000 ? 3 : 4;
    }

    private static int[] buildLineStarts(String source) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * Char offset of a byte offset.
     */
    int offset(int byteOffset) {
        return charAtByte[Math.min(Math.max(byteOffset, 0), charAtByte.length - 1)];
    }

    Range range(TSNode node) {
        return range(node.getStartByte(), node.getEndByte());
    }

    Range range(int startByte, int endByte) {
        int start = offset(startByte);
        int end = Math.max(start, offset(endByte));
        int last = Math.max(start, end - 1);
        return new Range(start, end, line(start), column(start), line(last), column(last));
    }

    String text(TSNode node) {
        return source.substring(offset(node.getStartByte()), offset(node.getEndByte()));
    }

    /**
     * 1-based line of a char offset.
     */
    int line(int offset) {
        int low = 0;
        int high = lineStarts.length - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lineStarts[mid] <= offset) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low + 1;
    }

    /**
     * 1-based column of a char offset.
     */
    int column(int offset) {
        return offset - lineStarts[line(offset) - 1] + 1;
    }
}
