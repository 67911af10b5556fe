package com.raditha.exprdetect.rewrite;

import com.raditha.exprdetect.model.Range;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RewriteBufferTest {

    private static Range range(int start, int end) {
        return new Range(start, end, 1, start + 1, 1, end);
    }

    @Test
    void testUntouchedBufferRendersSource() {
        RewriteBuffer buffer = new RewriteBuffer("x = a + b;");
        assertFalse(buffer.isModified());
        assertEquals("x = a + b;", buffer.render());
    }

    @Test
    void testInsertAndReplace() {
        RewriteBuffer buffer = new RewriteBuffer("x = a + b;");
        buffer.replace(range(4, 5), "(t)");
        buffer.insert(0, "int t = a; ");
        assertTrue(buffer.isModified());
        assertEquals("int t = a; x = (t) + b;", buffer.render());
    }

    @Test
    void testInsertionsAtOneOffsetKeepTheirOrderAndPrecedeReplacement() {
        RewriteBuffer buffer = new RewriteBuffer("abc");
        buffer.replace(range(0, 1), "X");
        buffer.insert(0, "1");
        buffer.insert(0, "2");
        assertEquals("12Xbc", buffer.render());
    }

    @Test
    void testInsertAtEnd() {
        RewriteBuffer buffer = new RewriteBuffer("abc");
        buffer.insert(3, " }");
        assertEquals("abc }", buffer.render());
    }

    @Test
    void testOverlappingReplacementsAreRejected() {
        RewriteBuffer buffer = new RewriteBuffer("abcdef");
        buffer.replace(range(1, 4), "X");
        assertThrows(IllegalStateException.class, () -> buffer.replace(range(3, 5), "Y"));
        buffer.replace(range(4, 6), "Z");
        assertEquals("aXZ", buffer.render());
    }

    @Test
    void testInsertionInsideReplacedSpanFailsOnRender() {
        RewriteBuffer buffer = new RewriteBuffer("abcdef");
        buffer.replace(range(1, 4), "X");
        buffer.insert(2, "!");
        assertThrows(IllegalStateException.class, buffer::render);
    }

    @Test
    void testOffsetsOutsideTheSourceAreRejected() {
        RewriteBuffer buffer = new RewriteBuffer("abc");
        assertThrows(IllegalArgumentException.class, () -> buffer.insert(4, "x"));
        assertThrows(IllegalArgumentException.class, () -> buffer.insert(-1, "x"));
        assertThrows(IllegalArgumentException.class, () -> buffer.replace(range(2, 5), "x"));
    }
}
