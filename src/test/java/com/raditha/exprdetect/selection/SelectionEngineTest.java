package com.raditha.exprdetect.selection;

import com.raditha.exprdetect.analysis.NamingConvention;
import com.raditha.exprdetect.frontend.CFrontEnd;
import com.raditha.exprdetect.frontend.CParser;
import com.raditha.exprdetect.model.Dialect;
import com.raditha.exprdetect.model.ExprKind;
import com.raditha.exprdetect.model.StmtKind;
import com.raditha.exprdetect.model.TranslationUnit;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SelectionEngineTest {

    private static final String SWITCHING = """
            int f(int a) {
              switch (a) {
              case 1:
                return a * 2;
              default:
                return 0;
              }
            }
            """;

    private static final String TWO_FUNCTIONS = """
            int f(int a, int b) {
              if (a) return a + 1;
              return b;
            }

            int g(int c) {
              return c - 1;
            }
            """;

    private final SelectionEngine engine = new SelectionEngine(NamingConvention.defaults());

    private static TranslationUnit parse(String source) {
        return new CParser("selection.c", source).parse();
    }

    @Test
    void testCountsAcrossFunctionsInOrder() {
        TranslationUnit unit = parse(TWO_FUNCTIONS);
        SelectionResult result = engine.select(unit, 5);

        assertEquals(6, result.eligibleCount());
        assertFalse(result.targetExceedsCount());
        CapturedInstance captured = result.captured().orElseThrow();
        assertEquals("g", captured.function().getName());
        assertEquals(ExprKind.BINARY, captured.expression().kind());
        assertEquals("c - 1", unit.textOf(captured.expression().range()));
    }

    @Test
    void testIfConditionBelongsToTheIfStatement() {
        CapturedInstance captured = engine.select(parse(TWO_FUNCTIONS), 1).captured().orElseThrow();
        assertEquals(StmtKind.IF, captured.statement().kind());
        assertFalse(captured.unbraced());
    }

    @Test
    void testUnbracedBodyIsFlagged() {
        TranslationUnit unit = parse(TWO_FUNCTIONS);
        CapturedInstance captured = engine.select(unit, 2).captured().orElseThrow();
        assertEquals(StmtKind.RETURN, captured.statement().kind());
        assertTrue(captured.unbraced());
        assertEquals("a + 1", unit.textOf(captured.expression().range()));

        CapturedInstance last = engine.select(unit, 4).captured().orElseThrow();
        assertEquals(StmtKind.RETURN, last.statement().kind());
        assertFalse(last.unbraced());
    }

    @Test
    void testSwitchConditionAndCaseBodies() {
        TranslationUnit unit = parse(SWITCHING);
        SelectionResult result = engine.select(unit, 1);
        assertEquals(3, result.eligibleCount());
        assertEquals(StmtKind.SWITCH, result.captured().orElseThrow().statement().kind());

        CapturedInstance inCase = engine.select(unit, 2).captured().orElseThrow();
        assertEquals("a * 2", unit.textOf(inCase.expression().range()));
        assertTrue(inCase.unbraced());
    }

    @Test
    void testTargetBeyondCountCapturesNothing() {
        SelectionResult result = engine.select(parse(TWO_FUNCTIONS), 7);
        assertEquals(6, result.eligibleCount());
        assertTrue(result.targetExceedsCount());
        assertTrue(result.captured().isEmpty());
    }

    @Test
    void testInvalidTargetIsRejected() {
        TranslationUnit unit = parse(TWO_FUNCTIONS);
        assertThrows(IllegalArgumentException.class, () -> engine.select(unit, 0));
        assertThrows(IllegalArgumentException.class, () -> engine.select(unit, -3));
    }

    @Test
    void testCxxUnitsHaveNoInstances() {
        TranslationUnit unit = new CFrontEnd().parse("selection.cpp", TWO_FUNCTIONS, Dialect.CXX);
        SelectionResult result = engine.select(unit, 1);
        assertEquals(0, result.eligibleCount());
        assertTrue(result.captured().isEmpty());
    }

    @Test
    void testFunctionPrototypesAreIgnored() {
        assertEquals(0, engine.select(parse("int f(int a);\nint g(int b);\n"), 1).eligibleCount());
    }

    @Property(tries = 30)
    void countDoesNotDependOnTarget(@ForAll @IntRange(min = 1, max = 12) int target) {
        TranslationUnit unit = parse(TWO_FUNCTIONS);
        SelectionResult result = engine.select(unit, target);
        assertEquals(6, result.eligibleCount());
        assertEquals(target <= 6, result.captured().isPresent());
    }

    @Test
    void testRepeatedPassesAgree() {
        TranslationUnit unit = parse(SWITCHING);
        CapturedInstance first = engine.select(unit, 3).captured().orElseThrow();
        CapturedInstance second = engine.select(unit, 3).captured().orElseThrow();
        assertSame(first.expression(), second.expression());
        assertSame(first.statement(), second.statement());
    }
}
