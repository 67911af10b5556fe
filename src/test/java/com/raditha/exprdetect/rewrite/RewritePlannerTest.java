package com.raditha.exprdetect.rewrite;

import com.raditha.exprdetect.analysis.NamingConvention;
import com.raditha.exprdetect.config.DetectorConfig;
import com.raditha.exprdetect.config.InstrumentMode;
import com.raditha.exprdetect.frontend.CParser;
import com.raditha.exprdetect.model.CType;
import com.raditha.exprdetect.model.TranslationUnit;
import com.raditha.exprdetect.model.TypeKind;
import com.raditha.exprdetect.selection.CapturedInstance;
import com.raditha.exprdetect.selection.SelectionEngine;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class RewritePlannerTest {

    private static final String SUBSCRIPT_BODY = """
            int f(int *a, int i) {
              int x;
              x = a[i] + 1;
              return x;
            }
            """;

    private final RewritePlanner planner = new RewritePlanner(DetectorConfig.defaults());
    private final SelectionEngine engine = new SelectionEngine(NamingConvention.defaults());

    private static TranslationUnit parse(String source) {
        return new CParser("plan.c", source).parse();
    }

    private CapturedInstance select(TranslationUnit unit, int target) {
        return engine.select(unit, target).captured().orElseThrow();
    }

    private static String apply(TranslationUnit unit, InstrumentationPlan plan) {
        RewriteBuffer buffer = new RewriteBuffer(unit.getSource());
        plan.applyTo(buffer);
        return buffer.render();
    }

    @Test
    void testEmitBlockWithVisiblePrintf() {
        TranslationUnit unit = parse("int printf(const char *format, ...);\n" + SUBSCRIPT_BODY);
        InstrumentationPlan plan = planner.planInstrumentation(unit, select(unit, 2), InstrumentMode.EMIT, null);

        assertEquals("__cvise_expr_tmp_1", plan.temporaryName());
        assertEquals("__cvise_printed_1", plan.guardName());
        assertFalse(plan.addsPrototype());
        assertFalse(plan.braced());
        assertEquals("""
                int printf(const char *format, ...);
                int f(int *a, int i) {
                  int x;
                  int __cvise_expr_tmp_1 = a[i];
                  static int __cvise_printed_1 = 0;
                  if (__cvise_printed_1 == __CVISE_INSTANCE_NUMBER) {
                    printf("cvise_value(%d)\\n", __cvise_expr_tmp_1);
                  }
                  ++__cvise_printed_1;
                  x = (__cvise_expr_tmp_1) + 1;
                  return x;
                }
                """, apply(unit, plan));
    }

    @Test
    void testCrlfSourceGetsCrlfLines() {
        TranslationUnit unit = parse(SUBSCRIPT_BODY.replace("\n", "\r\n"));
        InstrumentationPlan plan = planner.planInstrumentation(unit, select(unit, 2), InstrumentMode.CHECK, "5");

        String output = apply(unit, plan);
        assertEquals("\r\n", unit.lineSeparator());
        assertTrue(output.startsWith("void abort(void);\r\nint f(int *a, int i) {\r\n"));
        assertTrue(output.contains("\r\n  ++__cvise_checked_1;\r\n  x = (__cvise_expr_tmp_1) + 1;\r\n"));
        assertFalse(output.replace("\r\n", "").contains("\n"));
        assertEquals("\n", parse(SUBSCRIPT_BODY).lineSeparator());
    }

    @Test
    void testCheckBlockAddsAbortPrototype() {
        TranslationUnit unit = parse(SUBSCRIPT_BODY);
        InstrumentationPlan plan = planner.planInstrumentation(unit, select(unit, 2), InstrumentMode.CHECK, "5");

        assertEquals("__cvise_checked_1", plan.guardName());
        assertTrue(plan.addsPrototype());
        String output = apply(unit, plan);
        assertTrue(output.startsWith("void abort(void);\nint f(int *a, int i) {\n"));
        assertTrue(output.contains("\n    if (__cvise_expr_tmp_1 != 5) abort();\n"));
        assertTrue(output.contains("if (__cvise_checked_1 == __CVISE_INSTANCE_NUMBER) {"));
        assertFalse(output.contains("printf"));
    }

    @Test
    void testCustomInstanceNumber() {
        RewritePlanner custom = new RewritePlanner(DetectorConfig.defaults().withInstanceNumber("3"));
        TranslationUnit unit = parse(SUBSCRIPT_BODY);
        String output = apply(unit, custom.planInstrumentation(unit, select(unit, 1), InstrumentMode.EMIT, null));
        assertTrue(output.contains("if (__cvise_printed_1 == 3) {"));
        assertTrue(output.contains("int __cvise_expr_tmp_1 = a[i] + 1;"));
        assertTrue(output.contains("x = (__cvise_expr_tmp_1);"));
    }

    @Test
    void testUnbracedBodyIsWrapped() {
        TranslationUnit unit = parse("int f(int a) {\n  if (a) return a + 1;\n  return 0;\n}\n");
        InstrumentationPlan plan = planner.planInstrumentation(unit, select(unit, 2), InstrumentMode.EMIT, null);

        assertTrue(plan.braced());
        String output = apply(unit, plan);
        assertTrue(output.startsWith("int printf(const char *format, ...);\n"));
        assertTrue(output.contains("  if (a) { int __cvise_expr_tmp_1 = a + 1;\n"));
        assertTrue(output.contains("\n  return (__cvise_expr_tmp_1); }\n  return 0;\n"));
    }

    @Test
    void testDeclarationInitializerIsReplacedWithoutParentheses() {
        TranslationUnit unit = parse("int f(int a) {\n  int y = a * 3;\n  return y;\n}\n");
        String output = apply(unit, planner.planInstrumentation(unit, select(unit, 1), InstrumentMode.EMIT, null));
        assertTrue(output.contains("\n  int __cvise_expr_tmp_1 = a * 3;\n"));
        assertTrue(output.contains("\n  int y = __cvise_expr_tmp_1;\n"));
    }

    @Test
    void testNamesContinueAfterExistingOnes() {
        String source = """
                int f(int a) {
                  int __cvise_expr_tmp_4 = 0;
                  static int __cvise_printed_2 = 0;
                  return a + 1;
                }
                """;
        TranslationUnit unit = parse(source);
        InstrumentationPlan plan = planner.planInstrumentation(unit, select(unit, 1), InstrumentMode.EMIT, null);
        assertEquals("__cvise_expr_tmp_5", plan.temporaryName());
        assertEquals("__cvise_printed_3", plan.guardName());
    }

    @Test
    void testFloatingValueUsesFloatConversion() {
        TranslationUnit unit = parse("double f(double d) {\n  return d * 2.0;\n}\n");
        String output = apply(unit, planner.planInstrumentation(unit, select(unit, 1), InstrumentMode.EMIT, null));
        assertTrue(output.contains("double __cvise_expr_tmp_1 = d * 2.0;"));
        assertTrue(output.contains("printf(\"cvise_value(%f)\\n\", __cvise_expr_tmp_1);"));
    }

    @Test
    void testPrototypeDependsOnWhatPrecedesTheStatement() {
        TranslationUnit included = parse("#include <stdio.h>\n" + SUBSCRIPT_BODY);
        TranslationUnit late = parse(SUBSCRIPT_BODY + "int printf(const char *format, ...);\n");
        TranslationUnit lateInclude = parse(SUBSCRIPT_BODY + "#include <stdio.h>\n");

        assertFalse(planner.needsPrototype(included, SupportFunction.PRINTF,
                select(included, 2).statement().range()));
        assertTrue(planner.needsPrototype(late, SupportFunction.PRINTF, select(late, 2).statement().range()));
        assertTrue(planner.needsPrototype(lateInclude, SupportFunction.PRINTF,
                select(lateInclude, 2).statement().range()));
        assertTrue(planner.needsPrototype(included, SupportFunction.ABORT,
                select(included, 2).statement().range()));
    }

    @Test
    void testReplaceModeIsNotInstrumented() {
        TranslationUnit unit = parse(SUBSCRIPT_BODY);
        CapturedInstance instance = select(unit, 2);
        assertThrows(IllegalArgumentException.class,
                () -> planner.planInstrumentation(unit, instance, InstrumentMode.REPLACE, null));

        InstrumentationPlan plan = planner.planReplacement(instance, "a[0]");
        assertNull(plan.temporaryName());
        assertFalse(plan.addsPrototype());
        assertTrue(apply(unit, plan).contains("  x = a[0] + 1;\n"));
    }

    @ParameterizedTest
    @CsvSource({
            "INT, d",
            "CHAR, d",
            "SHORT, d",
            "BOOL, u",
            "UNSIGNED_CHAR, u",
            "UNSIGNED_INT, u",
            "LONG, ld",
            "UNSIGNED_LONG, lu",
            "LONG_LONG, lld",
            "UNSIGNED_LONG_LONG, llu",
            "FLOAT, f",
            "DOUBLE, f",
            "LONG_DOUBLE, Lf"
    })
    void testFormatSpecifiers(TypeKind kind, String expected) {
        assertEquals(expected, FormatSpecifier.of(CType.builtin(kind)));
        assertEquals(expected, FormatSpecifier.of(CType.builtin(kind).withQualifiers(true, false)));
    }

    @Test
    void testEnumerationsPrintAsInt() {
        assertEquals("d", FormatSpecifier.of(CType.enumeration("color")));
        assertThrows(IllegalStateException.class, () -> FormatSpecifier.of(CType.pointerTo(CType.INT)));
    }

    @Test
    void testTemporaryTypeSpelling() {
        assertEquals("int", RewritePlanner.temporaryType(CType.INT));
        assertEquals("enum color", RewritePlanner.temporaryType(CType.enumeration("color")));
        assertEquals("int", RewritePlanner.temporaryType(CType.enumeration(null)));
        assertEquals("unsigned long", RewritePlanner.temporaryType(CType.UNSIGNED_LONG));
    }
}
