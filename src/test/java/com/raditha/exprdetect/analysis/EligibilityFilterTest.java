package com.raditha.exprdetect.analysis;

import com.raditha.exprdetect.frontend.CParser;
import com.raditha.exprdetect.model.Expr;
import com.raditha.exprdetect.model.Stmt;
import com.raditha.exprdetect.model.TranslationUnit;
import com.raditha.exprdetect.selection.SelectionEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EligibilityFilterTest {

    private EligibilityFilter filter;
    private SelectionEngine engine;

    @BeforeEach
    void setUp() {
        filter = new EligibilityFilter(NamingConvention.defaults());
        engine = new SelectionEngine(filter, NamingConvention.defaults());
    }

    private static TranslationUnit parse(String source) {
        return new CParser("eligibility.c", source).parse();
    }

    private int count(String source) {
        return engine.select(parse(source), 1).eligibleCount();
    }

    private static List<Stmt> body(TranslationUnit unit) {
        return unit.functionDefinitions().get(0).getBody().statements();
    }

    @Nested
    class CandidateKinds {

        @Test
        void testIntegerAndFloatingReferencesAreCandidates() {
            TranslationUnit unit = parse("double g(int a, double d) { return a + d; }");
            Expr sum = body(unit).get(0).expression();
            assertTrue(filter.isCandidate(sum));
            assertTrue(filter.isCandidate(sum.child(1)));
            assertTrue(filter.isCandidate(sum.child(0).ignoreParenImpCasts()));
        }

        @Test
        void testPointerValuedExpressionsAreNotCandidates() {
            TranslationUnit unit = parse("int *g(int *p) { return p + 1; }");
            Expr sum = body(unit).get(0).expression();
            assertFalse(filter.isCandidate(sum));
            assertFalse(filter.isCandidate(sum.child(0).ignoreParenImpCasts()));
        }

        @Test
        void testLiteralsAreNotCandidates() {
            TranslationUnit unit = parse("int g(void) { return 42; }");
            assertFalse(filter.isCandidate(body(unit).get(0).expression()));
            assertEquals(0, count("int g(void) { return 42; }"));
        }
    }

    @Test
    void testOperandsOfAReturnAreCounted() {
        assertEquals(3, count("int f(int a, int b) { return a + b; }"));
    }

    @Test
    void testRepeatedOperandInOneStatementCountsOnce() {
        assertEquals(2, count("int f(int a) { return a + a; }"));
        assertEquals(2, count("void f(int *a) { int x; x = a[0] + a[0]; }"));
    }

    @Test
    void testSameExpressionInDifferentStatementsCountsTwice() {
        assertEquals(2, count("int f(int a) { int x = a; return a; }"));
    }

    @Test
    void testTopLevelExpressionOfExpressionStatementIsSkipped() {
        assertEquals(3, count("void f(int a, int b) { int x; x = a * b; }"));
        assertEquals(3, count("void f(int a, int b) { int x = 0; x += a * b; }"));
    }

    @Test
    void testLoopHeadersAreSkipped() {
        assertEquals(0, count("void f(int n) { int i; for (i = 0; i < n; i++) { } }"));
        assertEquals(0, count("void f(int n) { while (n > 0) n--; }"));
        assertEquals(1, count("void f(int a, int *p) { do { p[0] = a; } while (a > 1); }"));
    }

    @Test
    void testMultiDeclaratorDeclarationsAreSkipped() {
        assertEquals(0, count("void f(int a) { int x = a, y = a; }"));
        assertEquals(2, count("void f(int a) { int x = a + 1; }"));
    }

    @Test
    void testDeclarationThatAlsoDeclaresATagIsSkipped() {
        assertEquals(0, count("void f(int a) { struct T { int f; } t = { a + 1 }; }"));
        assertEquals(0, count("void f(int a) { enum { A } e = a + A; }"));
        assertEquals(2, count("struct T { int f; }; void f(int a) { struct T t = { a + 1 }; }"));
    }

    @Test
    void testWrittenAndAddressTakenOperandsAreSkipped() {
        assertEquals(0, count("void f(int a) { int *p; p = &a; }"));
        assertEquals(0, count("void f(int y) { y++; }"));
        assertEquals(1, count("void f(int *p, int i) { p[i] = 0; }"));
    }

    @Test
    void testIncrementInsideIfCountsOnlyTheCondition() {
        assertEquals(1, count("void f(int cond, int y) { if (cond) { y++; } }"));
    }

    @Test
    void testReportingCallArgumentsAreSkippedOnlyAsNames() {
        String decl = "int printf(const char *format, ...);\n";
        assertEquals(0, count(decl + "void f(int a) { printf(\"%d\\n\", a); }"));
        assertEquals(1, count(decl + "void f(int a) { printf(\"%d\\n\", a + 1); }"));
    }

    @Test
    void testCallsAreNeverDeduplicated() {
        assertEquals(4, count("int h(int); int g(int a) { return h(a) + h(a); }"));
    }

    @Test
    void testMemberAccessIsCounted() {
        assertEquals(1, count("struct S { int f; }; int g(struct S *s) { return s->f; }"));
    }

    @Test
    void testInstrumentationArtifactsContributeNothing() {
        String source = """
                void abort(void);
                void f(int a) {
                  int __cvise_expr_tmp_1 = a + 1;
                  static int __cvise_checked_1 = 0;
                  if (__cvise_checked_1 == 0) {
                    if (__cvise_expr_tmp_1 != 5) abort();
                  }
                  ++__cvise_checked_1;
                  int x = (__cvise_expr_tmp_1);
                }
                """;
        assertEquals(0, count(source));
    }

    @Test
    void testNegatedReferenceValuesContributeNothing() {
        String source = """
                void abort(void);
                void f(int a, double d) {
                  int __cvise_expr_tmp_1 = a + 1;
                  double __cvise_expr_tmp_2 = d * 2;
                  if (__cvise_expr_tmp_1 != -5) abort();
                  if (__cvise_expr_tmp_2 != -2.5) abort();
                }
                """;
        assertEquals(0, count(source));
        // an ordinary comparison keeps its negated operand
        assertEquals(3, count("void f(int a) { if (a != -5) return; }"));
    }

    @Test
    void testExpressionMatchingTemporaryInitializerIsSkipped() {
        String source = """
                void f(int a) {
                  int __cvise_expr_tmp_1 = a + 1;
                  int y = __cvise_expr_tmp_1 + (a + 1);
                }
                """;
        // the outer sum and a; the inner sum repeats the temporary's initializer
        assertEquals(2, count(source));
    }

    @Test
    void testCustomPrefixesAreHonoured() {
        NamingConvention naming = new NamingConvention("tmp_", "seen_", "chk_");
        SelectionEngine custom = new SelectionEngine(naming);
        String source = "void f(int a) { int tmp_1 = a; int seen_1 = tmp_1; int x = a; }";
        assertEquals(1, custom.select(parse(source), 1).eligibleCount());
        assertEquals(3, count(source));
    }
}
