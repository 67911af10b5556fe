package com.raditha.exprdetect.rewrite;

import com.raditha.exprdetect.frontend.CParser;
import com.raditha.exprdetect.model.FunctionDecl;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class NameQueryTest {

    private static final String PREFIX = "__cvise_expr_tmp_";

    private final NameQuery query = new NameQuery();

    private static FunctionDecl function(String source) {
        return new CParser("names.c", source).parse().functionDefinitions().get(0);
    }

    @Test
    void testNoMatchingNamesGivesZero() {
        assertEquals(0, query.maxSuffix(function("int f(int a) { int b = a; return b; }"), PREFIX));
    }

    @Test
    void testLargestSuffixAmongLocalsAndParameters() {
        String source = """
                int f(int __cvise_expr_tmp_3) {
                  int __cvise_expr_tmp_1 = 0;
                  if (__cvise_expr_tmp_1) {
                    int __cvise_expr_tmp_12 = 1;
                  }
                  return 0;
                }
                """;
        assertEquals(12, query.maxSuffix(function(source), PREFIX));
    }

    @Test
    void testOtherFunctionsAreNotConsulted() {
        String source = """
                int f(void) { return 0; }
                int g(void) { int __cvise_expr_tmp_9 = 0; return __cvise_expr_tmp_9; }
                """;
        assertEquals(0, query.maxSuffix(function(source), PREFIX));
    }

    @ParameterizedTest
    @CsvSource({
            "__cvise_expr_tmp_7, 7",
            "__cvise_expr_tmp_007, 7",
            "__cvise_expr_tmp_, 0",
            "__cvise_expr_tmp_x1, 0",
            "__cvise_expr_tmp_1a, 0",
            "other_3, 0",
            "__cvise_expr_tmp_99999999999, 0"
    })
    void testSuffixOf(String name, int expected) {
        assertEquals(expected, NameQuery.suffixOf(name, PREFIX));
    }
}
