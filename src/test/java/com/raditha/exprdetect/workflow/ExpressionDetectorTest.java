package com.raditha.exprdetect.workflow;

import com.raditha.exprdetect.config.DetectorConfig;
import com.raditha.exprdetect.config.InstrumentMode;
import com.raditha.exprdetect.frontend.CFrontEnd;
import com.raditha.exprdetect.model.Dialect;
import com.raditha.exprdetect.rewrite.InstrumentationVerifier;
import com.raditha.exprdetect.rewrite.InstrumentationVerifier.VerificationResult;
import com.raditha.exprdetect.rewrite.RewritePlanner;
import com.raditha.exprdetect.selection.SelectionEngine;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExpressionDetectorTest {

    private static final String SOURCE = """
            int f(int *a, int i) {
              int x;
              x = a[i] + 1;
              return x;
            }
            """;

    private final ExpressionDetector detector = new ExpressionDetector(DetectorConfig.defaults());

    private DetectionResult run(String source, DetectionRequest request) {
        return detector.detect("input.c", source, Dialect.C, request);
    }

    @Test
    void testQueryReportsCountWithoutRewriting() {
        DetectionResult result = run(SOURCE, DetectionRequest.queryInstances());
        assertEquals(DetectionStatus.QUERY_ONLY, result.status());
        assertEquals(4, result.eligibleCount());
        assertEquals(SOURCE, result.output());
        assertFalse(result.isModified());
        assertNull(result.instance());
    }

    @Test
    void testEmitRewritesSelectedInstance() {
        DetectionResult result = run(SOURCE, DetectionRequest.emit(2));
        assertEquals(DetectionStatus.OK, result.status());
        assertTrue(result.isModified());
        assertEquals(4, result.eligibleCount());
        assertEquals("__cvise_expr_tmp_1", result.plan().temporaryName());
        assertTrue(result.output().startsWith("int printf(const char *format, ...);\n"));
        assertTrue(result.output().contains("  int __cvise_expr_tmp_1 = a[i];\n"));
        assertTrue(result.output().contains("  x = (__cvise_expr_tmp_1) + 1;\n"));
    }

    @Test
    void testInstrumentedOutputHasFewerInstances() {
        String once = run(SOURCE, DetectionRequest.emit(2)).output();
        DetectionResult again = run(once, DetectionRequest.queryInstances());
        assertEquals(2, again.eligibleCount());
    }

    @Test
    void testSecondRunPicksFreshNames() {
        String once = run(SOURCE, DetectionRequest.emit(1)).output();
        DetectionResult twice = run(once, DetectionRequest.emit(1));
        assertEquals(DetectionStatus.OK, twice.status());
        assertEquals("__cvise_expr_tmp_2", twice.plan().temporaryName());
        assertEquals("__cvise_printed_2", twice.plan().guardName());
        assertFalse(twice.plan().addsPrototype());
    }

    @Test
    void testCheckMode() {
        DetectionResult result = run(SOURCE, DetectionRequest.check(1, "-3"));
        assertEquals(InstrumentMode.CHECK, DetectionRequest.check(1, "-3").mode());
        assertTrue(result.output().startsWith("void abort(void);\n"));
        assertTrue(result.output().contains("if (__cvise_expr_tmp_1 != -3) abort();"));
    }

    @Test
    void testNegativeReferenceValueAddsNoInstance() {
        String source = "int f(int a) { int x; x = a + 1; return x; }\n";
        String emitted = run(source, DetectionRequest.emit(1)).output();
        String checked = run(source, DetectionRequest.check(1, "-5")).output();

        assertTrue(checked.contains("!= -5) abort();"));
        assertEquals(1, run(emitted, DetectionRequest.queryInstances()).eligibleCount());
        assertEquals(1, run(checked, DetectionRequest.queryInstances()).eligibleCount());
    }

    @Test
    void testReplaceMode() {
        DetectionResult result = run(SOURCE, DetectionRequest.replace(2, "a[0]"));
        assertEquals(DetectionStatus.OK, result.status());
        assertEquals(SOURCE.replace("x = a[i] + 1;", "x = a[0] + 1;"), result.output());
        assertNull(result.plan().temporaryName());
    }

    @Test
    void testUnparsableReplacementFailsVerification() {
        assertThrows(IllegalStateException.class, () -> run(SOURCE, DetectionRequest.replace(2, ") (")));

        ExpressionDetector unchecked = new ExpressionDetector(DetectorConfig.defaults().withVerify(false));
        DetectionResult result = unchecked.detect("input.c", SOURCE, Dialect.C, DetectionRequest.replace(2, ") ("));
        assertTrue(result.output().contains("x = ) ( + 1;"));
    }

    @Test
    void testCounterBeyondCount() {
        DetectionResult result = run(SOURCE, DetectionRequest.emit(5));
        assertEquals(DetectionStatus.MAX_INSTANCE_EXCEEDED, result.status());
        assertEquals(4, result.eligibleCount());
        assertEquals(SOURCE, result.output());
    }

    @Test
    void testCxxIsUnsupported() {
        DetectionResult result = detector.detect("input.cpp", SOURCE, Dialect.CXX, DetectionRequest.emit(1));
        assertEquals(DetectionStatus.UNSUPPORTED_DIALECT, result.status());
        assertEquals(0, result.eligibleCount());
        assertEquals(SOURCE, result.output());
    }

    @Test
    void testFailedVerificationIsReported() {
        InstrumentationVerifier verifier = mock(InstrumentationVerifier.class);
        when(verifier.verify(anyString(), anyString(), anyString(), any(), any()))
                .thenReturn(new VerificationResult(false, List.of("temporary missing"), "Instrumentation incomplete"));
        DetectorConfig config = DetectorConfig.defaults();
        ExpressionDetector mocked = new ExpressionDetector(config, new CFrontEnd(),
                new SelectionEngine(config.naming()), new RewritePlanner(config), verifier);

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> mocked.detect("input.c", SOURCE, Dialect.C, DetectionRequest.emit(1)));
        assertEquals("Instrumentation incomplete: temporary missing", e.getMessage());
    }

    @Test
    void testVerifierIsSkippedWhenDisabled() {
        InstrumentationVerifier verifier = mock(InstrumentationVerifier.class);
        DetectorConfig config = DetectorConfig.defaults().withVerify(false);
        ExpressionDetector unchecked = new ExpressionDetector(config, new CFrontEnd(),
                new SelectionEngine(config.naming()), new RewritePlanner(config), verifier);

        assertEquals(DetectionStatus.OK,
                unchecked.detect("input.c", SOURCE, Dialect.C, DetectionRequest.emit(1)).status());
        verify(verifier, never()).verify(anyString(), anyString(), anyString(), any(), any());
    }

    @Test
    void testDetectFileInfersDialect(@TempDir Path dir) throws IOException {
        Path c = dir.resolve("unit.c");
        Path cpp = dir.resolve("unit.cpp");
        Files.writeString(c, SOURCE);
        Files.writeString(cpp, SOURCE);

        assertEquals(4, detector.detectFile(c, null, DetectionRequest.queryInstances()).eligibleCount());
        assertEquals(DetectionStatus.UNSUPPORTED_DIALECT,
                detector.detectFile(cpp, null, DetectionRequest.queryInstances()).status());
        assertEquals(SOURCE, Files.readString(c));
    }

    @Test
    void testRequestValidation() {
        assertThrows(IllegalArgumentException.class, () -> DetectionRequest.emit(0));
        assertThrows(IllegalArgumentException.class, () -> DetectionRequest.check(1, null));
        assertThrows(IllegalArgumentException.class, () -> DetectionRequest.replace(1, " "));
        assertThrows(IllegalArgumentException.class,
                () -> new DetectionRequest(1, null, null, null, false));
        assertTrue(new DetectionRequest(3, InstrumentMode.CHECK, null, null, true).queryOnly());
    }
}
