package com.raditha.exprdetect.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.exprdetect.config.InstrumentMode;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DetectorCLITest {

    private static final String SOURCE = """
            int f(int *a, int i) {
              int x;
              x = a[i] + 1;
              return x;
            }
            """;

    @TempDir
    Path tempDir;

    private Path input;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws IOException {
        input = tempDir.resolve("input.c");
        Files.writeString(input, SOURCE);
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        CommandLine cmd = DetectorCLI.createCommandLine();
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    @Test
    void testQueryInstances() throws IOException {
        assertEquals(DetectorCLI.EXIT_OK, run(input.toString(), "--query-instances"));
        assertTrue(out.toString().contains("Available transformation instances: 4"));
        assertEquals(SOURCE, Files.readString(input));
    }

    @Test
    void testEmitRewritesInputInPlace() throws IOException {
        assertEquals(DetectorCLI.EXIT_OK, run(input.toString(), "--counter", "2"));
        String rewritten = Files.readString(input);
        assertTrue(rewritten.contains("int __cvise_expr_tmp_1 = a[i];"));
        assertTrue(rewritten.contains("x = (__cvise_expr_tmp_1) + 1;"));
        assertTrue(out.toString().contains("Instrumented instance 2 of 4 into " + input));
    }

    @Test
    void testOutputFileLeavesInputAlone() throws IOException {
        Path output = tempDir.resolve("out.c");
        assertEquals(DetectorCLI.EXIT_OK,
                run(input.toString(), "--mode", "check", "--reference", "42", "--output", output.toString()));
        assertEquals(SOURCE, Files.readString(input));
        assertTrue(Files.readString(output).contains("if (__cvise_expr_tmp_1 != 42) abort();"));
    }

    @Test
    void testReplaceMode() throws IOException {
        assertEquals(DetectorCLI.EXIT_OK,
                run(input.toString(), "--mode", "replace", "--counter", "2", "--replacement", "a[1]"));
        assertTrue(Files.readString(input).contains("x = a[1] + 1;"));
    }

    @Test
    void testDiffPreview() throws IOException {
        assertEquals(DetectorCLI.EXIT_OK, run(input.toString(), "--diff", "--instance-number", "1"));
        String diff = out.toString();
        assertTrue(diff.contains("--- a/input.c"));
        assertTrue(diff.contains("+  if (__cvise_printed_1 == 1) {"));
        assertEquals(SOURCE, Files.readString(input));
    }

    @Test
    void testJsonReport() {
        assertEquals(DetectorCLI.EXIT_OK, run(input.toString(), "--json", "--query-instances"));
        assertTrue(out.toString().contains("\"eligibleCount\" : 4"));
        assertFalse(out.toString().contains("Available transformation instances"));
    }

    @Test
    void testReportFile() throws IOException {
        Path report = tempDir.resolve("report.json");
        assertEquals(DetectorCLI.EXIT_OK, run(input.toString(), "--counter", "2", "--report", report.toString()));

        JsonNode json = new ObjectMapper().readTree(report.toFile());
        assertEquals("OK", json.get("status").asText());
        assertEquals(4, json.get("eligibleCount").asInt());
        assertEquals("a[i]", json.get("instance").get("expression").asText());
        assertTrue(out.toString().contains("Instrumented instance 2 of 4"));
    }

    @Test
    void testNonUtf8BytesSurviveRewrite() throws IOException {
        String latin1 = "/* caf\u00e9 */\nint f(int a) { return a + 1; }\n";
        Files.write(input, latin1.getBytes(StandardCharsets.ISO_8859_1));

        assertEquals(DetectorCLI.EXIT_OK, run(input.toString(), "--counter", "2"));

        String rewritten = new String(Files.readAllBytes(input), StandardCharsets.ISO_8859_1);
        assertTrue(rewritten.contains("/* caf\u00e9 */\n"));
        assertFalse(rewritten.contains("\u00c3\u00a9"));
        assertTrue(rewritten.contains("int __cvise_expr_tmp_1 = a;"));
        assertTrue(rewritten.contains("return (__cvise_expr_tmp_1) + 1; }"));
    }

    @Test
    void testConfigFile() throws IOException {
        Path config = tempDir.resolve("custom.yml");
        Files.writeString(config, "expression_detector:\n  temp_prefix: __t_\n  instance_number: 5\n");
        assertEquals(DetectorCLI.EXIT_OK, run(input.toString(), "--config-file", config.toString()));
        String rewritten = Files.readString(input);
        assertTrue(rewritten.contains("int __t_1 = a[i] + 1;"));
        assertTrue(rewritten.contains("== 5) {"));
    }

    @Test
    void testCxxInputHasNoInstances() throws IOException {
        Path cpp = tempDir.resolve("input.cpp");
        Files.writeString(cpp, SOURCE);
        assertEquals(DetectorCLI.EXIT_OK, run(cpp.toString()));
        assertTrue(out.toString().contains("Available transformation instances: 0"));
        assertEquals(SOURCE, Files.readString(cpp));
    }

    @Test
    void testCounterBeyondMaximum() throws IOException {
        assertEquals(DetectorCLI.EXIT_CONFIGURATION_ERROR, run(input.toString(), "--counter", "9"));
        assertTrue(err.toString().contains("Error: instance 9 exceeds maximum instance 4"));
        assertEquals(SOURCE, Files.readString(input));
    }

    @Test
    void testConfigurationErrors() {
        assertEquals(DetectorCLI.EXIT_CONFIGURATION_ERROR, run(tempDir.resolve("missing.c").toString()));
        assertTrue(err.toString().contains("Configuration error: Input file not found"));

        assertEquals(DetectorCLI.EXIT_CONFIGURATION_ERROR, run(input.toString(), "--mode", "check"));
        assertTrue(err.toString().contains("Check mode requires a reference value"));

        assertEquals(DetectorCLI.EXIT_CONFIGURATION_ERROR,
                run(input.toString(), "--diff", "--output", tempDir.resolve("o.c").toString()));
        assertEquals(DetectorCLI.EXIT_CONFIGURATION_ERROR, run(input.toString(), "--counter", "0"));
        assertEquals(DetectorCLI.EXIT_CONFIGURATION_ERROR, run(input.toString(), "--lang", "fortran"));
    }

    @Test
    void testInvalidOptionValues() {
        assertEquals(DetectorCLI.EXIT_CONFIGURATION_ERROR, run(input.toString(), "--mode", "print"));
        assertEquals(DetectorCLI.EXIT_CONFIGURATION_ERROR, run(input.toString(), "--counter", "two"));
        assertEquals(DetectorCLI.EXIT_CONFIGURATION_ERROR, run());
    }

    @Test
    void testHelp() {
        assertEquals(DetectorCLI.EXIT_OK, run("--help"));
        assertTrue(out.toString().contains("--query-instances"));
    }

    /**
     * Every valid option combination parses.
     */
    @Property(tries = 100)
    void validOptionsParse(
            @ForAll @IntRange(min = 1, max = 50) int counter,
            @ForAll("modes") InstrumentMode mode,
            @ForAll boolean query,
            @ForAll boolean json,
            @ForAll boolean noVerify) {
        List<String> args = new ArrayList<>();
        args.add("input.c");
        args.add("--counter");
        args.add(String.valueOf(counter));
        args.add("--mode");
        args.add(mode.toCliString());
        if (mode == InstrumentMode.CHECK) {
            args.add("--reference");
            args.add("0");
        }
        if (mode == InstrumentMode.REPLACE) {
            args.add("--replacement");
            args.add("0");
        }
        if (query) {
            args.add("--query-instances");
        }
        if (json) {
            args.add("--json");
        }
        if (noVerify) {
            args.add("--no-verify");
        }

        CommandLine commandLine = new CommandLine(new DetectorCLI());
        assertDoesNotThrow(() -> commandLine.parseArgs(args.toArray(new String[0])));
    }

    @Provide
    Arbitrary<InstrumentMode> modes() {
        return Arbitraries.of(InstrumentMode.values());
    }
}
