package com.raditha.exprdetect.cli;

import com.raditha.exprdetect.config.DetectorConfig;
import com.raditha.exprdetect.config.DetectorSettings;
import com.raditha.exprdetect.config.InstrumentMode;
import com.raditha.exprdetect.frontend.CFrontEnd;
import com.raditha.exprdetect.metrics.DetectionReport;
import com.raditha.exprdetect.metrics.ReportExporter;
import com.raditha.exprdetect.model.Dialect;
import com.raditha.exprdetect.rewrite.DiffGenerator;
import com.raditha.exprdetect.workflow.DetectionRequest;
import com.raditha.exprdetect.workflow.DetectionResult;
import com.raditha.exprdetect.workflow.ExpressionDetector;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the expression detector.
 * <p>
 * Usage:
 * java -jar expression-detector.jar [options] <file>
 * <p>
 * Configuration priority: CLI arguments > exprdetect.yml > defaults
 */
@Command(name = "exprdetect", mixinStandardHelpOptions = true, version = "exprdetect v1.0.0",
        description = "Instruments the n-th interesting expression of a C file so its value can be observed")
public class DetectorCLI implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_INTERNAL_ERROR = 1;
    static final int EXIT_CONFIGURATION_ERROR = 2;
    static final int EXIT_IO_ERROR = 3;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "C source file to instrument", paramLabel = "<file>")
    private Path file;

    @Option(names = "--counter", description = "Ordinal of the instance to instrument (default: 1)", paramLabel = "<n>")
    private int counter = 1;

    @Option(names = "--mode", description = "Instrumentation mode: emit, check or replace (default: emit)",
            paramLabel = "<mode>", converter = InstrumentModeConverter.class)
    private InstrumentMode mode = InstrumentMode.EMIT;

    @Option(names = "--reference", description = "Reference value for check mode", paramLabel = "<value>")
    private String reference;

    @Option(names = "--replacement", description = "Replacement text for replace mode", paramLabel = "<text>")
    private String replacement;

    @Option(names = "--query-instances", description = "Only print the number of eligible instances")
    private boolean queryInstances = false;

    @Option(names = "--instance-number", description = "Text compared against the guard counter", paramLabel = "<text>")
    private String instanceNumber;

    @Option(names = "--lang", description = "Input language: c, c++ or auto (default: auto)", paramLabel = "<lang>")
    private String language = "auto";

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private Path configFile;

    @Option(names = "--output", description = "Write the result here instead of over the input", paramLabel = "<path>")
    private Path outputPath;

    @Option(names = "--diff", description = "Print a unified diff instead of writing the result")
    private boolean diff = false;

    @Option(names = "--json", description = "Print a JSON report of the run")
    private boolean jsonOutput = false;

    @Option(names = "--report", description = "Also write the JSON report of the run to this file",
            paramLabel = "<path>")
    private Path reportPath;

    @Option(names = "--no-verify", description = "Do not re-parse the instrumented source")
    private boolean noVerify = false;

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 for success, non-zero for errors)
     */
    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        Map<String, Object> yaml = configFile != null
                ? DetectorSettings.loadConfigMap(configFile)
                : DetectorSettings.loadConfigMap();
        DetectorConfig config = DetectorSettings.loadConfig(yaml, instanceNumber, noVerify);
        DetectionRequest request = new DetectionRequest(counter, mode, reference, replacement, queryInstances);

        ExpressionDetector detector = new ExpressionDetector(config);
        DetectionResult result = detector.detectFile(file, parseLanguage(), request);

        PrintWriter out = spec.commandLine().getOut();
        if (jsonOutput || reportPath != null) {
            ReportExporter exporter = new ReportExporter();
            DetectionReport report = exporter.buildReport(file.toString(), request, result);
            if (jsonOutput) {
                out.println(exporter.toJson(report));
            }
            if (reportPath != null) {
                exporter.exportToJson(report, reportPath);
            }
        }

        switch (result.status()) {
            case QUERY_ONLY, UNSUPPORTED_DIALECT -> {
                if (!jsonOutput) {
                    out.println("Available transformation instances: " + result.eligibleCount());
                }
                return EXIT_OK;
            }
            case MAX_INSTANCE_EXCEEDED -> {
                spec.commandLine().getErr().println("Error: instance " + counter
                        + " exceeds maximum instance " + result.eligibleCount());
                return EXIT_CONFIGURATION_ERROR;
            }
            case OK -> {
                writeResult(result, out);
                return EXIT_OK;
            }
        }
        return EXIT_OK;
    }

    public static void main(String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * Build the command with the exit code mapping used by {@link #main}.
     */
    static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new DetectorCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return EXIT_CONFIGURATION_ERROR;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return EXIT_IO_ERROR;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return EXIT_INTERNAL_ERROR;
            }
        });

        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return EXIT_CONFIGURATION_ERROR;
        });

        return cmd;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Input file not found: " + file);
        }
        if (configFile != null && !Files.isRegularFile(configFile)) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
        if (diff && outputPath != null) {
            throw new IllegalArgumentException("Cannot use both --diff and --output");
        }
        if (queryInstances && (diff || outputPath != null)) {
            throw new IllegalArgumentException("--query-instances writes no source; drop --diff and --output");
        }
    }

    private Dialect parseLanguage() {
        if ("auto".equalsIgnoreCase(language)) {
            return null;
        }
        return Dialect.fromString(language);
    }

    private void writeResult(DetectionResult result, PrintWriter out) throws IOException {
        if (diff) {
            String fileName = file.getFileName().toString();
            out.println(new DiffGenerator().generateUnifiedDiff(fileName, result.source(), result.output()));
            return;
        }
        Path target = outputPath != null ? outputPath : file;
        Files.writeString(target, result.output(), CFrontEnd.SOURCE_CHARSET);
        if (!jsonOutput) {
            out.println("Instrumented instance " + counter + " of " + result.eligibleCount() + " into " + target);
        }
    }

    /**
     * Custom converter for InstrumentMode enum to handle CLI string values.
     */
    public static class InstrumentModeConverter implements ITypeConverter<InstrumentMode> {
        @Override
        public InstrumentMode convert(String value) throws Exception {
            return InstrumentMode.fromString(value);
        }
    }
}
