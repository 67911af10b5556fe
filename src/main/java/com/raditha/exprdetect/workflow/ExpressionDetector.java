package com.raditha.exprdetect.workflow;

import com.raditha.exprdetect.config.DetectorConfig;
import com.raditha.exprdetect.config.InstrumentMode;
import com.raditha.exprdetect.frontend.CFrontEnd;
import com.raditha.exprdetect.model.Dialect;
import com.raditha.exprdetect.model.TranslationUnit;
import com.raditha.exprdetect.rewrite.InstrumentationPlan;
import com.raditha.exprdetect.rewrite.InstrumentationVerifier;
import com.raditha.exprdetect.rewrite.InstrumentationVerifier.VerificationResult;
import com.raditha.exprdetect.rewrite.RewriteBuffer;
import com.raditha.exprdetect.rewrite.RewritePlanner;
import com.raditha.exprdetect.selection.CapturedInstance;
import com.raditha.exprdetect.selection.SelectionEngine;
import com.raditha.exprdetect.selection.SelectionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Runs the detector on one translation unit: parse, count and select, plan
 * the rewrite, apply it and verify the result.
 */
public class ExpressionDetector {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionDetector.class);

    private final DetectorConfig config;
    private final CFrontEnd frontEnd;
    private final SelectionEngine engine;
    private final RewritePlanner planner;
    private final InstrumentationVerifier verifier;

    public ExpressionDetector(DetectorConfig config) {
        this(config, new CFrontEnd(), new SelectionEngine(config.naming()), new RewritePlanner(config),
                new InstrumentationVerifier());
    }

    public ExpressionDetector(DetectorConfig config, CFrontEnd frontEnd, SelectionEngine engine,
            RewritePlanner planner, InstrumentationVerifier verifier) {
        this.config = config;
        this.frontEnd = frontEnd;
        this.engine = engine;
        this.planner = planner;
        this.verifier = verifier;
    }

    /**
     * Read, parse and process a file. The file itself is not written.
     *
     * @param dialect the dialect, or {@code null} to infer it from the file name
     */
    public DetectionResult detectFile(Path file, Dialect dialect, DetectionRequest request) throws IOException {
        return detect(frontEnd.parseFile(file, dialect), request);
    }

    public DetectionResult detect(String fileName, String source, Dialect dialect, DetectionRequest request) {
        return detect(frontEnd.parse(fileName, source, dialect), request);
    }

    /**
     * Process an already parsed unit.
     *
     * @throws IllegalStateException if the rewritten source fails verification
     */
    public DetectionResult detect(TranslationUnit unit, DetectionRequest request) {
        String source = unit.getSource();
        if (unit.getDialect() == Dialect.CXX) {
            return DetectionResult.unchanged(DetectionStatus.UNSUPPORTED_DIALECT, 0, source);
        }

        SelectionResult selection = engine.select(unit, request.counter());
        logger.info("{}: {} eligible instances", unit.getFileName(), selection.eligibleCount());

        if (request.queryOnly()) {
            return DetectionResult.unchanged(DetectionStatus.QUERY_ONLY, selection.eligibleCount(), source);
        }
        if (selection.targetExceedsCount()) {
            logger.info("Instance {} exceeds maximum instance {}", request.counter(), selection.eligibleCount());
            return DetectionResult.unchanged(DetectionStatus.MAX_INSTANCE_EXCEEDED, selection.eligibleCount(),
                    source);
        }

        CapturedInstance instance = selection.captured().orElseThrow(() -> new IllegalStateException(
                "Instance " + request.counter() + " was counted but not captured"));

        InstrumentationPlan plan = request.mode() == InstrumentMode.REPLACE
                ? planner.planReplacement(instance, request.replacement())
                : planner.planInstrumentation(unit, instance, request.mode(), request.referenceValue());

        RewriteBuffer buffer = new RewriteBuffer(source);
        plan.applyTo(buffer);
        String output = buffer.render();

        if (config.verify()) {
            VerificationResult verification = verifier.verify(unit.getFileName(), output,
                    instance.function().getName(), plan, config.naming());
            if (!verification.success()) {
                throw new IllegalStateException(verification.message() + ": "
                        + String.join("; ", verification.errors()));
            }
        }

        logger.info("Rewrote instance {} in {} ({})", request.counter(), instance.function().getName(),
                request.mode().toCliString());
        return new DetectionResult(DetectionStatus.OK, selection.eligibleCount(), source, output, instance, plan);
    }
}
