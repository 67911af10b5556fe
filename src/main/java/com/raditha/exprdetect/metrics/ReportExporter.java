package com.raditha.exprdetect.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.exprdetect.model.Expr;
import com.raditha.exprdetect.model.Range;
import com.raditha.exprdetect.rewrite.InstrumentationPlan;
import com.raditha.exprdetect.selection.CapturedInstance;
import com.raditha.exprdetect.workflow.DetectionRequest;
import com.raditha.exprdetect.workflow.DetectionResult;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;

/**
 * Exports detector runs as JSON for the reduction harness and for logs.
 */
public class ReportExporter {

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * Build the report of a finished run.
     */
    public DetectionReport buildReport(String file, DetectionRequest request, DetectionResult result) {
        return new DetectionReport(
                file,
                LocalDateTime.now(),
                result.status().name(),
                result.eligibleCount(),
                request.counter(),
                request.queryOnly() ? null : request.mode().toCliString(),
                result.isModified() ? instanceReport(result) : null);
    }

    public String toJson(DetectionReport report) throws JsonProcessingException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
    }

    public void exportToJson(DetectionReport report, Path outputPath) throws IOException {
        mapper.writerWithDefaultPrettyPrinter().writeValue(outputPath.toFile(), report);
    }

    private static DetectionReport.InstanceReport instanceReport(DetectionResult result) {
        CapturedInstance instance = result.instance();
        InstrumentationPlan plan = result.plan();
        Expr expression = instance.expression();
        Range range = expression.range();
        return new DetectionReport.InstanceReport(
                instance.function().getName(),
                range.startLine(),
                range.startColumn(),
                result.source().substring(range.startOffset(), range.endOffset()),
                expression.type().spelling(),
                plan.temporaryName(),
                plan.guardName(),
                plan.addsPrototype());
    }
}
