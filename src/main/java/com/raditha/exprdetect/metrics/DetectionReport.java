package com.raditha.exprdetect.metrics;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;

/**
 * Machine readable summary of one detector run.
 *
 * @param file          the processed file
 * @param timestamp     when the report was built
 * @param status        how the run ended
 * @param eligibleCount number of eligible instances
 * @param counter       ordinal that was requested
 * @param mode          emit, check or replace
 * @param instance      the rewritten instance, absent unless the run changed
 *                      the source
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DetectionReport(
        String file,
        LocalDateTime timestamp,
        String status,
        int eligibleCount,
        int counter,
        String mode,
        InstanceReport instance) {

    /**
     * Where the rewritten instance is and what was inserted for it.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record InstanceReport(
            String function,
            int line,
            int column,
            String expression,
            String type,
            String temporary,
            String guard,
            boolean prototypeAdded) {
    }
}
