package com.raditha.exprdetect.workflow;

import com.raditha.exprdetect.rewrite.InstrumentationPlan;
import com.raditha.exprdetect.selection.CapturedInstance;

/**
 * Outcome of one detector run.
 *
 * @param status        how the run ended
 * @param eligibleCount number of eligible instances in the unit
 * @param source        the input source
 * @param output        the rewritten source; equal to {@code source} unless
 *                      the status is {@link DetectionStatus#OK}
 * @param instance      the rewritten instance, or null
 * @param plan          the applied edits, or null
 */
public record DetectionResult(
        DetectionStatus status,
        int eligibleCount,
        String source,
        String output,
        CapturedInstance instance,
        InstrumentationPlan plan) {

    static DetectionResult unchanged(DetectionStatus status, int eligibleCount, String source) {
        return new DetectionResult(status, eligibleCount, source, source, null, null);
    }

    public boolean isModified() {
        return status == DetectionStatus.OK;
    }
}
