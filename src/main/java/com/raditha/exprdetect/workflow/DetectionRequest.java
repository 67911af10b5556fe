package com.raditha.exprdetect.workflow;

import com.raditha.exprdetect.config.InstrumentMode;

/**
 * One invocation of the detector.
 *
 * @param counter        1-based ordinal of the instance to instrument
 * @param mode           what to do with the instance
 * @param referenceValue value the instance is checked against in check mode
 * @param replacement    text substituted for the instance in replace mode
 * @param queryOnly      only count the eligible instances
 */
public record DetectionRequest(
        int counter,
        InstrumentMode mode,
        String referenceValue,
        String replacement,
        boolean queryOnly) {

    /**
     * Validate the request.
     */
    public DetectionRequest {
        if (counter < 1) {
            throw new IllegalArgumentException("Counter must be at least 1, got: " + counter);
        }
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        if (!queryOnly && mode == InstrumentMode.CHECK && isBlank(referenceValue)) {
            throw new IllegalArgumentException("Check mode requires a reference value");
        }
        if (!queryOnly && mode == InstrumentMode.REPLACE && isBlank(replacement)) {
            throw new IllegalArgumentException("Replace mode requires a replacement");
        }
    }

    public static DetectionRequest emit(int counter) {
        return new DetectionRequest(counter, InstrumentMode.EMIT, null, null, false);
    }

    public static DetectionRequest check(int counter, String referenceValue) {
        return new DetectionRequest(counter, InstrumentMode.CHECK, referenceValue, null, false);
    }

    public static DetectionRequest replace(int counter, String replacement) {
        return new DetectionRequest(counter, InstrumentMode.REPLACE, null, replacement, false);
    }

    public static DetectionRequest queryInstances() {
        return new DetectionRequest(1, InstrumentMode.EMIT, null, null, true);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
