package com.raditha.exprdetect.config;

import com.raditha.exprdetect.analysis.NamingConvention;

/**
 * Settings shared by every run of the detector.
 *
 * @param naming         reserved prefixes of temporaries and guards
 * @param instanceNumber text compared against the guard, usually a macro the
 *                       harness defines on the compiler command line
 * @param verify         re-parse the instrumented output before returning it
 */
public record DetectorConfig(
        NamingConvention naming,
        String instanceNumber,
        boolean verify) {

    public static final String DEFAULT_INSTANCE_NUMBER = "__CVISE_INSTANCE_NUMBER";

    /**
     * Validate configuration.
     */
    public DetectorConfig {
        if (naming == null) {
            throw new IllegalArgumentException("naming cannot be null");
        }
        if (instanceNumber == null || instanceNumber.isBlank()) {
            throw new IllegalArgumentException("instanceNumber cannot be empty");
        }
    }

    /**
     * The prefixes and instance macro the reduction harness expects.
     */
    public static DetectorConfig defaults() {
        return new DetectorConfig(NamingConvention.defaults(), DEFAULT_INSTANCE_NUMBER, true);
    }

    public DetectorConfig withInstanceNumber(String value) {
        return new DetectorConfig(naming, value, verify);
    }

    public DetectorConfig withVerify(boolean value) {
        return new DetectorConfig(naming, instanceNumber, value);
    }
}
