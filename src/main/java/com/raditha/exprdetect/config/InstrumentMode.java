package com.raditha.exprdetect.config;

/**
 * What to do with the selected instance.
 */
public enum InstrumentMode {
    /**
     * Emit mode - print the value of the instance the first time the
     * instrumented program reaches it.
     */
    EMIT,

    /**
     * Check mode - abort the instrumented program when the instance differs
     * from a reference value.
     */
    CHECK,

    /**
     * Replace mode - substitute the instance with caller-supplied text.
     */
    REPLACE;

    /**
     * Convert a string value to InstrumentMode enum.
     *
     * @param value the string value to convert (case-insensitive)
     * @return the corresponding InstrumentMode
     * @throws IllegalArgumentException if the value is not a valid mode
     */
    public static InstrumentMode fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("InstrumentMode value cannot be null");
        }

        return switch (value.toLowerCase()) {
            case "emit" -> EMIT;
            case "check" -> CHECK;
            case "replace" -> REPLACE;
            default -> throw new IllegalArgumentException(
                    "Invalid instrument mode: " + value + ". Must be: emit, check, or replace");
        };
    }

    /**
     * Get the string representation of this mode for CLI usage.
     *
     * @return lowercase string representation
     */
    public String toCliString() {
        return switch (this) {
            case EMIT -> "emit";
            case CHECK -> "check";
            case REPLACE -> "replace";
        };
    }
}
