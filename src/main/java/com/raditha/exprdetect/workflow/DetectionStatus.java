package com.raditha.exprdetect.workflow;

/**
 * How a detector run ended.
 */
public enum DetectionStatus {
    /** The selected instance was rewritten. */
    OK,
    /** Only the eligible instances were counted. */
    QUERY_ONLY,
    /** The requested ordinal is larger than the number of eligible instances. */
    MAX_INSTANCE_EXCEEDED,
    /** The unit is C++ and was not analyzed. */
    UNSUPPORTED_DIALECT
}
