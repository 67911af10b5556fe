package com.raditha.exprdetect.selection;

import java.util.Optional;

/**
 * Outcome of one counting pass.
 *
 * @param eligibleCount number of eligible instances in the unit
 * @param target        ordinal that was requested
 * @param captured      the instance with that ordinal, if it exists
 */
public record SelectionResult(
        int eligibleCount,
        int target,
        Optional<CapturedInstance> captured) {

    public boolean targetExceedsCount() {
        return target > eligibleCount;
    }
}
