package com.flow.comparison;

import com.flow.model.Direction;
import com.flow.model.InstrumentKey;

/**
 * Both algorithms' verdicts on one window.
 *
 * @param directionAgreement True when both signalled in the same direction; false otherwise
 * @param confidenceDelta    Primary confidence minus reference confidence
 */
public record KeyComparison(
        InstrumentKey key,
        long windowStart,
        Agreement agreement,
        Direction primaryDirection,
        Direction referenceDirection,
        boolean directionAgreement,
        double primaryConfidence,
        double referenceConfidence,
        double confidenceDelta
) {
}
