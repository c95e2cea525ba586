package com.flow.detection;

import com.flow.config.DetectionConfig;

/**
 * Discrete confidence class, with the position-size multiplier each class carries.
 */
public enum SignalStrength {
    NONE(0.0),
    MODERATE(1.0),
    HIGH(1.5),
    VERY_HIGH(2.0),
    EXTREME(3.0);

    private final double positionMultiplier;

    SignalStrength(double positionMultiplier) {
        this.positionMultiplier = positionMultiplier;
    }

    public double getPositionMultiplier() {
        return positionMultiplier;
    }

    /**
     * Bucket a confidence against the cutoffs. A class needs confidence strictly
     * above its cutoff, so a tie lands in the lower class.
     */
    public static SignalStrength classify(double confidence, DetectionConfig.Scoring scoring) {
        if (confidence > scoring.extremeCutoff()) return EXTREME;
        if (confidence > scoring.veryHighCutoff()) return VERY_HIGH;
        if (confidence > scoring.highCutoff()) return HIGH;
        if (confidence > scoring.moderateCutoff()) return MODERATE;
        return NONE;
    }
}
