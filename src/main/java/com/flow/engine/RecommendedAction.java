package com.flow.engine;

import com.flow.detection.SignalStrength;

/**
 * Action suggested to downstream consumers for a signal of a given strength.
 */
public enum RecommendedAction {
    STRONG_BUY,
    BUY,
    MONITOR,
    IGNORE;

    public static RecommendedAction forStrength(SignalStrength strength) {
        return switch (strength) {
            case EXTREME -> STRONG_BUY;
            case VERY_HIGH, HIGH -> BUY;
            case MODERATE -> MONITOR;
            case NONE -> IGNORE;
        };
    }
}
