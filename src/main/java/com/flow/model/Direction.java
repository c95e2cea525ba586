package com.flow.model;

/**
 * Directional view on the underlying implied by option flow.
 * Buying calls or selling puts is LONG; buying puts or selling calls is SHORT.
 */
public enum Direction {
    LONG,
    SHORT,
    NEUTRAL;

    public static Direction of(OptionSide side, DominantSide dominant) {
        if (dominant == DominantSide.NEUTRAL) return NEUTRAL;
        boolean buying = dominant == DominantSide.BUY;
        return (side == OptionSide.CALL) == buying ? LONG : SHORT;
    }
}
