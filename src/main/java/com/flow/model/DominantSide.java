package com.flow.model;

/**
 * Prevailing aggressor side of a window.
 */
public enum DominantSide {
    BUY,
    SELL,
    NEUTRAL;

    /** Share of classified volume above which one side dominates. */
    private static final double DOMINANCE_SHARE = 0.6;

    /**
     * Classify from ask-initiated (buy) and bid-initiated (sell) volume.
     */
    public static DominantSide of(long askVolume, long bidVolume) {
        long classified = askVolume + bidVolume;
        if (classified == 0) return NEUTRAL;
        double buyShare = (double) askVolume / classified;
        if (buyShare > DOMINANCE_SHARE) return BUY;
        if (buyShare < 1.0 - DOMINANCE_SHARE) return SELL;
        return NEUTRAL;
    }
}
