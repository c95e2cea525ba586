package com.flow.detection;

/**
 * What to do with a window given its market-making score.
 */
public enum FilterRecommendation {
    ACCEPT,
    MONITOR,
    REJECT;

    /** Share of the maximum probability above which a window is only monitored. */
    static final double MONITOR_SHARE = 0.7;

    static FilterRecommendation of(double score, double maxProbability) {
        if (score > maxProbability) return REJECT;
        if (score > maxProbability * MONITOR_SHARE) return MONITOR;
        return ACCEPT;
    }
}
