package com.flow.model;

/**
 * Immutable summary of a key's trailing pressure-ratio history.
 * Published whole by the baseline store and only ever read during scoring.
 *
 * @param key         Strike and option side
 * @param mean        Mean pressure ratio over the lookback
 * @param std         Population standard deviation, never negative
 * @param ladder      Percentile ladder
 * @param sampleCount Closed windows contributing to the statistic
 * @param dataQuality Observed share of expected windows in [0, 1], after penalties
 * @param fallback    True when no history exists and configured defaults are served
 */
public record BaselineContext(
        InstrumentKey key,
        double mean,
        double std,
        PercentileLadder ladder,
        long sampleCount,
        double dataQuality,
        boolean fallback
) {

    public BaselineContext {
        if (key == null) throw new IllegalArgumentException("Key must not be null");
        if (ladder == null) throw new IllegalArgumentException("Ladder must not be null");
        if (Double.isNaN(mean)) throw new IllegalArgumentException("Mean must be a number");
        if (!(std >= 0)) throw new IllegalArgumentException("Std must be non-negative");
        if (sampleCount < 0) throw new IllegalArgumentException("Sample count must be non-negative");
        if (!(dataQuality >= 0 && dataQuality <= 1)) throw new IllegalArgumentException("Data quality must be in [0, 1]");
    }

    public double zScore(double value, double epsilon) {
        return (value - mean) / Math.max(std, epsilon);
    }

    public BaselineEvaluation evaluate(double value, double epsilon) {
        return BaselineEvaluation.of(value, zScore(value, epsilon), ladder.percentileRank(value));
    }

    public BaselineContext withDataQuality(double quality) {
        return new BaselineContext(key, mean, std, ladder, sampleCount, quality, fallback);
    }
}
