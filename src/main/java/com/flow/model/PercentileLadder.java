package com.flow.model;

import java.util.Arrays;

/**
 * Pressure-ratio values at the fixed percentile ranks 10/25/50/75/90/95/99.
 * Values are non-decreasing; construction rejects anything else.
 */
public final class PercentileLadder {

    public static final int[] RANKS = {10, 25, 50, 75, 90, 95, 99};

    /** Standard-normal quantiles for {@link #RANKS}. */
    private static final double[] NORMAL_QUANTILES = {
            -1.2815516, -0.6744898, 0.0, 0.6744898, 1.2815516, 1.6448536, 2.3263479
    };

    private final double[] values;

    private PercentileLadder(double[] values) {
        if (values.length != RANKS.length) {
            throw new IllegalArgumentException("Ladder needs " + RANKS.length + " values");
        }
        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(values[i]) || values[i] < 0) {
                throw new IllegalArgumentException("Ladder values must be non-negative numbers");
            }
            if (i > 0 && values[i] < values[i - 1]) {
                throw new IllegalArgumentException("Ladder values must be non-decreasing");
            }
        }
        this.values = values;
    }

    public static PercentileLadder of(double... values) {
        return new PercentileLadder(values.clone());
    }

    /**
     * Ladder from observed samples, linearly interpolated between closest ranks.
     *
     * @param samples Observations in any order; not modified
     */
    public static PercentileLadder fromSamples(double[] samples) {
        if (samples.length == 0) throw new IllegalArgumentException("No samples");
        double[] sorted = samples.clone();
        Arrays.sort(sorted);
        double[] ladder = new double[RANKS.length];
        for (int i = 0; i < RANKS.length; i++) {
            ladder[i] = Math.max(0.0, interpolate(sorted, RANKS[i]));
        }
        return new PercentileLadder(ladder);
    }

    /**
     * Ladder approximated as mean + z_p * std, used until enough samples exist.
     */
    public static PercentileLadder normal(double mean, double std) {
        double[] ladder = new double[RANKS.length];
        for (int i = 0; i < RANKS.length; i++) {
            double value = Math.max(0.0, mean + NORMAL_QUANTILES[i] * std);
            ladder[i] = i == 0 ? value : Math.max(value, ladder[i - 1]);
        }
        return new PercentileLadder(ladder);
    }

    /**
     * Percentile rank of {@code value}, interpolated between rungs.
     * A value equal to several flat rungs gets the lowest of their ranks.
     * Below the first rung the rank scales linearly from 0; above the last it is 100.
     */
    public double percentileRank(double value) {
        if (value <= values[0]) {
            if (values[0] <= 0) return value < values[0] ? 0.0 : RANKS[0];
            return RANKS[0] * Math.max(0.0, value) / values[0];
        }
        for (int i = 1; i < values.length; i++) {
            if (value <= values[i]) {
                double fraction = (value - values[i - 1]) / (values[i] - values[i - 1]);
                return RANKS[i - 1] + (RANKS[i] - RANKS[i - 1]) * fraction;
            }
        }
        return 100.0;
    }

    public double valueAt(int rank) {
        for (int i = 0; i < RANKS.length; i++) {
            if (RANKS[i] == rank) return values[i];
        }
        throw new IllegalArgumentException("Unsupported rank: " + rank);
    }

    public double median() {
        return valueAt(50);
    }

    public double[] values() {
        return values.clone();
    }

    private static double interpolate(double[] sorted, int rank) {
        double position = rank / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        if (lower == upper) return sorted[lower];
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (position - lower);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PercentileLadder other && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "PercentileLadder" + Arrays.toString(values);
    }
}
