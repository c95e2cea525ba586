package com.flow.store;

/**
 * Count, mean, sum of squared deviations (M2), minimum and maximum of a series.
 * Updated one value at a time with Welford's method and combined with Chan's
 * parallel formula, so per-day summaries can be merged without the raw values.
 */
public record RunningStats(long count, double mean, double m2, double min, double max) {

    public static final RunningStats EMPTY = new RunningStats(0, 0.0, 0.0, Double.NaN, Double.NaN);

    public RunningStats {
        if (count < 0) throw new IllegalArgumentException("Count must be non-negative");
        if (m2 < 0) m2 = 0.0;
    }

    public static RunningStats of(double value) {
        return new RunningStats(1, value, 0.0, value, value);
    }

    public RunningStats add(double value) {
        if (count == 0) return of(value);
        long n = count + 1;
        double delta = value - mean;
        double newMean = mean + delta / n;
        double newM2 = m2 + delta * (value - newMean);
        return new RunningStats(n, newMean, newM2, Math.min(min, value), Math.max(max, value));
    }

    public RunningStats merge(RunningStats other) {
        if (other.count == 0) return this;
        if (count == 0) return other;
        long n = count + other.count;
        double delta = other.mean - mean;
        double newMean = mean + delta * other.count / n;
        double newM2 = m2 + other.m2 + delta * delta * ((double) count * other.count / n);
        return new RunningStats(n, newMean, newM2, Math.min(min, other.min), Math.max(max, other.max));
    }

    /** Population variance; 0 for fewer than two values. */
    public double variance() {
        return count < 2 ? 0.0 : m2 / count;
    }

    public double std() {
        return Math.sqrt(variance());
    }

    public boolean isEmpty() {
        return count == 0;
    }
}
