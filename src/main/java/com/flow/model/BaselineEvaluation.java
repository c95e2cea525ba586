package com.flow.model;

/**
 * A pressure ratio measured against a {@link BaselineContext}.
 *
 * @param value          Observed pressure ratio
 * @param zScore         (value - mean) / max(std, epsilon)
 * @param percentileRank Rank in [0, 100] interpolated on the ladder
 * @param anomaly        |z| at or above {@value #ANOMALY_Z_SCORE} or rank at or above {@value #ANOMALY_PERCENTILE}
 */
public record BaselineEvaluation(double value, double zScore, double percentileRank, boolean anomaly) {

    public static final double ANOMALY_Z_SCORE = 2.0;
    public static final double ANOMALY_PERCENTILE = 95.0;

    public static BaselineEvaluation of(double value, double zScore, double percentileRank) {
        boolean anomaly = Math.abs(zScore) >= ANOMALY_Z_SCORE || percentileRank >= ANOMALY_PERCENTILE;
        return new BaselineEvaluation(value, zScore, percentileRank, anomaly);
    }
}
