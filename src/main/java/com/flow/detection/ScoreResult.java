package com.flow.detection;

import com.flow.model.BaselineEvaluation;

/**
 * Confidence for one window and the terms it was built from.
 *
 * @param confidence           Weighted sum clamped to [0, 1]
 * @param strength             Class of the confidence, NONE when a guard failed
 * @param pressureSignificance Saturating transform of the pressure ratio, in [0, 1)
 * @param baselineDeviation    Saturating transform of the positive z-score, scaled by data quality
 * @param coordinationScore    Share of the saturation count of coordinated neighbour strikes
 * @param coordinatedStrikes   Neighbour strikes with same-direction elevated pressure
 * @param dataQuality          Lower of window completeness and baseline quality
 * @param baseline             Z-score, percentile rank and anomaly flag of the ratio
 */
public record ScoreResult(
        double confidence,
        SignalStrength strength,
        double pressureSignificance,
        double baselineDeviation,
        double coordinationScore,
        int coordinatedStrikes,
        double dataQuality,
        BaselineEvaluation baseline
) {

    public boolean isSignal() {
        return strength != SignalStrength.NONE;
    }
}
