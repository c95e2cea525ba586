package com.flow.detection;

import com.flow.config.DetectionConfig;
import com.flow.model.BaselineContext;
import com.flow.model.BaselineEvaluation;
import com.flow.model.Direction;
import com.flow.model.PressureWindow;

import java.util.HashSet;
import java.util.Set;

/**
 * Combines pressure, baseline deviation, market-making penalty and cross-strike
 * coordination into one bounded confidence:
 *
 * <pre>
 * confidence = wP * pressureSignificance + wB * baselineDeviation
 *            - wMM * mm.score + wC * coordinationScore      (clamped to [0, 1])
 * </pre>
 *
 * Both positive terms saturate so a single extreme input cannot dominate.
 */
public class ConfidenceScorer {

    private final DetectionConfig config;

    public ConfidenceScorer(DetectionConfig config) {
        this.config = config;
    }

    public ScoreResult score(PressureWindow window, BaselineContext baseline, MarketMakingAssessment mm) {
        return score(window, baseline, mm, CoordinationIndex.empty());
    }

    public ScoreResult score(PressureWindow window,
                             BaselineContext baseline,
                             MarketMakingAssessment mm,
                             CoordinationIndex coordination) {
        DetectionConfig.Weights weights = config.weights();
        double ratio = window.pressureRatio();
        BaselineEvaluation evaluation = baseline.evaluate(ratio, config.baseline().epsilon());

        double significance = pressureSignificance(ratio);
        double deviation = baselineDeviation(evaluation.zScore(), baseline.dataQuality());
        int coordinated = coordinatedStrikes(window, coordination);
        double coordinationScore = Math.min(1.0, (double) coordinated / config.coordination().saturationCount());

        double confidence = clamp(weights.pressure() * significance
                + weights.baseline() * deviation
                - weights.marketMaking() * mm.score()
                + weights.coordination() * coordinationScore);

        double quality = dataQuality(window, baseline);
        SignalStrength strength = passesGuards(window)
                ? SignalStrength.classify(confidence, config.scoring())
                : SignalStrength.NONE;

        return new ScoreResult(confidence, strength, significance, deviation,
                coordinationScore, coordinated, quality, evaluation);
    }

    /**
     * 0 at a ratio of 1, about 0.63 at the minimum-interest ratio, approaching 1 above it.
     */
    double pressureSignificance(double ratio) {
        if (ratio <= 1.0) return 0.0;
        double scale = config.gates().minPressureRatio() - 1.0;
        return 1.0 - Math.exp(-(ratio - 1.0) / scale);
    }

    /**
     * tanh of the positive z-score over the scale, weighted by baseline data quality.
     */
    double baselineDeviation(double zScore, double dataQuality) {
        if (!(zScore > 0)) return 0.0;
        return Math.tanh(zScore / config.scoring().zScoreScale()) * dataQuality;
    }

    /**
     * Distinct other strikes within the radius whose windows share this window's
     * direction, started within the time offset, and carry elevated pressure.
     */
    int coordinatedStrikes(PressureWindow window, CoordinationIndex coordination) {
        Direction direction = window.direction();
        if (direction == Direction.NEUTRAL || coordination.isEmpty()) return 0;
        DetectionConfig.Coordination settings = config.coordination();
        long offset = settings.timeOffset().toMillis();

        Set<Double> strikes = new HashSet<>();
        for (PressureWindow neighbour : coordination.nearby(window.key().strike(), settings.radius())) {
            if (neighbour.key().strike() == window.key().strike()) continue;
            if (neighbour.direction() != direction) continue;
            if (neighbour.pressureRatio() < settings.elevatedPressureRatio()) continue;
            if (Math.abs(neighbour.windowStart() - window.windowStart()) > offset) continue;
            strikes.add(neighbour.key().strike());
        }
        return strikes.size();
    }

    /** Minimum volume and window data-completeness guards. */
    public boolean passesGuards(PressureWindow window) {
        return window.totalVolume() >= config.gates().minVolume()
                && window.dataCompleteness() >= config.gates().minDataQuality();
    }

    static double dataQuality(PressureWindow window, BaselineContext baseline) {
        return Math.min(window.dataCompleteness(), baseline.dataQuality());
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
