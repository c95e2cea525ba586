package com.flow.detection;

/**
 * Likelihood that a window is delta-neutral market making rather than directional flow.
 *
 * @param straddleProbability Best match against an opposite-side window at the same strike
 * @param straddleDetected    Straddle probability reached the detection threshold
 * @param crushProbability    Strength of a simultaneous call and put price decline
 * @param volatilityCrush     Both sides fell by at least the configured threshold
 * @param score               Weighted combination, clamped to [0, 1]
 * @param recommendation      Filter outcome for the score
 */
public record MarketMakingAssessment(
        double straddleProbability,
        boolean straddleDetected,
        double crushProbability,
        boolean volatilityCrush,
        double score,
        FilterRecommendation recommendation
) {

    public static final MarketMakingAssessment NONE =
            new MarketMakingAssessment(0.0, false, 0.0, false, 0.0, FilterRecommendation.ACCEPT);

    public MarketMakingAssessment {
        if (!(score >= 0 && score <= 1)) throw new IllegalArgumentException("Score must be in [0, 1]");
        if (recommendation == null) throw new IllegalArgumentException("Recommendation must not be null");
    }

    /**
     * Assessment with only a combined score, for callers that have no sub-probabilities.
     */
    public static MarketMakingAssessment ofScore(double score, double maxProbability) {
        return new MarketMakingAssessment(0.0, false, 0.0, false, score,
                FilterRecommendation.of(score, maxProbability));
    }
}
