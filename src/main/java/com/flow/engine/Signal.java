package com.flow.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flow.detection.SignalStrength;
import com.flow.model.Direction;
import com.flow.model.DominantSide;
import com.flow.model.InstrumentKey;

/**
 * A classified institutional-flow signal for one closed window. Immutable.
 *
 * <p>Data quality is reported on {@link KeyEvaluation} and in the logs, not here.
 *
 * @param key                Strike and option side
 * @param timestamp          Window end in Unix milliseconds
 * @param windowStart        Window start in Unix milliseconds
 * @param pressureRatio      ask / max(bid, 1)
 * @param bidVolume          Bid-initiated volume
 * @param askVolume          Ask-initiated volume
 * @param dominantSide       Prevailing aggressor side
 * @param direction          Implied view on the underlying
 * @param baselineMean       Mean ratio of the baseline used
 * @param zScore             Baseline z-score of the ratio
 * @param percentileRank     Rank of the ratio on the baseline ladder
 * @param marketMakingScore  Combined market-making score
 * @param straddleDetected   Opposite-side straddle found
 * @param volatilityCrush    Simultaneous call and put decline found
 * @param coordinationScore  Cross-strike coordination score
 * @param confidence         Final confidence in [0, 1]
 * @param strength           Discrete class of the confidence
 * @param action             Recommended action for the class
 * @param positionMultiplier Position-size multiplier for the class
 * @param riskScore          1 - confidence
 * @param algorithm          Name of the producing algorithm
 */
public record Signal(
        @JsonProperty("key") InstrumentKey key,
        @JsonProperty("timestamp") long timestamp,
        @JsonProperty("windowStart") long windowStart,
        @JsonProperty("pressureRatio") double pressureRatio,
        @JsonProperty("bidVolume") long bidVolume,
        @JsonProperty("askVolume") long askVolume,
        @JsonProperty("dominantSide") DominantSide dominantSide,
        @JsonProperty("direction") Direction direction,
        @JsonProperty("baselineMean") double baselineMean,
        @JsonProperty("zScore") double zScore,
        @JsonProperty("percentileRank") double percentileRank,
        @JsonProperty("marketMakingScore") double marketMakingScore,
        @JsonProperty("straddleDetected") boolean straddleDetected,
        @JsonProperty("volatilityCrush") boolean volatilityCrush,
        @JsonProperty("coordinationScore") double coordinationScore,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("strength") SignalStrength strength,
        @JsonProperty("action") RecommendedAction action,
        @JsonProperty("positionMultiplier") double positionMultiplier,
        @JsonProperty("riskScore") double riskScore,
        @JsonProperty("algorithm") String algorithm
) {

    public Signal {
        if (key == null) throw new IllegalArgumentException("Key must not be null");
        if (!(confidence >= 0 && confidence <= 1)) throw new IllegalArgumentException("Confidence must be in [0, 1]");
        if (strength == null || strength == SignalStrength.NONE) {
            throw new IllegalArgumentException("A signal needs a strength above NONE");
        }
    }
}
