package com.flow.config;

import com.flow.model.WindowLength;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Immutable detection settings, bound from {@code flow.detection.*}.
 *
 * <p>Every nested record validates itself on construction and throws
 * {@link ConfigurationException} for values that would make scoring undefined.
 * {@link #defaults()} mirrors the shipped {@code application.properties}.
 */
@ConfigurationProperties(prefix = "flow.detection")
public record DetectionConfig(
        Window window,
        Baseline baseline,
        Gates gates,
        Weights weights,
        Scoring scoring,
        MarketMaking marketMaking,
        Coordination coordination
) {

    /** Upper bound on the coordination weight, so the bonus stays a bonus. */
    public static final double MAX_COORDINATION_WEIGHT = 0.25;

    public DetectionConfig {
        require(window != null, "window settings missing");
        require(baseline != null, "baseline settings missing");
        require(gates != null, "gate settings missing");
        require(weights != null, "weight settings missing");
        require(scoring != null, "scoring settings missing");
        require(marketMaking != null, "market-making settings missing");
        require(coordination != null, "coordination settings missing");
    }

    public static DetectionConfig defaults() {
        return new DetectionConfig(
                new Window(Duration.ofMinutes(5), Duration.ofMinutes(30)),
                new Baseline(20, 78, 512, 20, 10_000, 1e-6, 1.0, 0.5, 0.1, 0.8),
                new Gates(2.0, 100, 0.5),
                new Weights(0.5, 0.5, 0.6, 0.15),
                new Scoring(3.0, 0.85, 0.75, 0.65, 0.5),
                new MarketMaking(Duration.ofMinutes(5), 0.7, 0.9, 0.5, 0.05,
                        Duration.ofMinutes(60), 4096, 0.3),
                new Coordination(50.0, Duration.ofMinutes(5), 1.5, 3)
        );
    }

    public DetectionConfig withWindow(Window value) {
        return new DetectionConfig(value, baseline, gates, weights, scoring, marketMaking, coordination);
    }

    public DetectionConfig withBaseline(Baseline value) {
        return new DetectionConfig(window, value, gates, weights, scoring, marketMaking, coordination);
    }

    public DetectionConfig withGates(Gates value) {
        return new DetectionConfig(window, baseline, value, weights, scoring, marketMaking, coordination);
    }

    public DetectionConfig withWeights(Weights value) {
        return new DetectionConfig(window, baseline, gates, value, scoring, marketMaking, coordination);
    }

    public DetectionConfig withMarketMaking(MarketMaking value) {
        return new DetectionConfig(window, baseline, gates, weights, scoring, value, coordination);
    }

    public DetectionConfig withCoordination(Coordination value) {
        return new DetectionConfig(window, baseline, gates, weights, scoring, marketMaking, value);
    }

    /**
     * @param length      Bucket length of one pressure window
     * @param idleTimeout Keys without events for this long are evicted from the aggregator
     */
    public record Window(Duration length, Duration idleTimeout) {
        public Window {
            requirePositive(length, "window.length");
            requirePositive(idleTimeout, "window.idle-timeout");
            require(idleTimeout.compareTo(length) >= 0, "window.idle-timeout must be at least window.length");
        }

        public WindowLength windowLength() {
            return WindowLength.of(length);
        }
    }

    /**
     * @param lookbackDays          Days of closed windows in the rolling statistic
     * @param expectedWindowsPerDay Windows per key per trading day, for data quality
     * @param reservoirSize         Recent observations kept per key for percentiles
     * @param minReservoirSamples   Below this the ladder uses a normal approximation
     * @param queueCapacity         Pending record() calls before drop-oldest kicks in
     * @param epsilon               Floor on the standard deviation in z-scores
     * @param defaultMean           Mean pressure ratio served for keys without history
     * @param defaultStd            Standard deviation served for keys without history
     * @param fallbackDataQuality   Data quality of the default context
     * @param degradedQualityFactor Multiplier on data quality while storage is unavailable
     */
    public record Baseline(
            int lookbackDays,
            int expectedWindowsPerDay,
            int reservoirSize,
            int minReservoirSamples,
            int queueCapacity,
            double epsilon,
            double defaultMean,
            double defaultStd,
            double fallbackDataQuality,
            double degradedQualityFactor
    ) {
        public Baseline {
            require(lookbackDays > 0, "baseline.lookback-days must be positive");
            require(expectedWindowsPerDay > 0, "baseline.expected-windows-per-day must be positive");
            require(reservoirSize > 0, "baseline.reservoir-size must be positive");
            require(minReservoirSamples > 0 && minReservoirSamples <= reservoirSize,
                    "baseline.min-reservoir-samples must be in (0, reservoir-size]");
            require(queueCapacity > 0, "baseline.queue-capacity must be positive");
            require(epsilon > 0, "baseline.epsilon must be positive");
            require(defaultMean >= 0, "baseline.default-mean must be non-negative");
            require(defaultStd >= 0, "baseline.default-std must be non-negative");
            requireUnit(fallbackDataQuality, "baseline.fallback-data-quality");
            requireUnit(degradedQualityFactor, "baseline.degraded-quality-factor");
        }

        public int expectedWindows() {
            return lookbackDays * expectedWindowsPerDay;
        }
    }

    /**
     * Hard gates. A window failing any of them produces no signal.
     */
    public record Gates(double minPressureRatio, long minVolume, double minDataQuality) {
        public Gates {
            require(minPressureRatio > 1.0, "gates.min-pressure-ratio must be above 1");
            require(minVolume >= 0, "gates.min-volume must be non-negative");
            requireUnit(minDataQuality, "gates.min-data-quality");
        }
    }

    /**
     * confidence = pressure * significance + baseline * deviation
     * - marketMaking * mmScore + coordination * coordinationScore.
     */
    public record Weights(double pressure, double baseline, double marketMaking, double coordination) {
        public Weights {
            requireUnit(pressure, "weights.pressure");
            requireUnit(baseline, "weights.baseline");
            requireUnit(marketMaking, "weights.market-making");
            requireUnit(coordination, "weights.coordination");
            require(pressure + baseline <= 1.0 + 1e-9, "weights.pressure + weights.baseline must not exceed 1");
            require(coordination <= MAX_COORDINATION_WEIGHT,
                    "weights.coordination must not exceed " + MAX_COORDINATION_WEIGHT);
        }
    }

    /**
     * @param zScoreScale Z-score at which the saturating deviation term reaches tanh(1)
     */
    public record Scoring(
            double zScoreScale,
            double extremeCutoff,
            double veryHighCutoff,
            double highCutoff,
            double moderateCutoff
    ) {
        public Scoring {
            require(zScoreScale > 0, "scoring.z-score-scale must be positive");
            require(moderateCutoff > 0, "scoring.moderate-cutoff must be positive");
            require(moderateCutoff < highCutoff && highCutoff < veryHighCutoff && veryHighCutoff < extremeCutoff,
                    "strength cutoffs must be strictly increasing");
            require(extremeCutoff < 1.0, "scoring.extreme-cutoff must be below 1");
        }
    }

    /**
     * @param straddleTimeOffset    Maximum start offset between call and put legs
     * @param straddleBalanceWeight Share of straddle probability from volume balance (rest: proximity)
     * @param straddleWeight        Weight of straddle probability in the combined score
     * @param volatilityCrushWeight Weight of volatility-crush probability in the combined score
     * @param crushDeclineThreshold Price decline (fraction) on both sides that flags a crush
     * @param historyRetention      How long closed windows stay in the recent-history buffer
     * @param historyCapacity       Hard cap on the recent-history buffer
     * @param maxProbability        Combined score above which the filter recommends REJECT
     */
    public record MarketMaking(
            Duration straddleTimeOffset,
            double straddleBalanceWeight,
            double straddleWeight,
            double volatilityCrushWeight,
            double crushDeclineThreshold,
            Duration historyRetention,
            int historyCapacity,
            double maxProbability
    ) {
        public MarketMaking {
            requirePositive(straddleTimeOffset, "market-making.straddle-time-offset");
            requireUnit(straddleBalanceWeight, "market-making.straddle-balance-weight");
            requireUnit(straddleWeight, "market-making.straddle-weight");
            requireUnit(volatilityCrushWeight, "market-making.volatility-crush-weight");
            require(crushDeclineThreshold > 0 && crushDeclineThreshold < 1,
                    "market-making.crush-decline-threshold must be in (0, 1)");
            requirePositive(historyRetention, "market-making.history-retention");
            require(historyCapacity > 0, "market-making.history-capacity must be positive");
            requireUnit(maxProbability, "market-making.max-probability");
        }
    }

    /**
     * @param radius                Strike distance that counts as nearby
     * @param timeOffset            Maximum start offset between coordinated windows
     * @param elevatedPressureRatio Pressure ratio a neighbour needs to count
     * @param saturationCount       Neighbours at which the coordination score reaches 1
     */
    public record Coordination(double radius, Duration timeOffset, double elevatedPressureRatio, int saturationCount) {
        public Coordination {
            require(radius >= 0 && !Double.isNaN(radius), "coordination.radius must be non-negative");
            require(timeOffset != null && !timeOffset.isNegative(), "coordination.time-offset must be non-negative");
            require(elevatedPressureRatio > 0, "coordination.elevated-pressure-ratio must be positive");
            require(saturationCount > 0, "coordination.saturation-count must be positive");
        }
    }

    private static void require(boolean condition, String message) {
        if (!condition) throw new ConfigurationException(message);
    }

    private static void requirePositive(Duration value, String name) {
        require(value != null && !value.isZero() && !value.isNegative(), name + " must be positive");
    }

    private static void requireUnit(double value, String name) {
        require(value >= 0 && value <= 1, name + " must be within [0, 1]");
    }
}
