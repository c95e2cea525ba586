package com.flow.engine;

import com.flow.config.DetectionConfig;
import com.flow.detection.SignalStrength;
import com.flow.model.InstrumentKey;
import com.flow.model.PressureWindow;

import java.util.ArrayList;
import java.util.List;

/**
 * Reference algorithm: raw ask/bid ratio and volume thresholds, with no baseline,
 * market-making or coordination adjustment. Stateless, so both modes behave alike.
 *
 * <p>confidence = min(1, ratio / saturationRatio). A qualifying window is at least MODERATE.
 */
public class VolumeRatioAlgorithm implements SignalAlgorithm {

    public static final String NAME = "volume-ratio";

    private final DetectionConfig config;
    private final double saturationRatio;

    public VolumeRatioAlgorithm(DetectionConfig config) {
        this(config, 2.0 * config.gates().minPressureRatio());
    }

    public VolumeRatioAlgorithm(DetectionConfig config, double saturationRatio) {
        if (!(saturationRatio > 0)) throw new IllegalArgumentException("Saturation ratio must be positive");
        this.config = config;
        this.saturationRatio = saturationRatio;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public BatchResult evaluateDetailed(List<PressureWindow> batch, EvaluationMode mode) {
        long started = System.nanoTime();
        List<Signal> signals = new ArrayList<>();
        List<KeyEvaluation> evaluations = new ArrayList<>(batch.size());

        for (PressureWindow window : batch) {
            InstrumentKey key = window.key();
            double ratio = window.pressureRatio();
            double confidence = Math.min(1.0, ratio / saturationRatio);
            double quality = window.dataCompleteness();

            SuppressionReason reason = null;
            if (ratio < config.gates().minPressureRatio()) reason = SuppressionReason.BELOW_MIN_PRESSURE;
            else if (window.totalVolume() < config.gates().minVolume()) reason = SuppressionReason.BELOW_MIN_VOLUME;

            if (reason != null) {
                evaluations.add(KeyEvaluation.suppressed(key, window.windowStart(), confidence, quality, reason));
                continue;
            }

            SignalStrength strength = SignalStrength.classify(confidence, config.scoring());
            if (strength == SignalStrength.NONE) strength = SignalStrength.MODERATE;
            Signal signal = new Signal(key, window.windowEnd(), window.windowStart(), ratio,
                    window.bidVolume(), window.askVolume(), window.dominantSide(), window.direction(),
                    0.0, 0.0, 0.0, 0.0, false, false, 0.0,
                    confidence, strength, RecommendedAction.forStrength(strength),
                    strength.getPositionMultiplier(), 1.0 - confidence, NAME);
            signals.add(signal);
            evaluations.add(KeyEvaluation.emitted(signal, quality));
        }
        return new BatchResult(NAME, signals, evaluations, System.nanoTime() - started);
    }
}
