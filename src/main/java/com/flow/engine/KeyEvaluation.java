package com.flow.engine;

import com.flow.model.InstrumentKey;

/**
 * Per-window outcome of one evaluation, for operators and the comparison harness.
 *
 * @param key         Strike and option side
 * @param windowStart Start of the evaluated window
 * @param state       EMITTED or SUPPRESSED
 * @param confidence  Computed confidence, 0 when scoring failed
 * @param dataQuality Lower of window completeness and baseline quality
 * @param reason      Why no signal was produced; null when emitted
 * @param signal      The emitted signal; null when suppressed
 */
public record KeyEvaluation(
        InstrumentKey key,
        long windowStart,
        KeyState state,
        double confidence,
        double dataQuality,
        SuppressionReason reason,
        Signal signal
) {

    public static KeyEvaluation emitted(Signal signal, double dataQuality) {
        return new KeyEvaluation(signal.key(), signal.windowStart(), KeyState.EMITTED,
                signal.confidence(), dataQuality, null, signal);
    }

    public static KeyEvaluation suppressed(InstrumentKey key, long windowStart, double confidence,
                                           double dataQuality, SuppressionReason reason) {
        return new KeyEvaluation(key, windowStart, KeyState.SUPPRESSED, confidence, dataQuality, reason, null);
    }

    public boolean isEmitted() {
        return state == KeyState.EMITTED;
    }
}
