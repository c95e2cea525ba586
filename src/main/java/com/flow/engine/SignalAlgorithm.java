package com.flow.engine;

import com.flow.model.PressureWindow;

import java.util.List;

/**
 * Turns a batch of closed pressure windows into signals.
 */
public interface SignalAlgorithm {

    String name();

    /**
     * Evaluate a batch and report every window's outcome.
     * Never throws for problems confined to one key.
     */
    BatchResult evaluateDetailed(List<PressureWindow> batch, EvaluationMode mode);

    /**
     * Live evaluation returning only the emitted signals.
     */
    default List<Signal> evaluate(List<PressureWindow> batch) {
        return evaluateDetailed(batch, EvaluationMode.LIVE).signals();
    }
}
