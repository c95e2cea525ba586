package com.flow.engine;

import java.util.List;

/**
 * Everything one algorithm produced for one batch.
 *
 * @param algorithm    Name of the algorithm
 * @param signals      Emitted signals, in evaluation order
 * @param evaluations  One entry per evaluated window
 * @param elapsedNanos Wall-clock time spent evaluating
 */
public record BatchResult(String algorithm, List<Signal> signals, List<KeyEvaluation> evaluations, long elapsedNanos) {

    public BatchResult {
        signals = List.copyOf(signals);
        evaluations = List.copyOf(evaluations);
    }
}
