package com.flow.comparison;

import java.util.List;

/**
 * Outcome of running both algorithms over one batch.
 *
 * @param primaryNanos   Wall-clock time of the primary algorithm
 * @param referenceNanos Wall-clock time of the reference algorithm
 */
public record ComparisonResult(
        String primaryAlgorithm,
        String referenceAlgorithm,
        List<KeyComparison> comparisons,
        int primarySignals,
        int referenceSignals,
        long primaryNanos,
        long referenceNanos
) {

    public ComparisonResult {
        comparisons = List.copyOf(comparisons);
    }

    public long count(Agreement agreement) {
        return comparisons.stream().filter(c -> c.agreement() == agreement).count();
    }
}
