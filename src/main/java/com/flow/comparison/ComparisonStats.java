package com.flow.comparison;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Totals accumulated by the harness across every comparison run.
 */
public record ComparisonStats(
        @JsonProperty("runs") long runs,
        @JsonProperty("windowsCompared") long windowsCompared,
        @JsonProperty("agreement") Map<Agreement, Long> agreement,
        @JsonProperty("directionAgreementRate") double directionAgreementRate,
        @JsonProperty("meanConfidenceDelta") double meanConfidenceDelta,
        @JsonProperty("meanPrimaryMicros") double meanPrimaryMicros,
        @JsonProperty("meanReferenceMicros") double meanReferenceMicros
) {

    public ComparisonStats {
        agreement = Map.copyOf(agreement);
    }
}
