package com.flow.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flow.detection.SignalStrength;
import com.flow.engine.Signal;
import com.flow.model.Direction;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of the most recently emitted signals.
 */
public record SignalSummary(
        @JsonProperty("totalSignals") long totalSignals,
        @JsonProperty("recentSignals") int recentSignals,
        @JsonProperty("averageConfidence") double averageConfidence,
        @JsonProperty("byStrength") Map<SignalStrength, Long> byStrength,
        @JsonProperty("byDirection") Map<Direction, Long> byDirection,
        @JsonProperty("latest") List<Signal> latest
) {

    static final int LATEST_COUNT = 5;

    /**
     * @param totalSignals Signals emitted since startup
     * @param recent       Retained signals, oldest first
     */
    static SignalSummary of(long totalSignals, List<Signal> recent) {
        Map<SignalStrength, Long> byStrength = new EnumMap<>(SignalStrength.class);
        Map<Direction, Long> byDirection = new EnumMap<>(Direction.class);
        double confidenceSum = 0.0;
        for (Signal signal : recent) {
            byStrength.merge(signal.strength(), 1L, Long::sum);
            byDirection.merge(signal.direction(), 1L, Long::sum);
            confidenceSum += signal.confidence();
        }
        double average = recent.isEmpty() ? 0.0 : confidenceSum / recent.size();
        List<Signal> latest = recent.subList(Math.max(0, recent.size() - LATEST_COUNT), recent.size());
        return new SignalSummary(totalSignals, recent.size(), average,
                byStrength, byDirection, List.copyOf(latest));
    }
}
