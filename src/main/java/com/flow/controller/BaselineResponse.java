package com.flow.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flow.model.BaselineContext;
import com.flow.model.PercentileLadder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST response DTO for one key's baseline.
 *
 * <pre>
 * {
 *   "key": "21900C",
 *   "mean": 1.02,
 *   "std": 0.31,
 *   "percentiles": {"p10": 0.64, ..., "p99": 1.9},
 *   "samples": 1404,
 *   "dataQuality": 0.9,
 *   "fallback": false
 * }
 * </pre>
 */
public record BaselineResponse(
        @JsonProperty("key") String key,
        @JsonProperty("mean") double mean,
        @JsonProperty("std") double std,
        @JsonProperty("percentiles") Map<String, Double> percentiles,
        @JsonProperty("samples") long samples,
        @JsonProperty("dataQuality") double dataQuality,
        @JsonProperty("fallback") boolean fallback
) {

    public static BaselineResponse of(BaselineContext context) {
        Map<String, Double> percentiles = new LinkedHashMap<>();
        double[] values = context.ladder().values();
        for (int i = 0; i < PercentileLadder.RANKS.length; i++) {
            percentiles.put("p" + PercentileLadder.RANKS[i], round(values[i]));
        }
        return new BaselineResponse(context.key().toString(), round(context.mean()), round(context.std()),
                percentiles, context.sampleCount(), round(context.dataQuality()), context.fallback());
    }

    private static double round(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
