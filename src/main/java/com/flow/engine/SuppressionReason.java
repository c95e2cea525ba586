package com.flow.engine;

/**
 * Why a scored window produced no signal.
 */
public enum SuppressionReason {
    BELOW_MIN_PRESSURE,
    BELOW_MIN_VOLUME,
    LOW_DATA_QUALITY,
    BELOW_CONFIDENCE,
    COMPUTATION_FAILURE
}
