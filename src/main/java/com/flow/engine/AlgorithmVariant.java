package com.flow.engine;

/**
 * The closed set of signal algorithms, chosen once at startup via {@code flow.algorithm}.
 */
public enum AlgorithmVariant {
    INSTITUTIONAL_FLOW,
    VOLUME_RATIO
}
