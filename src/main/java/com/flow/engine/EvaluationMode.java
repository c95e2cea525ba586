package com.flow.engine;

/**
 * LIVE evaluation feeds the baseline store, the recent history and key states.
 * SHADOW computes the same outcomes and leaves all of them untouched.
 */
public enum EvaluationMode {
    LIVE,
    SHADOW
}
