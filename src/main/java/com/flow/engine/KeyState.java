package com.flow.engine;

/**
 * Lifecycle of one (strike, side) key as seen by the engine.
 */
public enum KeyState {
    IDLE,
    WINDOW_OPEN,
    WINDOW_CLOSED,
    SCORED,
    EMITTED,
    SUPPRESSED
}
