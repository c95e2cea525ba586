package com.flow.comparison;

/**
 * Which of the two algorithms signalled a window.
 */
public enum Agreement {
    BOTH,
    PRIMARY_ONLY,
    REFERENCE_ONLY,
    NEITHER;

    static Agreement of(boolean primary, boolean reference) {
        if (primary && reference) return BOTH;
        if (primary) return PRIMARY_ONLY;
        if (reference) return REFERENCE_ONLY;
        return NEITHER;
    }
}
