package io.taintscan.model;

/**
 * Aggregate classification of a sink over all paths that reach it.
 */
public enum OverallVerdict {
    /**
     * At least one live path is fully exploitable.
     */
    MUST_FIX,

    /**
     * The worst live path is only partially mitigated.
     */
    GOOD_TO_FIX,

    /**
     * Every live path is sanitized or behind an authorization gate.
     */
    FALSE_POSITIVE,

    /**
     * No live path reaches the sink.
     */
    DEAD_CODE,

    /**
     * The sink could not be analyzed; see the accompanying error.
     */
    ERROR;

    /**
     * Returns true if the sink requires a code change.
     */
    public boolean isActionable() {
        return this == MUST_FIX || this == GOOD_TO_FIX;
    }
}
