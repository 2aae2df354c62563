package io.taintscan.model;

/**
 * How much the evidence behind a sink verdict can be trusted.
 */
public enum Confidence {
    /**
     * All live paths agree and no path was truncated.
     */
    HIGH,

    /**
     * Live paths disagree, or the sink has no path at all.
     */
    MEDIUM,

    /**
     * At least one path was truncated at a cycle, so the evidence is incomplete.
     */
    LOW
}
