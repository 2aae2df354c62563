package io.taintscan.graph;

import java.util.Locale;

/**
 * Static reachability of an edge, decided once by the front end that built the graph.
 */
public enum BranchCondition {
    /**
     * Unconditional traversal.
     */
    ALWAYS,

    /**
     * Statically never taken (e.g. guarded by a compile-time-constant false flag).
     * Everything reachable only through this edge is dead code.
     */
    NEVER,

    /**
     * Depends on values not known statically; treated as reachable.
     */
    RUNTIME;

    /**
     * Returns true if traversal through an edge with this condition can happen at runtime.
     */
    public boolean isTraversable() {
        return this != NEVER;
    }

    /**
     * Parses a condition name case-insensitively. A null or blank value means {@link #ALWAYS}.
     *
     * @throws IllegalArgumentException if the value names no condition
     */
    public static BranchCondition parse(String value) {
        if (value == null || value.isBlank()) {
            return ALWAYS;
        }
        return BranchCondition.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
