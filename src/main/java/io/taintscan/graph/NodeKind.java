package io.taintscan.graph;

import java.util.Locale;

/**
 * Structural kind of a node in the taint graph, as declared by the front end.
 */
public enum NodeKind {
    /**
     * A function reachable from outside the program (route handler, RPC method).
     */
    ENTRY_POINT,

    /**
     * An ordinary call site or callee.
     */
    CALL,

    /**
     * A branch point whose outgoing edges carry branch conditions.
     */
    BRANCH,

    /**
     * A dangerous operation such as raw query execution or template rendering.
     */
    SINK;

    /**
     * Parses a kind name case-insensitively, accepting {@code entryPoint}, {@code entry-point}
     * and {@code ENTRY_POINT} alike.
     *
     * @throws IllegalArgumentException if the value names no kind
     */
    public static NodeKind parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Node kind is missing");
        }
        String normalized = value.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace('-', '_')
                .toUpperCase(Locale.ROOT);
        return NodeKind.valueOf(normalized);
    }
}
