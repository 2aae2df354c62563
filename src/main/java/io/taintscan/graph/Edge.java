package io.taintscan.graph;

/**
 * A directed edge from caller to callee, or from a branch to one of its targets.
 *
 * @param from      Id of the source node
 * @param to        Id of the target node
 * @param condition Static reachability of this edge
 */
public record Edge(
        String from,
        String to,
        BranchCondition condition
) {
    public Edge {
        if (from == null || from.isBlank()) {
            throw new IllegalArgumentException("Edge source cannot be null or blank");
        }
        if (to == null || to.isBlank()) {
            throw new IllegalArgumentException("Edge target cannot be null or blank");
        }
        if (condition == null) {
            condition = BranchCondition.ALWAYS;
        }
    }

    /**
     * Returns true if this edge connects a node to itself.
     */
    public boolean isSelfLoop() {
        return from.equals(to);
    }

    /**
     * Formats the edge for display, e.g. {@code "a -> b [NEVER]"}.
     */
    public String formatted() {
        return from + " -> " + to + " [" + condition + "]";
    }
}
