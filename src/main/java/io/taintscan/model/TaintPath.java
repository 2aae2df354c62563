package io.taintscan.model;

import io.taintscan.graph.BranchCondition;
import io.taintscan.graph.Node;

import java.util.List;
import java.util.OptionalInt;

/**
 * An ordered sequence of nodes from a path root to a sink, with the branch conditions of the
 * edges between them.
 *
 * @param nodes           Nodes from entry to sink
 * @param conditions      Condition of each traversed edge ({@code nodes.size() - 1} entries)
 * @param entryRegistered Whether the first node is a registered entry point
 * @param truncations     Back-edges skipped while building this path
 */
public record TaintPath(
        List<Node> nodes,
        List<BranchCondition> conditions,
        boolean entryRegistered,
        List<CycleTruncation> truncations
) {
    public TaintPath {
        if (nodes == null || nodes.isEmpty()) {
            throw new IllegalArgumentException("A path needs at least one node");
        }
        nodes = List.copyOf(nodes);
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        if (conditions.size() != nodes.size() - 1) {
            throw new IllegalArgumentException("Expected " + (nodes.size() - 1)
                    + " conditions for " + nodes.size() + " nodes, got " + conditions.size());
        }
        truncations = truncations == null ? List.of() : List.copyOf(truncations);
    }

    public Node entry() {
        return nodes.get(0);
    }

    public Node sink() {
        return nodes.get(nodes.size() - 1);
    }

    public List<String> nodeIds() {
        return nodes.stream().map(Node::id).toList();
    }

    /**
     * A path is live iff its entry is registered and every edge on it can be traversed.
     */
    public boolean isLive() {
        return entryRegistered && firstNeverEdge().isEmpty();
    }

    /**
     * Returns the index of the first statically never-taken edge; edge {@code i} connects
     * node {@code i} to node {@code i + 1}.
     */
    public OptionalInt firstNeverEdge() {
        for (int i = 0; i < conditions.size(); i++) {
            if (!conditions.get(i).isTraversable()) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    public boolean isTruncated() {
        return !truncations.isEmpty();
    }

    /**
     * Returns the number of edges on the path.
     */
    public int length() {
        return conditions.size();
    }

    /**
     * Returns a human-readable path, e.g. {@code "a -> b -[NEVER]-> c"}.
     */
    public String pathString() {
        StringBuilder sb = new StringBuilder(nodes.get(0).id());
        for (int i = 0; i < conditions.size(); i++) {
            BranchCondition condition = conditions.get(i);
            sb.append(condition == BranchCondition.ALWAYS ? " -> " : " -[" + condition + "]-> ");
            sb.append(nodes.get(i + 1).id());
        }
        return sb.toString();
    }
}
