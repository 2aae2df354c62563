package io.taintscan.graph;

import java.util.List;

/**
 * Thrown when a sink has no incoming edge from any other node and the policy
 * treats orphans as fatal.
 */
public class OrphanedSinkException extends StructuralGraphException {

    private final List<String> sinkIds;

    public OrphanedSinkException(List<String> sinkIds) {
        super("Sink(s) not reachable from any node: " + String.join(", ", sinkIds), sinkIds.get(0));
        this.sinkIds = List.copyOf(sinkIds);
    }

    public List<String> sinkIds() {
        return sinkIds;
    }
}
