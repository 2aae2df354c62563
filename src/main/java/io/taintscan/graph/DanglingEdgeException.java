package io.taintscan.graph;

/**
 * Thrown when an edge references a node id that was never declared.
 */
public class DanglingEdgeException extends StructuralGraphException {

    private final String missingNodeId;

    public DanglingEdgeException(Edge edge, String missingNodeId) {
        super("Edge " + edge.formatted() + " references unknown node: " + missingNodeId, edge.formatted());
        this.missingNodeId = missingNodeId;
    }

    public String missingNodeId() {
        return missingNodeId;
    }
}
