package io.taintscan.graph;

/**
 * Thrown when two nodes are declared with the same id.
 */
public class DuplicateNodeException extends StructuralGraphException {

    public DuplicateNodeException(String nodeId) {
        super("Duplicate node id: " + nodeId, nodeId);
    }
}
