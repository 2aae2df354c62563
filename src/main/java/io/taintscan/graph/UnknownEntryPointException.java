package io.taintscan.graph;

/**
 * Thrown when registration names an id that is unknown or not an entry point.
 */
public class UnknownEntryPointException extends StructuralGraphException {

    public UnknownEntryPointException(String nodeId, String reason) {
        super("Cannot register entry point '" + nodeId + "': " + reason, nodeId);
    }
}
