package io.taintscan.graph;

/**
 * A structural defect in the input graph. Fatal: the run is aborted and the offending
 * node or edge id is surfaced to the caller.
 */
public class StructuralGraphException extends RuntimeException {

    private final String offendingId;

    public StructuralGraphException(String message, String offendingId) {
        super(message);
        this.offendingId = offendingId;
    }

    /**
     * Returns the id of the node (or the formatted edge) that caused the failure.
     */
    public String offendingId() {
        return offendingId;
    }
}
