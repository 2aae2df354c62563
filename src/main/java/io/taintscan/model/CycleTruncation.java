package io.taintscan.model;

/**
 * A back-edge that path enumeration declined to follow because its target was already on
 * the path. Recorded as evidence on every path that passes through {@code fromNodeId}.
 *
 * @param fromNodeId Node owning the back-edge
 * @param toNodeId   Node already on the path
 */
public record CycleTruncation(
        String fromNodeId,
        String toNodeId
) {
    public String formatted() {
        return "revisit of " + toNodeId + " from " + fromNodeId + " skipped";
    }
}
