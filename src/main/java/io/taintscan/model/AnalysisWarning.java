package io.taintscan.model;

/**
 * A non-fatal problem found during analysis, carried into the report.
 *
 * @param code    Stable machine-readable code
 * @param nodeId  Node concerned, or null
 * @param sinkId  Sink concerned, or null
 * @param message Human-readable description
 */
public record AnalysisWarning(
        String code,
        String nodeId,
        String sinkId,
        String message
) {
    public static final String UNCLASSIFIABLE_ROLE = "UNCLASSIFIABLE_ROLE";
    public static final String ORPHANED_SINK = "ORPHANED_SINK";
    public static final String SINK_FAILED = "SINK_FAILED";

    public static AnalysisWarning unclassifiableRole(String nodeId, String message) {
        return new AnalysisWarning(UNCLASSIFIABLE_ROLE, nodeId, null, message);
    }

    public static AnalysisWarning orphanedSink(String sinkId) {
        return new AnalysisWarning(ORPHANED_SINK, sinkId, sinkId,
                "Sink " + sinkId + " is not reachable from any node and was excluded");
    }

    public static AnalysisWarning sinkFailed(String sinkId, String message) {
        return new AnalysisWarning(SINK_FAILED, null, sinkId, message);
    }

    /**
     * Returns a one-line display form, e.g. {@code "[UNCLASSIFIABLE_ROLE] n1: ..."}.
     */
    public String formatted() {
        String subject = nodeId != null ? nodeId : sinkId;
        return "[" + code + "] " + (subject != null ? subject + ": " : "") + message;
    }
}
