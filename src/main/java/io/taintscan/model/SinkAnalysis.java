package io.taintscan.model;

import io.taintscan.graph.Node;

import java.util.List;

/**
 * Everything computed for one sink: its classified paths and their aggregate.
 *
 * @param sink     The sink node
 * @param category Vulnerability category declared on the sink
 * @param paths    Classified paths in enumeration order (empty on error)
 * @param verdict  Aggregate verdict
 */
public record SinkAnalysis(
        Node sink,
        SinkCategory category,
        List<PathClassification> paths,
        SinkVerdict verdict
) {
    public SinkAnalysis {
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        if (verdict == null) {
            throw new IllegalArgumentException("verdict cannot be null");
        }
        paths = paths == null ? List.of() : List.copyOf(paths);
    }

    public String sinkId() {
        return sink.id();
    }

    public OverallVerdict overall() {
        return verdict.overall();
    }
}
