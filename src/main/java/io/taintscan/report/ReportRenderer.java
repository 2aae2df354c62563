package io.taintscan.report;

import io.taintscan.graph.Node;
import io.taintscan.graph.TaintGraph;
import io.taintscan.model.AnalysisWarning;
import io.taintscan.model.ClassificationReport;
import io.taintscan.model.EntryPointVerdict;
import io.taintscan.model.SinkAnalysis;
import io.taintscan.model.SinkCategory;
import io.taintscan.model.SinkVerdict;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles sink analyses into a {@link ClassificationReport}.
 * <p>
 * Sinks are ordered by declaration in the graph regardless of the order analyses finished in.
 * Every in-scope sink appears exactly once; one with no analysis gets an error entry.
 */
public class ReportRenderer {

    public ClassificationReport render(TaintGraph graph, List<SinkAnalysis> analyses) {
        return render(graph, analyses, List.of(), List.of(), List.of());
    }

    public ClassificationReport render(
            TaintGraph graph,
            List<SinkAnalysis> analyses,
            List<EntryPointVerdict> entryPoints,
            List<AnalysisWarning> warnings,
            List<String> excludedSinks
    ) {
        Map<String, SinkAnalysis> bySink = new HashMap<>();
        for (SinkAnalysis analysis : analyses) {
            if (bySink.putIfAbsent(analysis.sinkId(), analysis) != null) {
                throw new IllegalArgumentException("Sink " + analysis.sinkId() + " analyzed more than once");
            }
        }

        List<SinkAnalysis> ordered = new ArrayList<>();
        for (Node sink : graph.inScopeSinks()) {
            SinkAnalysis analysis = bySink.remove(sink.id());
            if (analysis == null) {
                analysis = new SinkAnalysis(sink, SinkCategory.OTHER, List.of(),
                        SinkVerdict.failed(sink.id(), "no result for sink"));
            }
            ordered.add(analysis);
        }
        if (!bySink.isEmpty()) {
            throw new IllegalArgumentException("Analyses for sinks not in scope: " + bySink.keySet());
        }

        return new ClassificationReport(
                graph.name(),
                graph.nodeCount(),
                graph.edgeCount(),
                ordered,
                entryPoints,
                null,
                warnings,
                excludedSinks
        );
    }
}
