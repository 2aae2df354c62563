package io.taintscan.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.taintscan.graph.BranchCondition;
import io.taintscan.model.AnalysisWarning;
import io.taintscan.model.ClassificationReport;
import io.taintscan.model.EntryPointVerdict;
import io.taintscan.model.OverallVerdict;
import io.taintscan.model.PathClassification;
import io.taintscan.model.PathVerdict;
import io.taintscan.model.SinkAnalysis;
import io.taintscan.model.SinkVerdict;

import java.io.IOException;
import java.io.Writer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Formats classification results as JSON for machine processing.
 */
public class JsonReporter implements Reporter {

    private final ObjectMapper mapper;
    private final boolean prettyPrint;

    public JsonReporter() {
        this(true);
    }

    public JsonReporter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
        this.mapper = createMapper();
    }

    private ObjectMapper createMapper() {
        ObjectMapper m = new ObjectMapper();
        m.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        if (prettyPrint) {
            m.enable(SerializationFeature.INDENT_OUTPUT);
        }
        return m;
    }

    @Override
    public String format() {
        return "json";
    }

    @Override
    public void write(ClassificationReport report, Writer writer) throws IOException {
        mapper.writeValue(writer, toJsonReport(report));
    }

    /**
     * Converts the report to its serialized shape.
     */
    public JsonReport toJsonReport(ClassificationReport report) {
        ClassificationReport.Summary summary = report.summary();

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (OverallVerdict verdict : OverallVerdict.values()) {
            counts.put(verdict.name(), summary.countOf(verdict));
        }

        return new JsonReport(
                new JsonReport.Metadata(report.graphName(), report.nodeCount(), report.edgeCount()),
                report.sinks().stream().map(this::toJsonSink).toList(),
                report.entryPoints().stream().map(this::toJsonEntryPoint).toList(),
                new JsonReport.Summary(
                        summary.totalSinks(),
                        counts,
                        summary.totalPaths(),
                        pathCounts(summary.pathCounts())
                ),
                report.warnings().stream().map(this::toJsonWarning).toList(),
                report.excludedSinks()
        );
    }

    private JsonReport.Sink toJsonSink(SinkAnalysis analysis) {
        SinkVerdict verdict = analysis.verdict();
        return new JsonReport.Sink(
                analysis.sinkId(),
                analysis.sink().label(),
                analysis.category() != null ? analysis.category().name() : null,
                verdict.overall().name(),
                verdict.label(),
                verdict.reasons().stream().map(PathVerdict::name).toList(),
                verdict.rationale(),
                verdict.confidence().name(),
                verdict.error(),
                pathCounts(verdict.pathCounts()),
                analysis.paths().stream().map(this::toJsonPath).toList()
        );
    }

    private JsonReport.Path toJsonPath(PathClassification classification) {
        return new JsonReport.Path(
                classification.path().nodeIds(),
                classification.path().conditions().stream().map(BranchCondition::name).toList(),
                classification.verdict().name(),
                classification.verdict().isLive(),
                classification.authGateSeen(),
                classification.protectedBy(),
                classification.evidence()
        );
    }

    private JsonReport.EntryPoint toJsonEntryPoint(EntryPointVerdict entry) {
        return new JsonReport.EntryPoint(
                entry.entryId(),
                entry.registered(),
                entry.sinkIds(),
                entry.overall().name(),
                entry.reasons().stream().map(PathVerdict::name).toList(),
                entry.rationale()
        );
    }

    private JsonReport.Warning toJsonWarning(AnalysisWarning warning) {
        return new JsonReport.Warning(warning.code(), warning.nodeId(), warning.sinkId(), warning.message());
    }

    private static Map<String, Integer> pathCounts(Map<PathVerdict, Integer> counts) {
        Map<String, Integer> result = new LinkedHashMap<>();
        for (PathVerdict verdict : PathVerdict.values()) {
            result.put(verdict.name(), counts.getOrDefault(verdict, 0));
        }
        return result;
    }

    /**
     * JSON structure for the report.
     */
    public record JsonReport(
            Metadata metadata,
            List<Sink> sinks,
            List<EntryPoint> entryPoints,
            Summary summary,
            List<Warning> warnings,
            List<String> excludedSinks
    ) {
        public record Metadata(
                String graphName,
                int nodeCount,
                int edgeCount
        ) {}

        public record Sink(
                String sinkId,
                String label,
                String category,
                String overallVerdict,
                String verdictLabel,
                List<String> reasons,
                String rationale,
                String confidence,
                String error,
                Map<String, Integer> pathCounts,
                List<Path> paths
        ) {}

        public record Path(
                List<String> nodes,
                List<String> conditions,
                String verdict,
                boolean live,
                boolean authGateSeen,
                String protectedBy,
                List<String> evidence
        ) {}

        public record EntryPoint(
                String entryId,
                boolean registered,
                List<String> sinks,
                String overallVerdict,
                List<String> reasons,
                String rationale
        ) {}

        public record Summary(
                int totalSinks,
                Map<String, Integer> counts,
                int totalPaths,
                Map<String, Integer> pathCounts
        ) {}

        public record Warning(
                String code,
                String nodeId,
                String sinkId,
                String message
        ) {}
    }
}
