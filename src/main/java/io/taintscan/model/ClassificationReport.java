package io.taintscan.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Complete result of one classification run. Deterministic for a given graph and policy:
 * sinks appear in declaration order and nothing time-dependent is recorded.
 *
 * @param graphName     Name of the analyzed graph (may be null)
 * @param nodeCount     Number of nodes in the graph
 * @param edgeCount     Number of edges in the graph
 * @param sinks         One entry per in-scope sink, in declaration order
 * @param entryPoints   Per-root roll-up of the same paths, in declaration order
 * @param summary       Counts over all sinks and paths
 * @param warnings      Non-fatal problems, in discovery order
 * @param excludedSinks Ids of orphaned sinks left out of scope
 */
public record ClassificationReport(
        String graphName,
        int nodeCount,
        int edgeCount,
        List<SinkAnalysis> sinks,
        List<EntryPointVerdict> entryPoints,
        Summary summary,
        List<AnalysisWarning> warnings,
        List<String> excludedSinks
) {
    /**
     * Summary counts.
     *
     * @param totalSinks    Number of sinks in the report
     * @param verdictCounts Sinks per overall verdict (every verdict present, zeros included)
     * @param totalPaths    Number of paths across all sinks
     * @param pathCounts    Paths per path verdict (every verdict present, zeros included)
     */
    public record Summary(
            int totalSinks,
            Map<OverallVerdict, Integer> verdictCounts,
            int totalPaths,
            Map<PathVerdict, Integer> pathCounts
    ) {
        public Summary {
            verdictCounts = Collections.unmodifiableMap(new EnumMap<>(verdictCounts));
            pathCounts = Collections.unmodifiableMap(new EnumMap<>(pathCounts));
        }

        /**
         * Computes the summary of the given sink analyses.
         */
        public static Summary of(List<SinkAnalysis> sinks) {
            Map<OverallVerdict, Integer> verdictCounts = new EnumMap<>(OverallVerdict.class);
            for (OverallVerdict verdict : OverallVerdict.values()) {
                verdictCounts.put(verdict, 0);
            }
            Map<PathVerdict, Integer> pathCounts = new EnumMap<>(PathVerdict.class);
            for (PathVerdict verdict : PathVerdict.values()) {
                pathCounts.put(verdict, 0);
            }

            int totalPaths = 0;
            for (SinkAnalysis sink : sinks) {
                verdictCounts.merge(sink.overall(), 1, Integer::sum);
                for (PathClassification path : sink.paths()) {
                    pathCounts.merge(path.verdict(), 1, Integer::sum);
                    totalPaths++;
                }
            }
            return new Summary(sinks.size(), verdictCounts, totalPaths, pathCounts);
        }

        public int countOf(OverallVerdict verdict) {
            return verdictCounts.getOrDefault(verdict, 0);
        }
    }

    public ClassificationReport {
        sinks = sinks == null ? List.of() : List.copyOf(sinks);
        entryPoints = entryPoints == null ? List.of() : List.copyOf(entryPoints);
        if (summary == null) {
            summary = Summary.of(sinks);
        }
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        excludedSinks = excludedSinks == null ? List.of() : List.copyOf(excludedSinks);
    }

    /**
     * Returns the analysis of the given sink, or empty if it is not in the report.
     */
    public Optional<SinkAnalysis> sink(String sinkId) {
        return sinks.stream()
                .filter(s -> s.sinkId().equals(sinkId))
                .findFirst();
    }

    /**
     * Returns true if any sink needs a code change.
     */
    public boolean hasActionableSinks() {
        return sinks.stream().anyMatch(s -> s.overall().isActionable());
    }

    /**
     * Returns true if any sink failed to be analyzed.
     */
    public boolean hasFailedSinks() {
        return sinks.stream().anyMatch(s -> s.overall() == OverallVerdict.ERROR);
    }
}
