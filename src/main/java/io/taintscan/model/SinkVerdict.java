package io.taintscan.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Aggregate verdict for one sink. A pure value: equal inputs give equal verdicts, whatever
 * order the paths were fed in.
 *
 * @param sinkId     Id of the sink
 * @param overall    Overall classification
 * @param reasons    Distinct live-path verdict kinds present, in verdict order;
 *                   {@code [DEAD]} when no live path exists, empty on error
 * @param pathCounts Number of paths per path verdict (every verdict present, zeros included)
 * @param rationale  Counts as prose, e.g. {@code "2 dead, 1 sanitized"}
 * @param confidence Trust in the evidence
 * @param error      Failure message when {@code overall} is {@link OverallVerdict#ERROR}, else null
 */
public record SinkVerdict(
        String sinkId,
        OverallVerdict overall,
        List<PathVerdict> reasons,
        Map<PathVerdict, Integer> pathCounts,
        String rationale,
        Confidence confidence,
        String error
) {
    public SinkVerdict {
        if (sinkId == null || sinkId.isBlank()) {
            throw new IllegalArgumentException("sinkId cannot be null or blank");
        }
        if (overall == null) {
            throw new IllegalArgumentException("overall cannot be null");
        }
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
        pathCounts = completeCounts(pathCounts);
    }

    private static Map<PathVerdict, Integer> completeCounts(Map<PathVerdict, Integer> counts) {
        Map<PathVerdict, Integer> complete = new EnumMap<>(PathVerdict.class);
        for (PathVerdict verdict : PathVerdict.values()) {
            Integer count = counts != null ? counts.get(verdict) : null;
            complete.put(verdict, count != null ? count : 0);
        }
        return Collections.unmodifiableMap(complete);
    }

    /**
     * Creates the verdict for a sink whose analysis failed.
     */
    public static SinkVerdict failed(String sinkId, String error) {
        return new SinkVerdict(sinkId, OverallVerdict.ERROR, List.of(), null,
                "analysis failed", Confidence.LOW, error);
    }

    public int totalPaths() {
        return pathCounts.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int countOf(PathVerdict verdict) {
        return pathCounts.get(verdict);
    }

    /**
     * Returns the display label, e.g. {@code "FALSE_POSITIVE / sanitized"}.
     */
    public String label() {
        if (reasons.isEmpty()) {
            return overall.name();
        }
        return overall.name() + " / " + reasons.stream()
                .map(PathVerdict::label)
                .collect(Collectors.joining(", "));
    }
}
