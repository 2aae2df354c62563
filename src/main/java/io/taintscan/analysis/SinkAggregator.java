package io.taintscan.analysis;

import io.taintscan.config.ClassificationPolicy;
import io.taintscan.graph.Node;
import io.taintscan.graph.TaintGraph;
import io.taintscan.model.Confidence;
import io.taintscan.model.EntryPointVerdict;
import io.taintscan.model.OverallVerdict;
import io.taintscan.model.PathClassification;
import io.taintscan.model.PathVerdict;
import io.taintscan.model.SinkAnalysis;
import io.taintscan.model.SinkVerdict;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Combines all path verdicts of one sink: the worst live path dominates.
 * <ul>
 *   <li>no live path: {@link OverallVerdict#DEAD_CODE}</li>
 *   <li>any live path vulnerable: {@link OverallVerdict#MUST_FIX}</li>
 *   <li>any live path partially mitigated: {@link OverallVerdict#GOOD_TO_FIX}</li>
 *   <li>all live paths sanitized or auth-protected: {@link OverallVerdict#FALSE_POSITIVE}</li>
 * </ul>
 * Only counts and sets of the inputs are used, so the result is independent of input order.
 */
public class SinkAggregator {

    private final ClassificationPolicy policy;

    public SinkAggregator(ClassificationPolicy policy) {
        this.policy = policy;
    }

    /**
     * Aggregates classified paths, taking truncation evidence into account for confidence.
     */
    public SinkVerdict aggregate(String sinkId, Collection<PathClassification> paths) {
        Map<PathVerdict, Integer> counts = new EnumMap<>(PathVerdict.class);
        boolean truncated = false;
        for (PathClassification path : paths) {
            counts.merge(path.verdict(), 1, Integer::sum);
            truncated |= path.path().isTruncated();
        }
        return aggregate(sinkId, counts, truncated);
    }

    /**
     * Aggregates bare path verdicts.
     */
    public SinkVerdict aggregateVerdicts(String sinkId, Collection<PathVerdict> verdicts) {
        Map<PathVerdict, Integer> counts = new EnumMap<>(PathVerdict.class);
        for (PathVerdict verdict : verdicts) {
            counts.merge(verdict, 1, Integer::sum);
        }
        return aggregate(sinkId, counts, false);
    }

    /**
     * Rolls the classified paths of all sinks up per path root, using the same worst-live-path
     * rule. Roots that reach no sink are omitted.
     */
    public List<EntryPointVerdict> aggregateEntryPoints(TaintGraph graph, List<SinkAnalysis> sinks) {
        Map<String, List<PathClassification>> byRoot = new HashMap<>();
        Map<String, Set<String>> sinksByRoot = new HashMap<>();
        for (SinkAnalysis sink : sinks) {
            for (PathClassification path : sink.paths()) {
                String rootId = path.path().entry().id();
                byRoot.computeIfAbsent(rootId, k -> new ArrayList<>()).add(path);
                sinksByRoot.computeIfAbsent(rootId, k -> new LinkedHashSet<>()).add(sink.sinkId());
            }
        }

        List<EntryPointVerdict> result = new ArrayList<>();
        for (Node root : graph.pathRoots()) {
            List<PathClassification> paths = byRoot.get(root.id());
            if (paths == null) {
                continue;
            }
            SinkVerdict rolled = aggregate(root.id(), paths);
            result.add(new EntryPointVerdict(
                    root.id(),
                    graph.isRegistered(root.id()),
                    List.copyOf(sinksByRoot.get(root.id())),
                    rolled.overall(),
                    rolled.reasons(),
                    rolled.rationale()
            ));
        }
        return result;
    }

    private SinkVerdict aggregate(String sinkId, Map<PathVerdict, Integer> counts, boolean truncated) {
        Set<PathVerdict> live = EnumSet.noneOf(PathVerdict.class);
        counts.keySet().stream()
                .filter(PathVerdict::isLive)
                .forEach(live::add);

        OverallVerdict overall = overallOf(live);
        List<PathVerdict> reasons = live.isEmpty() ? List.of(PathVerdict.DEAD) : List.copyOf(live);

        int total = counts.values().stream().mapToInt(Integer::intValue).sum();
        Confidence confidence;
        if (truncated) {
            confidence = Confidence.LOW;
        } else if (live.size() > 1 || total == 0) {
            confidence = Confidence.MEDIUM;
        } else {
            confidence = Confidence.HIGH;
        }

        return new SinkVerdict(sinkId, overall, reasons, counts, rationale(counts, total), confidence, null);
    }

    private OverallVerdict overallOf(Set<PathVerdict> live) {
        if (live.isEmpty()) {
            return OverallVerdict.DEAD_CODE;
        }
        if (live.contains(PathVerdict.VULNERABLE)) {
            return OverallVerdict.MUST_FIX;
        }
        if (live.contains(PathVerdict.PARTIALLY_MITIGATED)) {
            return OverallVerdict.GOOD_TO_FIX;
        }
        if (live.contains(PathVerdict.AUTH_PROTECTED) && !policy.authGateIsBenign()) {
            return OverallVerdict.GOOD_TO_FIX;
        }
        return OverallVerdict.FALSE_POSITIVE;
    }

    /**
     * Renders the counts as prose in verdict order, e.g. {@code "2 dead, 1 sanitized"}.
     */
    private String rationale(Map<PathVerdict, Integer> counts, int total) {
        if (total == 0) {
            return "no paths";
        }
        List<String> parts = new ArrayList<>();
        for (PathVerdict verdict : PathVerdict.values()) {
            int count = counts.getOrDefault(verdict, 0);
            if (count > 0) {
                parts.add(count + " " + verdict.label());
            }
        }
        return String.join(", ", parts);
    }
}
