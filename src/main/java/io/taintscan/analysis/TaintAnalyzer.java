package io.taintscan.analysis;

import io.taintscan.config.ClassificationPolicy;
import io.taintscan.graph.Node;
import io.taintscan.graph.OrphanedSinkException;
import io.taintscan.graph.PathEnumerator;
import io.taintscan.graph.TaintGraph;
import io.taintscan.model.AnalysisWarning;
import io.taintscan.model.ClassificationReport;
import io.taintscan.model.EntryPointVerdict;
import io.taintscan.model.PathClassification;
import io.taintscan.model.SinkAnalysis;
import io.taintscan.model.SinkVerdict;
import io.taintscan.model.TaintPath;
import io.taintscan.report.ReportRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs the whole classification over a graph: node roles, then per sink path enumeration,
 * path verdicts and aggregation.
 * <p>
 * Sinks are independent, so each one is a separate task on a fixed pool. The graph and the
 * role table are immutable and every task builds its own results, so nothing is shared
 * between workers. A failure in one sink is confined to that sink's entry in the report.
 */
public class TaintAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(TaintAnalyzer.class);

    private final ClassificationPolicy policy;
    private final int workerThreads;
    private final Duration timeout;
    private final NodeClassifier classifier = new NodeClassifier();
    private final SinkAggregator aggregator;
    private final ReportRenderer renderer = new ReportRenderer();

    public TaintAnalyzer(ClassificationPolicy policy) {
        this(policy, Runtime.getRuntime().availableProcessors(), null);
    }

    /**
     * @param policy        classification policy
     * @param workerThreads upper bound on the pool size
     * @param timeout       budget for the whole run, or null for none
     */
    public TaintAnalyzer(ClassificationPolicy policy, int workerThreads, Duration timeout) {
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be positive: " + workerThreads);
        }
        this.policy = policy;
        this.workerThreads = workerThreads;
        this.timeout = timeout;
        this.aggregator = new SinkAggregator(policy);
    }

    /**
     * Classifies every in-scope sink of the graph.
     *
     * @throws OrphanedSinkException    if the graph has orphaned sinks and the policy says to fail
     * @throws AnalysisTimeoutException if the run exceeds its time budget
     */
    public ClassificationReport analyze(TaintGraph graph) {
        List<AnalysisWarning> warnings = new ArrayList<>();

        List<String> excluded = graph.orphanedSinks().stream().map(Node::id).toList();
        if (!excluded.isEmpty()) {
            if (policy.orphanedSinks() == ClassificationPolicy.OrphanHandling.FAIL) {
                throw new OrphanedSinkException(excluded);
            }
            for (String sinkId : excluded) {
                log.warn("Sink {} has no caller, excluding it", sinkId);
                warnings.add(AnalysisWarning.orphanedSink(sinkId));
            }
        }

        NodeRoles roles = classifier.classifyAll(graph);
        warnings.addAll(roles.warnings());

        List<Node> sinks = graph.inScopeSinks();
        log.info("Analyzing {} sink(s) in graph {} ({} nodes, {} edges)",
                sinks.size(), graph.name(), graph.nodeCount(), graph.edgeCount());

        List<SinkAnalysis> analyses = sinks.isEmpty() ? List.of() : runAll(graph, roles, sinks);
        for (SinkAnalysis analysis : analyses) {
            if (analysis.verdict().error() != null) {
                warnings.add(AnalysisWarning.sinkFailed(analysis.sinkId(), analysis.verdict().error()));
            }
        }

        List<EntryPointVerdict> entryPoints = aggregator.aggregateEntryPoints(graph, analyses);
        return renderer.render(graph, analyses, entryPoints, warnings, excluded);
    }

    /**
     * Classifies a single sink on the calling thread.
     */
    public SinkAnalysis analyzeSink(TaintGraph graph, String sinkId) {
        NodeRoles roles = classifier.classifyAll(graph);
        return analyzeSink(new PathEnumerator(graph), roles, graph.requireNode(sinkId));
    }

    private List<SinkAnalysis> runAll(TaintGraph graph, NodeRoles roles, List<Node> sinks) {
        PathEnumerator enumerator = new PathEnumerator(graph);
        List<Callable<SinkAnalysis>> tasks = new ArrayList<>();
        for (Node sink : sinks) {
            tasks.add(() -> analyzeSink(enumerator, roles, sink));
        }

        int poolSize = Math.min(sinks.size(), workerThreads);
        ExecutorService executor = Executors.newFixedThreadPool(poolSize);
        try {
            List<Future<SinkAnalysis>> futures = timeout == null
                    ? executor.invokeAll(tasks)
                    : executor.invokeAll(tasks, timeout.toMillis(), TimeUnit.MILLISECONDS);
            return collect(sinks, futures);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Classification was interrupted", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private List<SinkAnalysis> collect(List<Node> sinks, List<Future<SinkAnalysis>> futures)
            throws InterruptedException {
        long unfinished = futures.stream().filter(Future::isCancelled).count();
        if (unfinished > 0) {
            throw new AnalysisTimeoutException(timeout, (int) unfinished);
        }

        List<SinkAnalysis> results = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).get());
            } catch (ExecutionException | CancellationException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                results.add(failed(sinks.get(i), cause));
            }
        }
        return results;
    }

    private SinkAnalysis analyzeSink(PathEnumerator enumerator, NodeRoles roles, Node sink) {
        try {
            PathVerdictEngine engine = new PathVerdictEngine(roles, policy);
            List<PathClassification> paths = new ArrayList<>();
            for (TaintPath path : enumerator.enumeratePaths(sink.id())) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new IllegalStateException("Analysis of sink " + sink.id() + " was cancelled");
                }
                if (paths.size() >= policy.maxPathsPerSink()) {
                    throw new PathLimitExceededException(sink.id(), policy.maxPathsPerSink());
                }
                paths.add(engine.classify(path));
            }
            SinkVerdict verdict = aggregator.aggregate(sink.id(), paths);
            log.debug("Sink {}: {} ({})", sink.id(), verdict.label(), verdict.rationale());
            return new SinkAnalysis(sink, roles.sinkCategory(sink.id()), paths, verdict);
        } catch (RuntimeException e) {
            return failed(sink, e);
        }
    }

    private SinkAnalysis failed(Node sink, Throwable cause) {
        log.warn("Analysis of sink {} failed: {}", sink.id(), cause.getMessage());
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new SinkAnalysis(sink, classifier.sinkCategory(sink), List.of(), SinkVerdict.failed(sink.id(), message));
    }
}
