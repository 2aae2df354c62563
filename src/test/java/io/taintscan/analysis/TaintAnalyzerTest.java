package io.taintscan.analysis;

import io.taintscan.config.ClassificationPolicy;
import io.taintscan.graph.BranchCondition;
import io.taintscan.graph.Node;
import io.taintscan.graph.NodeKind;
import io.taintscan.graph.OrphanedSinkException;
import io.taintscan.graph.TaintGraph;
import io.taintscan.model.AnalysisWarning;
import io.taintscan.model.ClassificationReport;
import io.taintscan.model.EntryPointVerdict;
import io.taintscan.model.OverallVerdict;
import io.taintscan.model.PathClassification;
import io.taintscan.model.PathVerdict;
import io.taintscan.model.SinkAnalysis;
import io.taintscan.model.SinkCategory;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaintAnalyzerTest {

    private final TaintAnalyzer analyzer = new TaintAnalyzer(ClassificationPolicy.defaults(), 2, null);

    @Test
    void analyze_unprotectedLivePathMustBeFixed() {
        TaintGraph graph = TaintGraph.builder()
                .addNode(entry("search"))
                .addNode(sink("execute"))
                .addEdge("search", "execute")
                .markEntryRegistered("search")
                .build();

        SinkAnalysis sink = analyze(graph, "execute");

        assertThat(sink.overall()).isEqualTo(OverallVerdict.MUST_FIX);
        assertThat(sink.paths()).extracting(PathClassification::verdict).containsExactly(PathVerdict.VULNERABLE);
    }

    @Test
    void analyze_strictValidatorIsFalsePositive() {
        TaintGraph graph = TaintGraph.builder()
                .addNode(entry("profile"))
                .addNode(validator("is_numeric_id", "strict"))
                .addNode(sink("execute"))
                .addEdge("profile", "is_numeric_id")
                .addEdge("is_numeric_id", "execute")
                .markEntryRegistered("profile")
                .build();

        SinkAnalysis sink = analyze(graph, "execute");

        assertThat(sink.overall()).isEqualTo(OverallVerdict.FALSE_POSITIVE);
        assertThat(sink.verdict().label()).isEqualTo("FALSE_POSITIVE / sanitized");
    }

    @Test
    void analyze_weakValidatorIsGoodToFix() {
        TaintGraph graph = TaintGraph.builder()
                .addNode(entry("render"))
                .addNode(validator("blocks_dunder", "weak"))
                .addNode(sink("render_template_string"))
                .addEdge("render", "blocks_dunder")
                .addEdge("blocks_dunder", "render_template_string")
                .markEntryRegistered("render")
                .build();

        SinkAnalysis sink = analyze(graph, "render_template_string");

        assertThat(sink.overall()).isEqualTo(OverallVerdict.GOOD_TO_FIX);
        assertThat(sink.verdict().reasons()).containsExactly(PathVerdict.PARTIALLY_MITIGATED);
    }

    @Test
    void analyze_twoDeadAndOneSanitizedPathIsFalsePositive() {
        TaintGraph graph = TaintGraph.builder()
                .addNode(entry("route"))
                .addNode(Node.of("legacy_flag", NodeKind.BRANCH))
                .addNode(Node.of("legacy_query", NodeKind.CALL))
                .addNode(validator("allowlist", "strict"))
                .addNode(Node.of("debug_flag", NodeKind.BRANCH))
                .addNode(Node.of("debug_query", NodeKind.CALL))
                .addNode(sink("execute"))
                .addEdge("route", "legacy_flag")
                .addEdge("route", "allowlist")
                .addEdge("route", "debug_flag")
                .addEdge("legacy_flag", "legacy_query", BranchCondition.NEVER)
                .addEdge("legacy_query", "execute")
                .addEdge("allowlist", "execute")
                .addEdge("debug_flag", "debug_query", BranchCondition.NEVER)
                .addEdge("debug_query", "execute")
                .markEntryRegistered("route")
                .build();

        SinkAnalysis sink = analyze(graph, "execute");

        assertThat(sink.paths()).extracting(PathClassification::verdict)
                .containsExactly(PathVerdict.DEAD, PathVerdict.SANITIZED, PathVerdict.DEAD);
        assertThat(sink.overall()).isEqualTo(OverallVerdict.FALSE_POSITIVE);
        assertThat(sink.verdict().label()).isEqualTo("FALSE_POSITIVE / sanitized");
        assertThat(sink.verdict().rationale()).isEqualTo("2 dead, 1 sanitized");
        assertThat(sink.paths().get(0).evidence())
                .containsExactly("edge legacy_flag -> legacy_query is never taken");
    }

    @Test
    void analyze_sinkWithOnlyNeverPathsIsDeadCode() {
        TaintGraph graph = TaintGraph.builder()
                .addNode(entry("route"))
                .addNode(Node.of("helper", NodeKind.CALL))
                .addNode(sink("execute"))
                .addEdge("route", "execute", BranchCondition.NEVER)
                .addEdge("route", "helper")
                .addEdge("helper", "execute", BranchCondition.NEVER)
                .markEntryRegistered("route")
                .build();

        SinkAnalysis sink = analyze(graph, "execute");

        assertThat(sink.paths()).hasSize(2).allMatch(p -> p.verdict() == PathVerdict.DEAD);
        assertThat(sink.overall()).isEqualTo(OverallVerdict.DEAD_CODE);
    }

    @Test
    void analyze_unregisteredEntryContributesOnlyDeadPaths() {
        TaintGraph graph = TaintGraph.builder()
                .addNode(entry("internal_diagnostic"))
                .addNode(role("admin_required", "authz-gate"))
                .addNode(sink("execute"))
                .addEdge("internal_diagnostic", "admin_required")
                .addEdge("admin_required", "execute")
                .addEdge("internal_diagnostic", "execute", BranchCondition.RUNTIME)
                .build();

        SinkAnalysis sink = analyze(graph, "execute");

        assertThat(sink.paths()).hasSize(2).allMatch(p -> p.verdict() == PathVerdict.DEAD);
        assertThat(sink.overall()).isEqualTo(OverallVerdict.DEAD_CODE);
        assertThat(sink.paths().get(0).deadReason()).isEqualTo("entry point internal_diagnostic is not registered");
    }

    @Test
    void analyze_listsSinksInDeclarationOrderWhateverTheThreadCount() {
        TaintGraph graph = multiSinkGraph();

        ClassificationReport serial = new TaintAnalyzer(ClassificationPolicy.defaults(), 1, null).analyze(graph);
        ClassificationReport parallel = new TaintAnalyzer(ClassificationPolicy.defaults(), 8, null).analyze(graph);

        assertThat(serial.sinks()).extracting(SinkAnalysis::sinkId).containsExactly("orders_query", "audit_query", "page");
        assertThat(parallel).isEqualTo(serial);
        assertThat(serial.summary().totalSinks()).isEqualTo(3);
        assertThat(serial.summary().countOf(OverallVerdict.MUST_FIX)).isEqualTo(1);
        assertThat(serial.summary().countOf(OverallVerdict.FALSE_POSITIVE)).isEqualTo(2);
        assertThat(serial.summary().countOf(OverallVerdict.DEAD_CODE)).isZero();
    }

    @Test
    void analyze_rollsUpVerdictsPerEntryPoint() {
        ClassificationReport report = analyzer.analyze(multiSinkGraph());

        assertThat(report.entryPoints()).extracting(EntryPointVerdict::entryId).containsExactly("orders", "admin");
        EntryPointVerdict orders = report.entryPoints().get(0);
        assertThat(orders.sinkIds()).containsExactly("orders_query", "page");
        assertThat(orders.overall()).isEqualTo(OverallVerdict.MUST_FIX);
        assertThat(orders.registered()).isTrue();
        assertThat(report.entryPoints().get(1).overall()).isEqualTo(OverallVerdict.FALSE_POSITIVE);
    }

    @Test
    void analyze_isolatesFailureToOneSink() {
        TaintGraph graph = TaintGraph.builder()
                .addNode(entry("route"))
                .addNode(Node.of("a", NodeKind.CALL))
                .addNode(Node.of("b", NodeKind.CALL))
                .addNode(sink("busy"))
                .addNode(sink("simple"))
                .addEdge("route", "a")
                .addEdge("route", "b")
                .addEdge("a", "busy")
                .addEdge("b", "busy")
                .addEdge("route", "simple")
                .markEntryRegistered("route")
                .build();
        ClassificationPolicy policy = ClassificationPolicy.builder().maxPathsPerSink(1).build();

        ClassificationReport report = new TaintAnalyzer(policy, 2, null).analyze(graph);

        SinkAnalysis busy = report.sink("busy").orElseThrow();
        assertThat(busy.overall()).isEqualTo(OverallVerdict.ERROR);
        assertThat(busy.verdict().error()).contains("more than 1 paths");
        assertThat(busy.category()).isEqualTo(SinkCategory.SQL);
        assertThat(report.sink("simple").orElseThrow().overall()).isEqualTo(OverallVerdict.MUST_FIX);
        assertThat(report.hasFailedSinks()).isTrue();
        assertThat(report.warnings()).extracting(AnalysisWarning::code).containsExactly(AnalysisWarning.SINK_FAILED);
    }

    @Test
    void analyze_excludesOrphanedSinksByDefault() {
        TaintGraph graph = TaintGraph.builder()
                .addNode(entry("route"))
                .addNode(sink("execute"))
                .addNode(sink("unused_query"))
                .addEdge("route", "execute")
                .markEntryRegistered("route")
                .build();

        ClassificationReport report = analyzer.analyze(graph);

        assertThat(report.sinks()).extracting(SinkAnalysis::sinkId).containsExactly("execute");
        assertThat(report.excludedSinks()).containsExactly("unused_query");
        assertThat(report.warnings()).extracting(AnalysisWarning::code).containsExactly(AnalysisWarning.ORPHANED_SINK);
    }

    @Test
    void analyze_failsOnOrphanedSinksWhenConfigured() {
        TaintGraph graph = TaintGraph.builder()
                .addNode(entry("route"))
                .addNode(sink("unused_query"))
                .build();
        ClassificationPolicy policy = ClassificationPolicy.builder()
                .orphanedSinks(ClassificationPolicy.OrphanHandling.FAIL)
                .build();

        assertThatThrownBy(() -> new TaintAnalyzer(policy).analyze(graph))
                .isInstanceOf(OrphanedSinkException.class)
                .satisfies(e -> assertThat(((OrphanedSinkException) e).sinkIds()).containsExactly("unused_query"));
    }

    @Test
    void analyze_reportsUnclassifiableTagsAndTreatsThemAsUnprotected() {
        TaintGraph graph = TaintGraph.builder()
                .addNode(entry("route"))
                .addNode(role("validated_query", "magic-sanitizer"))
                .addNode(sink("execute"))
                .addEdge("route", "validated_query")
                .addEdge("validated_query", "execute")
                .markEntryRegistered("route")
                .build();

        ClassificationReport report = analyzer.analyze(graph);

        assertThat(report.sink("execute").orElseThrow().overall()).isEqualTo(OverallVerdict.MUST_FIX);
        assertThat(report.warnings()).singleElement()
                .satisfies(w -> assertThat(w.code()).isEqualTo(AnalysisWarning.UNCLASSIFIABLE_ROLE));
    }

    @Test
    void analyze_graphWithoutSinks() {
        TaintGraph graph = TaintGraph.builder()
                .addNode(entry("health"))
                .markEntryRegistered("health")
                .build();

        ClassificationReport report = analyzer.analyze(graph);

        assertThat(report.sinks()).isEmpty();
        assertThat(report.summary().totalSinks()).isZero();
        assertThat(report.summary().verdictCounts()).hasSize(OverallVerdict.values().length);
    }

    @Test
    void analyze_timesOut() {
        TaintGraph.Builder builder = TaintGraph.builder()
                .addNode(entry("route"))
                .addNode(sink("execute"))
                .markEntryRegistered("route");
        String previous = "route";
        for (int i = 0; i < 24; i++) {
            builder.addNode(Node.of("up" + i, NodeKind.CALL))
                    .addNode(Node.of("down" + i, NodeKind.CALL))
                    .addNode(Node.of("join" + i, NodeKind.CALL))
                    .addEdge(previous, "up" + i)
                    .addEdge(previous, "down" + i)
                    .addEdge("up" + i, "join" + i)
                    .addEdge("down" + i, "join" + i);
            previous = "join" + i;
        }
        builder.addEdge(previous, "execute");
        ClassificationPolicy policy = ClassificationPolicy.builder().maxPathsPerSink(Integer.MAX_VALUE).build();
        TaintAnalyzer slow = new TaintAnalyzer(policy, 1, Duration.ofMillis(1));

        assertThatThrownBy(() -> slow.analyze(builder.build()))
                .isInstanceOfSatisfying(AnalysisTimeoutException.class,
                        e -> assertThat(e.timeout()).isEqualTo(Duration.ofMillis(1)));
    }

    @Test
    void analyzeSink_classifiesOnCallingThread() {
        SinkAnalysis sink = analyzer.analyzeSink(multiSinkGraph(), "audit_query");

        assertThat(sink.overall()).isEqualTo(OverallVerdict.FALSE_POSITIVE);
        assertThat(sink.verdict().reasons()).containsExactly(PathVerdict.AUTH_PROTECTED);
    }

    @Test
    void analyze_uncalledCycleShowsAsDeadPath() {
        TaintGraph graph = TaintGraph.builder()
                .addNode(entry("route"))
                .addNode(Node.of("a", NodeKind.CALL))
                .addNode(Node.of("b", NodeKind.CALL))
                .addNode(sink("execute"))
                .addEdge("a", "b")
                .addEdge("b", "a")
                .addEdge("b", "execute")
                .markEntryRegistered("route")
                .build();

        ClassificationReport report = analyzer.analyze(graph);

        SinkAnalysis sink = report.sink("execute").orElseThrow();
        assertThat(sink.overall()).isEqualTo(OverallVerdict.DEAD_CODE);
        assertThat(sink.verdict().rationale()).isEqualTo("1 dead");
        assertThat(sink.paths()).hasSize(1);
        assertThat(sink.paths().get(0).deadReason()).isEqualTo("a is not an entry point and no entry point calls it");
        assertThat(report.entryPoints()).extracting(EntryPointVerdict::entryId).containsExactly("a");
    }

    private SinkAnalysis analyze(TaintGraph graph, String sinkId) {
        return analyzer.analyze(graph).sink(sinkId).orElseThrow();
    }

    /**
     * orders reaches an unprotected query and a sanitized template; admin reaches an audit
     * query behind a gate.
     */
    private static TaintGraph multiSinkGraph() {
        return TaintGraph.builder()
                .addNode(entry("orders"))
                .addNode(entry("admin"))
                .addNode(role("admin_required", "authz_gate"))
                .addNode(role("escape", "sanitizer"))
                .addNode(sink("orders_query"))
                .addNode(sink("audit_query"))
                .addNode(Node.builder().id("page").kind(NodeKind.SINK).tag("sink", "template").build())
                .addEdge("orders", "orders_query")
                .addEdge("orders", "escape")
                .addEdge("escape", "page")
                .addEdge("admin", "admin_required")
                .addEdge("admin_required", "audit_query")
                .markEntryRegistered("orders")
                .markEntryRegistered("admin")
                .build();
    }

    private static Node entry(String id) {
        return Node.builder().id(id).kind(NodeKind.ENTRY_POINT).tag("role", "source").build();
    }

    private static Node sink(String id) {
        return Node.builder().id(id).kind(NodeKind.SINK).tag("sink", "sql").build();
    }

    private static Node role(String id, String role) {
        return Node.builder().id(id).tag("role", role).build();
    }

    private static Node validator(String id, String strength) {
        return Node.builder().id(id).tag("role", "validator").tag("strength", strength).build();
    }
}
