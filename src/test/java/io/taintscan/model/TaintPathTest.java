package io.taintscan.model;

import io.taintscan.graph.BranchCondition;
import io.taintscan.graph.Node;
import io.taintscan.graph.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaintPathTest {

    private final Node entry = Node.of("search", NodeKind.ENTRY_POINT);
    private final Node guard = Node.of("flag", NodeKind.BRANCH);
    private final Node sink = Node.of("query", NodeKind.SINK);

    @Test
    void isLive_requiresRegisteredEntryAndNoNeverEdge() {
        TaintPath live = new TaintPath(List.of(entry, guard, sink),
                List.of(BranchCondition.ALWAYS, BranchCondition.RUNTIME), true, null);
        TaintPath unregistered = new TaintPath(List.of(entry, sink),
                List.of(BranchCondition.ALWAYS), false, null);
        TaintPath neverTaken = new TaintPath(List.of(entry, guard, sink),
                List.of(BranchCondition.ALWAYS, BranchCondition.NEVER), true, null);

        assertThat(live.isLive()).isTrue();
        assertThat(unregistered.isLive()).isFalse();
        assertThat(neverTaken.isLive()).isFalse();
        assertThat(neverTaken.firstNeverEdge()).hasValue(1);
    }

    @Test
    void pathString_marksNonTrivialConditions() {
        TaintPath path = new TaintPath(List.of(entry, guard, sink),
                List.of(BranchCondition.ALWAYS, BranchCondition.NEVER), true, null);

        assertThat(path.pathString()).isEqualTo("search -> flag -[NEVER]-> query");
        assertThat(path.length()).isEqualTo(2);
    }

    @Test
    void constructor_rejectsMismatchedConditions() {
        assertThatThrownBy(() -> new TaintPath(List.of(entry, sink), List.of(), true, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Expected 1 conditions");
    }

    @Test
    void evidence_listsDecisiveFactFirst() {
        TaintPath path = new TaintPath(List.of(entry, guard, sink),
                List.of(BranchCondition.ALWAYS, BranchCondition.ALWAYS), true,
                List.of(new CycleTruncation("flag", "search")));

        PathClassification classification = PathClassification.builder(path)
                .verdict(PathVerdict.SANITIZED)
                .authGateSeen(true)
                .protectedBy("flag")
                .addAuthzGate("search")
                .build();

        assertThat(classification.evidence()).containsExactly(
                "taint neutralized by flag",
                "authorization gate search",
                "revisit of search from flag skipped");
    }

    @Test
    void sinkVerdictLabel_joinsReasons() {
        SinkVerdict verdict = new SinkVerdict("query", OverallVerdict.FALSE_POSITIVE,
                List.of(PathVerdict.SANITIZED, PathVerdict.AUTH_PROTECTED),
                Map.of(PathVerdict.SANITIZED, 1, PathVerdict.AUTH_PROTECTED, 2),
                "1 sanitized, 2 auth protected", Confidence.HIGH, null);

        assertThat(verdict.label()).isEqualTo("FALSE_POSITIVE / sanitized, auth protected");
        assertThat(verdict.totalPaths()).isEqualTo(3);
        assertThat(verdict.countOf(PathVerdict.DEAD)).isZero();
    }

    @Test
    void failedVerdict_hasNoReasons() {
        SinkVerdict failed = SinkVerdict.failed("query", "boom");

        assertThat(failed.label()).isEqualTo("ERROR");
        assertThat(failed.confidence()).isEqualTo(Confidence.LOW);
        assertThat(failed.error()).isEqualTo("boom");
    }

    @Test
    void warningFormatted_prefersNodeId() {
        assertThat(AnalysisWarning.orphanedSink("stray").formatted())
                .isEqualTo("[ORPHANED_SINK] stray: Sink stray is not reachable from any node and was excluded");
        assertThat(AnalysisWarning.sinkFailed("query", "boom").formatted())
                .isEqualTo("[SINK_FAILED] query: boom");
    }
}
