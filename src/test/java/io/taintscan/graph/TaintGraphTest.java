package io.taintscan.graph;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaintGraphTest {

    @Test
    void addNode_rejectsDuplicateId() {
        TaintGraph.Builder builder = TaintGraph.builder()
                .addNode(Node.of("search", NodeKind.ENTRY_POINT));

        assertThatThrownBy(() -> builder.addNode(Node.of("search", NodeKind.CALL)))
                .isInstanceOf(DuplicateNodeException.class)
                .satisfies(e -> assertThat(((StructuralGraphException) e).offendingId()).isEqualTo("search"));
    }

    @Test
    void addEdge_rejectsUnknownTarget() {
        TaintGraph.Builder builder = TaintGraph.builder()
                .addNode(Node.of("search", NodeKind.ENTRY_POINT));

        assertThatThrownBy(() -> builder.addEdge("search", "execute"))
                .isInstanceOf(DanglingEdgeException.class)
                .satisfies(e -> assertThat(((DanglingEdgeException) e).missingNodeId()).isEqualTo("execute"));
    }

    @Test
    void addEdge_rejectsUnknownSource() {
        TaintGraph.Builder builder = TaintGraph.builder()
                .addNode(Node.of("execute", NodeKind.SINK));

        assertThatThrownBy(() -> builder.addEdge("ghost", "execute", BranchCondition.RUNTIME))
                .isInstanceOf(DanglingEdgeException.class)
                .hasMessageContaining("ghost");
    }

    @Test
    void addEdge_keepsIdenticalEdgeOnce() {
        TaintGraph graph = TaintGraph.builder()
                .addNode(Node.of("a", NodeKind.ENTRY_POINT))
                .addNode(Node.of("b", NodeKind.SINK))
                .addEdge("a", "b")
                .addEdge("a", "b", BranchCondition.ALWAYS)
                .addEdge("a", "b", BranchCondition.RUNTIME)
                .build();

        assertThat(graph.edgeCount()).isEqualTo(2);
        assertThat(graph.outgoing("a")).extracting(Edge::condition)
                .containsExactly(BranchCondition.ALWAYS, BranchCondition.RUNTIME);
    }

    @Test
    void addEdge_allowsSelfLoopsAndBackEdges() {
        TaintGraph graph = TaintGraph.builder()
                .addNode(Node.of("a", NodeKind.ENTRY_POINT))
                .addNode(Node.of("b", NodeKind.CALL))
                .addEdge("a", "b")
                .addEdge("b", "a")
                .addEdge("b", "b")
                .build();

        assertThat(graph.incoming("b")).hasSize(2);
        assertThat(graph.outgoing("b")).extracting(Edge::to).containsExactly("a", "b");
    }

    @Test
    void markEntryRegistered_rejectsUnknownNode() {
        TaintGraph.Builder builder = TaintGraph.builder();

        assertThatThrownBy(() -> builder.markEntryRegistered("missing"))
                .isInstanceOf(UnknownEntryPointException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void markEntryRegistered_rejectsNonEntryNode() {
        TaintGraph.Builder builder = TaintGraph.builder()
                .addNode(Node.of("helper", NodeKind.CALL));

        assertThatThrownBy(() -> builder.markEntryRegistered("helper"))
                .isInstanceOf(UnknownEntryPointException.class);
    }

    @Test
    void isRegistered_reflectsRegistration() {
        TaintGraph graph = TaintGraph.builder()
                .addNode(Node.of("public_route", NodeKind.ENTRY_POINT))
                .addNode(Node.of("internal_route", NodeKind.ENTRY_POINT))
                .markEntryRegistered("public_route")
                .build();

        assertThat(graph.isRegistered("public_route")).isTrue();
        assertThat(graph.isRegistered("internal_route")).isFalse();
        assertThat(graph.entryPoints()).extracting(Node::id)
                .containsExactly("public_route", "internal_route");
    }

    @Test
    void orphanedSinks_ignoresSelfLoops() {
        TaintGraph graph = TaintGraph.builder()
                .addNode(Node.of("route", NodeKind.ENTRY_POINT))
                .addNode(Node.of("used", NodeKind.SINK))
                .addNode(Node.of("unused", NodeKind.SINK))
                .addEdge("route", "used")
                .addEdge("unused", "unused")
                .build();

        assertThat(graph.orphanedSinks()).extracting(Node::id).containsExactly("unused");
        assertThat(graph.inScopeSinks()).extracting(Node::id).containsExactly("used");
    }

    @Test
    void pathRoots_includesEntryPointsAndUncalledCode() {
        TaintGraph graph = TaintGraph.builder()
                .addNode(Node.of("legacy_batch", NodeKind.CALL))
                .addNode(Node.of("route", NodeKind.ENTRY_POINT))
                .addNode(Node.of("helper", NodeKind.CALL))
                .addNode(Node.of("execute", NodeKind.SINK))
                .addEdge("route", "helper")
                .addEdge("helper", "execute")
                .addEdge("legacy_batch", "execute")
                .build();

        assertThat(graph.pathRoots()).extracting(Node::id).containsExactly("legacy_batch", "route");
    }

    @Test
    void pathRoots_includesFirstNodeOfUncalledCycle() {
        TaintGraph graph = TaintGraph.builder()
                .addNode(Node.of("route", NodeKind.ENTRY_POINT))
                .addNode(Node.of("retry", NodeKind.CALL))
                .addNode(Node.of("load", NodeKind.CALL))
                .addNode(Node.of("ping", NodeKind.CALL))
                .addNode(Node.of("pong", NodeKind.CALL))
                .addNode(Node.of("execute", NodeKind.SINK))
                .addEdge("load", "retry")
                .addEdge("retry", "load")
                .addEdge("load", "execute")
                .addEdge("route", "ping")
                .addEdge("ping", "pong")
                .addEdge("pong", "ping")
                .addEdge("pong", "execute")
                .build();

        assertThat(graph.pathRoots()).extracting(Node::id).containsExactly("route", "retry");
    }

    @Test
    void pathRoots_skipsCycleThatContainsEntryPoint() {
        TaintGraph graph = TaintGraph.builder()
                .addNode(Node.of("helper", NodeKind.CALL))
                .addNode(Node.of("route", NodeKind.ENTRY_POINT))
                .addNode(Node.of("execute", NodeKind.SINK))
                .addEdge("helper", "route")
                .addEdge("route", "helper")
                .addEdge("helper", "execute")
                .build();

        assertThat(graph.pathRoots()).extracting(Node::id).containsExactly("route");
    }

    @Test
    void nodesReaching_followsEdgesBackwardsIgnoringConditions() {
        TaintGraph graph = TaintGraph.builder()
                .addNode(Node.of("route", NodeKind.ENTRY_POINT))
                .addNode(Node.of("branch", NodeKind.BRANCH))
                .addNode(Node.of("unrelated", NodeKind.CALL))
                .addNode(Node.of("execute", NodeKind.SINK))
                .addEdge("route", "branch")
                .addEdge("branch", "execute", BranchCondition.NEVER)
                .addEdge("route", "unrelated")
                .build();

        assertThat(graph.nodesReaching("execute")).containsExactlyInAnyOrder("execute", "branch", "route");
    }

    @Test
    void nodes_preserveDeclarationOrder() {
        TaintGraph graph = TaintGraph.builder()
                .name("ordering")
                .addNode(Node.of("z", NodeKind.CALL))
                .addNode(Node.of("a", NodeKind.CALL))
                .addNode(Node.of("m", NodeKind.SINK))
                .build();

        assertThat(graph.name()).isEqualTo("ordering");
        assertThat(graph.nodes()).extracting(Node::id).containsExactly("z", "a", "m");
        assertThat(graph.sinks()).extracting(Node::id).containsExactly("m");
    }
}
