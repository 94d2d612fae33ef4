package io.repoinsight.graph;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DependencyGraphTest {

    @Test
    void fromAdjacency_registersUnseenTargetsImplicitly() {
        DependencyGraph graph = DependencyGraph.fromAdjacency(List.of(
                AdjacencyFact.of("a", "b", "c")
        ));

        assertThat(graph.nodeIds()).containsExactly("a", "b", "c");
        assertThat(graph.edgeCount()).isEqualTo(2);
        assertThat(graph.node("c")).get().extracting(GraphNode::kind).isEqualTo(NodeKind.FILE);
    }

    @Test
    void fromAdjacency_keepsSelfLoops() {
        DependencyGraph graph = DependencyGraph.fromAdjacency(List.of(AdjacencyFact.of("a", "a")));

        assertThat(graph.edges()).singleElement().satisfies(edge -> assertThat(edge.isSelfLoop()).isTrue());
        assertThat(graph.fanIn("a")).isEqualTo(1);
        assertThat(graph.fanOut("a")).isEqualTo(1);
    }

    @Test
    void fromAdjacency_skipsBlankTargets() {
        DependencyGraph graph = DependencyGraph.fromAdjacency(List.of(
                new AdjacencyFact("a", List.of("b", "", " "), NodeKind.FILE, EdgeKind.DEPENDENCY)
        ));

        assertThat(graph.nodeIds()).containsExactly("a", "b");
    }

    @Test
    void laterFact_upgradesImplicitNodeKind() {
        DependencyGraph graph = DependencyGraph.fromAdjacency(List.of(
                AdjacencyFact.of("app", "lib"),
                new AdjacencyFact("lib", List.of(), NodeKind.PACKAGE, EdgeKind.DEPENDENCY)
        ));

        assertThat(graph.node("lib")).get().extracting(GraphNode::kind).isEqualTo(NodeKind.PACKAGE);
    }

    @Test
    void addEdge_mergesRepeatedEdgesBySummingWeights() {
        DependencyGraph graph = DependencyGraph.builder()
                .addEdge("a", "b")
                .addEdge(new GraphEdge("a", "b", EdgeKind.DEPENDENCY, 2.5))
                .addEdge("a", "b", EdgeKind.DEV_DEPENDENCY)
                .build();

        assertThat(graph.edgeCount()).isEqualTo(2);
        assertThat(graph.edges().get(0).weight()).isEqualTo(3.5);
        assertThat(graph.edges().get(1).kind()).isEqualTo(EdgeKind.DEV_DEPENDENCY);
    }

    @Test
    void successors_filterByEdgeKind() {
        DependencyGraph graph = DependencyGraph.builder()
                .addEdge("a", "b")
                .addEdge("a", "c", EdgeKind.DEV_DEPENDENCY)
                .build();

        assertThat(graph.successors("a", Set.of(EdgeKind.DEPENDENCY))).containsExactly("b");
        assertThat(graph.successors("a", Set.of(EdgeKind.values()))).containsExactly("b", "c");
        assertThat(graph.predecessors("c", Set.of(EdgeKind.DEV_DEPENDENCY))).containsExactly("a");
    }

    @Test
    void fanInAndFanOut_countEdges() {
        DependencyGraph graph = DependencyGraph.fromAdjacency(List.of(
                AdjacencyFact.of("a", "c"),
                AdjacencyFact.of("b", "c"),
                AdjacencyFact.of("c", "d")
        ));

        assertThat(graph.fanIn("c")).isEqualTo(2);
        assertThat(graph.fanOut("c")).isEqualTo(1);
        assertThat(graph.fanIn("unknown")).isZero();
    }

    @Test
    void explicitNode_keepsMetadata() {
        DependencyGraph graph = DependencyGraph.builder()
                .addNode(new GraphNode("src/app.ts", NodeKind.FILE, Map.of("lang", "ts")))
                .addEdge("src/app.ts", "src/db.ts")
                .build();

        assertThat(graph.node("src/app.ts")).get()
                .extracting(GraphNode::metadata)
                .isEqualTo(Map.of("lang", "ts"));
    }

    @Test
    void graphNode_equalityIsById() {
        assertThat(new GraphNode("a", NodeKind.FILE, Map.of()))
                .isEqualTo(new GraphNode("a", NodeKind.PACKAGE, Map.of("x", "y")));
    }

    @Test
    void graphEdge_rejectsNegativeWeight() {
        assertThatThrownBy(() -> new GraphEdge("a", "b", EdgeKind.DEPENDENCY, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
