package io.repoinsight.graph;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CriticalPathFinderTest {

    private final CriticalPathFinder finder = new CriticalPathFinder();

    @Test
    void getCriticalPath_returnsLongestChain() {
        DependencyGraph graph = DependencyGraph.fromAdjacency(List.of(
                AdjacencyFact.of("A", "B", "E"),
                AdjacencyFact.of("B", "C"),
                AdjacencyFact.of("C", "D")
        ));

        assertThat(finder.getCriticalPath(graph)).containsExactly("A", "B", "C", "D");
    }

    @Test
    void getCriticalPath_terminatesOnCycles() {
        DependencyGraph graph = DependencyGraph.fromAdjacency(List.of(
                AdjacencyFact.of("A", "B"),
                AdjacencyFact.of("B", "C"),
                AdjacencyFact.of("C", "A")
        ));

        assertThat(finder.getCriticalPath(graph)).containsExactly("A", "B", "C");
    }

    @Test
    void getCriticalPath_emptyGraph() {
        assertThat(finder.getCriticalPath(DependencyGraph.builder().build())).isEmpty();
    }

    @Test
    void getCriticalPath_singleNode() {
        DependencyGraph graph = DependencyGraph.builder().addNode("only", NodeKind.FILE).build();

        assertThat(finder.getCriticalPath(graph)).containsExactly("only");
    }
}
