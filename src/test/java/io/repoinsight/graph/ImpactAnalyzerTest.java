package io.repoinsight.graph;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ImpactAnalyzerTest {

    private final ImpactAnalyzer analyzer = new ImpactAnalyzer();

    @Test
    void getAffected_returnsTransitiveDependents() {
        DependencyGraph graph = DependencyGraph.fromAdjacency(List.of(
                AdjacencyFact.of("A", "B"),
                AdjacencyFact.of("B", "C")
        ));

        assertThat(analyzer.getAffected(graph, Set.of("C"))).containsExactlyInAnyOrder("A", "B");
    }

    @Test
    void getAffected_excludesChangedNodesEvenOnCycles() {
        DependencyGraph graph = DependencyGraph.fromAdjacency(List.of(
                AdjacencyFact.of("A", "B"),
                AdjacencyFact.of("B", "A")
        ));

        assertThat(analyzer.getAffected(graph, Set.of("A"))).containsExactly("B");
    }

    @Test
    void getAffected_ignoresUnknownIds() {
        DependencyGraph graph = DependencyGraph.fromAdjacency(List.of(AdjacencyFact.of("A", "B")));

        assertThat(analyzer.getAffected(graph, Set.of("missing"))).isEmpty();
    }

    @Test
    void affectedWithDistance_keepsShortestDistance() {
        DependencyGraph graph = DependencyGraph.fromAdjacency(List.of(
                AdjacencyFact.of("app", "service", "util"),
                AdjacencyFact.of("service", "util")
        ));

        Map<String, Integer> affected = analyzer.affectedWithDistance(graph, Set.of("util"));

        assertThat(affected).containsExactly(Map.entry("app", 1), Map.entry("service", 1));
    }
}
