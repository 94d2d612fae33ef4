package io.repoinsight.analysis;

import io.repoinsight.graph.AdjacencyFact;
import io.repoinsight.graph.DependencyGraph;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DriftDetectorTest {

    private static final Instant THEN = Instant.parse("2026-02-01T09:00:00Z");

    // 4 nodes, 4 edges
    private static DependencyGraph graph() {
        return DependencyGraph.fromAdjacency(List.of(
                AdjacencyFact.of("a", "b", "c"),
                AdjacencyFact.of("b", "c"),
                AdjacencyFact.of("c", "d")));
    }

    private static ArchitectureBaseline baseline(int nodes, int edges) {
        return new ArchitectureBaseline("old.json", THEN, nodes, edges);
    }

    @Test
    void detect_reportsBothMeasuresPastThreshold() {
        List<DriftDetector.Drift> drifts = new DriftDetector().detect(baseline(2, 2), graph());

        assertThat(drifts).extracting(DriftDetector.Drift::measure).containsExactly("module", "dependency");
        assertThat(drifts.get(0).message()).isEqualTo("Significant module count change: 2 -> 4 (100.0%)");
        assertThat(drifts.get(1).message()).isEqualTo("Significant dependency count change: 2 -> 4 (100.0%)");
    }

    @Test
    void detect_thresholdsAreExclusive() {
        // 4 vs 5 modules is exactly 20%, 4 vs 3 dependencies is 33%
        List<DriftDetector.Drift> drifts = new DriftDetector().detect(baseline(5, 3), graph());

        assertThat(drifts).singleElement().satisfies(drift -> {
            assertThat(drift.measure()).isEqualTo("dependency");
            assertThat(drift.previous()).isEqualTo(3);
            assertThat(drift.current()).isEqualTo(4);
        });
    }

    @Test
    void detect_shrinkingGraphIsDrift() {
        List<DriftDetector.Drift> drifts = new DriftDetector().detect(baseline(10, 4), graph());

        assertThat(drifts).singleElement()
                .extracting(DriftDetector.Drift::message)
                .isEqualTo("Significant module count change: 10 -> 4 (60.0%)");
    }

    @Test
    void detect_zeroBaselineIsNeverDrift() {
        assertThat(new DriftDetector().detect(baseline(0, 0), graph())).isEmpty();
    }

    @Test
    void detect_unchangedGraph() {
        assertThat(new DriftDetector().detect(baseline(4, 4), graph())).isEmpty();
    }
}
