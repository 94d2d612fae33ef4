package io.repoinsight.analysis;

import io.repoinsight.confidence.AdaptiveConfidence;
import io.repoinsight.confidence.ConfidenceLevel;
import io.repoinsight.config.ArchitectureConfig;
import io.repoinsight.config.LearningConfig;
import io.repoinsight.graph.AdjacencyFact;
import io.repoinsight.graph.DependencyGraph;
import io.repoinsight.learning.InMemoryStateRepository;
import io.repoinsight.learning.PatternSignature;
import io.repoinsight.learning.PatternStore;
import io.repoinsight.model.AnalysisReport;
import io.repoinsight.model.Finding;
import io.repoinsight.model.FindingType;
import io.repoinsight.model.Severity;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class GraphAnalyzerTest {

    private static final String UI = "src/components/UserList.tsx";
    private static final String SERVICE = "src/services/users.ts";
    private static final String REPO = "src/data/userRepo.ts";
    private static final String UTIL = "src/utils/date.ts";

    private static DependencyGraph layeredGraph() {
        return DependencyGraph.fromAdjacency(List.of(
                AdjacencyFact.of(UI, SERVICE, UTIL),
                AdjacencyFact.of(SERVICE, REPO, UTIL),
                AdjacencyFact.of(REPO, SERVICE, UTIL),
                AdjacencyFact.of(UTIL)));
    }

    private static GraphAnalyzer analyzer(ArchitectureConfig config, PatternStore store) {
        return new GraphAnalyzer(config, new AdaptiveConfidence(store));
    }

    private static PatternStore emptyStore() {
        return new PatternStore(LearningConfig.defaults(), new InMemoryStateRepository(),
                Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void analyze_reportsCycleAndLayerViolation() {
        AnalysisReport report = analyzer(ArchitectureConfig.defaults(), emptyStore())
                .analyze(layeredGraph(), "layered.json");

        assertThat(report.source()).isEqualTo("layered.json");
        assertThat(report.findings()).extracting(Finding::type)
                .containsExactly(FindingType.CIRCULAR_DEPENDENCY, FindingType.LAYER_VIOLATION);

        Finding cycle = report.findings().get(0);
        assertThat(cycle.severity()).isEqualTo(Severity.HIGH);
        assertThat(cycle.nodeId()).isEqualTo(REPO);
        assertThat(cycle.nodes()).containsExactlyInAnyOrder(SERVICE, REPO);
        assertThat(cycle.message()).startsWith("Circular dependency detected: ");
        assertThat(cycle.signature().detectorId()).isEqualTo(GraphAnalyzer.DETECTOR_ID);
        assertThat(cycle.signature().location().filePath()).isEqualTo(REPO + "|" + SERVICE);

        Finding violation = report.findings().get(1);
        assertThat(violation.severity()).isEqualTo(Severity.HIGH);
        assertThat(violation.nodeId()).isEqualTo(REPO);
        assertThat(violation.nodes()).containsExactly(REPO, SERVICE);
        assertThat(violation.message()).isEqualTo(
                "Layer violation: Data layer should not depend on Services layer (" + REPO + " -> " + SERVICE + ")");
    }

    @Test
    void analyze_scoresFindings() {
        AnalysisReport report = analyzer(ArchitectureConfig.defaults(), emptyStore())
                .analyze(layeredGraph(), "layered.json");

        Finding cycle = report.findings().get(0);
        // 40 + 27 + 16 + 7 with the architecture default accuracy
        assertThat(cycle.confidenceScore()).isEqualTo(90);
        assertThat(cycle.confidence().level()).isEqualTo(ConfidenceLevel.VERY_HIGH);
        assertThat(report.findings()).allSatisfy(f -> assertThat(f.confidence()).isNotNull());
    }

    @Test
    void analyze_computesMetrics() {
        AnalysisReport report = analyzer(ArchitectureConfig.defaults(), emptyStore())
                .analyze(layeredGraph(), "layered.json");

        assertThat(report.metrics().totalModules()).isEqualTo(4);
        assertThat(report.metrics().totalDependencies()).isEqualTo(6);
        assertThat(report.metrics().circularDependencies()).isEqualTo(1);
        assertThat(report.metrics().layerViolations()).isEqualTo(1);
        assertThat(report.metrics().averageCoupling()).isEqualTo(3.0);
        assertThat(report.metrics().layerHealth()).isEqualTo(75.0);
        assertThat(report.metrics().architectureScore()).isEqualTo(80.0);
    }

    @Test
    void analyze_leavesCycleMembersOutOfOrder() {
        AnalysisReport report = analyzer(ArchitectureConfig.defaults(), emptyStore())
                .analyze(layeredGraph(), "layered.json");

        assertThat(report.excludedFromOrder()).contains(SERVICE, REPO);
        assertThat(report.topologicalOrder()).doesNotContain(SERVICE, REPO);
        assertThat(report.topologicalOrder()).contains(UTIL);
    }

    @Test
    void analyze_reportsHighCouplingAboveLimit() {
        ArchitectureConfig tight = new ArchitectureConfig(3, ArchitectureConfig.defaults().layers());

        AnalysisReport report = analyzer(tight, emptyStore()).analyze(layeredGraph(), "layered.json");

        assertThat(report.findings()).filteredOn(f -> f.type() == FindingType.HIGH_COUPLING)
                .singleElement()
                .satisfies(f -> {
                    assertThat(f.nodeId()).isEqualTo(SERVICE);
                    assertThat(f.severity()).isEqualTo(Severity.MEDIUM);
                    assertThat(f.message()).isEqualTo("High coupling detected: 4 dependencies (max: 3)");
                });
        assertThat(report.findings()).last().extracting(Finding::type).isEqualTo(FindingType.HIGH_COUPLING);
    }

    @Test
    void analyze_couplingFarAboveLimitIsHigh() {
        ArchitectureConfig tight = new ArchitectureConfig(1, List.of());

        AnalysisReport report = analyzer(tight, emptyStore()).analyze(layeredGraph(), "layered.json");

        assertThat(report.findings()).filteredOn(f -> f.type() == FindingType.HIGH_COUPLING)
                .filteredOn(f -> f.nodeId().equals(SERVICE))
                .singleElement()
                .extracting(Finding::severity)
                .isEqualTo(Severity.HIGH);
    }

    @Test
    void analyze_withholdsSuppressedFindings() {
        PatternStore store = emptyStore();
        PatternSignature cycle = PatternSignature.of(GraphAnalyzer.DETECTOR_ID,
                FindingType.CIRCULAR_DEPENDENCY.label(), REPO + "|" + SERVICE, 0);
        for (int i = 0; i < 10; i++) {
            store.recordFailure(cycle, 90, null);
        }

        AnalysisReport report = analyzer(ArchitectureConfig.defaults(), store).analyze(layeredGraph(), "layered.json");

        assertThat(report.suppressedCount()).isEqualTo(1);
        assertThat(report.findings()).extracting(Finding::type).containsExactly(FindingType.LAYER_VIOLATION);
        assertThat(report.cycles()).hasSize(1);
        assertThat(report.metrics().architectureScore()).isEqualTo(90.0);
    }

    @Test
    void analyze_computesChangeImpact() {
        AnalysisReport report = analyzer(ArchitectureConfig.defaults(), emptyStore())
                .analyze(layeredGraph(), "layered.json", Set.of(UTIL));

        assertThat(report.changedNodes()).containsExactly(UTIL);
        assertThat(report.affectedNodes()).containsOnly(entry(UI, 1), entry(SERVICE, 1), entry(REPO, 1));
    }

    @Test
    void analyze_cleanGraphHasPerfectScore() {
        DependencyGraph graph = DependencyGraph.fromAdjacency(List.of(
                AdjacencyFact.of(UI, SERVICE),
                AdjacencyFact.of(SERVICE, UTIL)));

        AnalysisReport report = new GraphAnalyzer(null, null).analyze(graph, "clean.json");

        assertThat(report.findings()).isEmpty();
        assertThat(report.hasFindingsAtLeast(Severity.LOW)).isFalse();
        assertThat(report.topologicalOrder()).hasSize(3);
        assertThat(report.criticalPath()).hasSize(3);
        assertThat(report.metrics().architectureScore()).isEqualTo(100.0);
        assertThat(report.metrics().layerHealth()).isEqualTo(100.0);
    }

    @Test
    void analyze_emptyGraph() {
        AnalysisReport report = new GraphAnalyzer(null, null).analyze(DependencyGraph.builder().build(), "empty.json");

        assertThat(report.findings()).isEmpty();
        assertThat(report.metrics().totalModules()).isZero();
        assertThat(report.metrics().averageCoupling()).isZero();
    }

    @Test
    void analyze_reportsDriftAgainstBaseline() {
        ArchitectureBaseline baseline = new ArchitectureBaseline("layered.json",
                Instant.parse("2026-02-01T09:00:00Z"), 10, 4);

        AnalysisReport report = analyzer(ArchitectureConfig.defaults(), emptyStore())
                .analyze(layeredGraph(), "layered.json", Set.of(), baseline);

        assertThat(report.findings()).filteredOn(f -> f.type() == FindingType.ARCHITECTURE_DRIFT)
                .extracting(Finding::message)
                .containsExactly("Significant module count change: 10 -> 4 (60.0%)",
                        "Significant dependency count change: 4 -> 6 (50.0%)");
        assertThat(report.findings()).filteredOn(f -> f.type() == FindingType.ARCHITECTURE_DRIFT)
                .allSatisfy(f -> {
                    assertThat(f.severity()).isEqualTo(Severity.MEDIUM);
                    assertThat(f.nodeId()).isEqualTo(GraphAnalyzer.WORKSPACE_NODE);
                    assertThat(f.confidence()).isNotNull();
                });
        assertThat(report.metrics().architectureScore()).isEqualTo(70.0);
    }

    @Test
    void analyze_noDriftWithinThresholds() {
        ArchitectureBaseline baseline = new ArchitectureBaseline("layered.json",
                Instant.parse("2026-02-01T09:00:00Z"), 5, 5);

        AnalysisReport report = analyzer(ArchitectureConfig.defaults(), emptyStore())
                .analyze(layeredGraph(), "layered.json", Set.of(), baseline);

        assertThat(report.findings()).extracting(Finding::type)
                .containsExactly(FindingType.CIRCULAR_DEPENDENCY, FindingType.LAYER_VIOLATION);
    }

    @Test
    void analyze_reportsUiDependingOnDataDirectly() {
        DependencyGraph graph = DependencyGraph.fromAdjacency(List.of(
                AdjacencyFact.of(UI, SERVICE, REPO),
                AdjacencyFact.of(SERVICE, REPO)));

        AnalysisReport report = analyzer(ArchitectureConfig.defaults(), emptyStore()).analyze(graph, "skip.json");

        assertThat(report.findings()).singleElement().satisfies(f -> {
            assertThat(f.type()).isEqualTo(FindingType.LAYER_VIOLATION);
            assertThat(f.nodes()).containsExactly(UI, REPO);
            assertThat(f.recommendation()).isEqualTo("Refactor to depend on the UI or Services or Utils layer instead.");
        });
    }
}
