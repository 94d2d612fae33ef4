package io.repoinsight.analysis;

import io.repoinsight.confidence.AdaptiveConfidence;
import io.repoinsight.confidence.ConfidenceScore;
import io.repoinsight.config.ArchitectureConfig;
import io.repoinsight.graph.BoundaryViolation;
import io.repoinsight.graph.CouplingMetrics;
import io.repoinsight.graph.CriticalPathFinder;
import io.repoinsight.graph.Cycle;
import io.repoinsight.graph.CycleDetector;
import io.repoinsight.graph.DependencyGraph;
import io.repoinsight.graph.ImpactAnalyzer;
import io.repoinsight.graph.LayerRules;
import io.repoinsight.graph.NodeCoupling;
import io.repoinsight.graph.TopologicalOrderer;
import io.repoinsight.learning.PatternSignature;
import io.repoinsight.model.AnalysisReport;
import io.repoinsight.model.ArchitectureMetrics;
import io.repoinsight.model.Finding;
import io.repoinsight.model.FindingType;
import io.repoinsight.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs every graph algorithm over one graph and turns the structural results into scored findings.
 * <p>
 * Findings are identified to the learning store with detector id {@value #DETECTOR_ID}; findings
 * whose pattern is suppressed are counted but not reported.
 */
public class GraphAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(GraphAnalyzer.class);

    public static final String DETECTOR_ID = "architecture";

    /**
     * Node id of findings about the graph as a whole.
     */
    public static final String WORKSPACE_NODE = "<workspace>";

    private final ArchitectureConfig config;
    private final AdaptiveConfidence confidence;
    private final CycleDetector cycleDetector = new CycleDetector();
    private final TopologicalOrderer orderer = new TopologicalOrderer();
    private final CriticalPathFinder criticalPathFinder = new CriticalPathFinder();
    private final ImpactAnalyzer impactAnalyzer = new ImpactAnalyzer();
    private final CouplingMetrics couplingMetrics = new CouplingMetrics();
    private final DriftDetector driftDetector = new DriftDetector();

    public GraphAnalyzer(ArchitectureConfig config, AdaptiveConfidence confidence) {
        this.config = config != null ? config : ArchitectureConfig.defaults();
        this.confidence = confidence != null ? confidence : AdaptiveConfidence.withoutLearning();
    }

    public AnalysisReport analyze(DependencyGraph graph, String source) {
        return analyze(graph, source, Set.of());
    }

    /**
     * @param changedNodeIds Nodes to compute change impact for; may be empty
     */
    public AnalysisReport analyze(DependencyGraph graph, String source, Set<String> changedNodeIds) {
        return analyze(graph, source, changedNodeIds, null);
    }

    /**
     * @param changedNodeIds Nodes to compute change impact for; may be empty
     * @param baseline       Graph size from the previous analysis, or null to skip drift detection
     */
    public AnalysisReport analyze(DependencyGraph graph, String source, Set<String> changedNodeIds,
                                  ArchitectureBaseline baseline) {
        Instant start = Instant.now();

        List<Cycle> cycles = cycleDetector.detectCycles(graph);
        TopologicalOrderer.Ordering ordering = orderer.order(graph);
        List<String> criticalPath = criticalPathFinder.getCriticalPath(graph);
        LayerRules rules = config.layerRules();
        List<BoundaryViolation> violations = rules.boundaryViolations(graph);
        List<NodeCoupling> coupled = couplingMetrics.highlyCoupled(graph, config.maxCoupling());
        Map<String, Integer> affected = changedNodeIds.isEmpty()
                ? Map.of()
                : impactAnalyzer.affectedWithDistance(graph, changedNodeIds);
        List<DriftDetector.Drift> drifts = baseline != null ? driftDetector.detect(baseline, graph) : List.of();

        List<Finding> candidates = new ArrayList<>();
        cycles.forEach(cycle -> candidates.add(cycleFinding(cycle)));
        violations.forEach(violation -> candidates.add(violationFinding(violation)));
        coupled.forEach(node -> candidates.add(couplingFinding(node)));
        drifts.forEach(drift -> candidates.add(driftFinding(drift)));

        List<Finding> findings = new ArrayList<>();
        int suppressed = 0;
        for (Finding candidate : candidates) {
            if (confidence.isSuppressed(candidate.signature())) {
                suppressed++;
                continue;
            }
            ConfidenceScore score = confidence.score(candidate.type().factors(), candidate.signature());
            findings.add(candidate.withConfidence(score));
        }
        findings.sort(Comparator.comparingInt((Finding f) -> f.severity().rank())
                .thenComparing(f -> f.type().ordinal())
                .thenComparing(Finding::nodeId));

        log.debug("Analysed {} nodes: {} cycles, {} layer violations, {} highly coupled, {} drifts, {} suppressed",
                graph.nodeCount(), cycles.size(), violations.size(), coupled.size(), drifts.size(), suppressed);

        return AnalysisReport.builder()
                .source(source)
                .analyzedAt(start)
                .duration(Duration.between(start, Instant.now()))
                .findings(findings)
                .suppressedCount(suppressed)
                .cycles(cycles)
                .topologicalOrder(ordering.order())
                .excludedFromOrder(ordering.excluded())
                .criticalPath(criticalPath)
                .changedNodes(List.copyOf(new LinkedHashSet<>(changedNodeIds)))
                .affectedNodes(affected)
                .metrics(metrics(graph, cycles.size(), violations.size(), findings))
                .build();
    }

    private Finding cycleFinding(Cycle cycle) {
        String primary = cycle.path().stream().sorted().findFirst().orElseThrow();
        return Finding.builder()
                .type(FindingType.CIRCULAR_DEPENDENCY)
                .severity(cycle.severity())
                .nodeId(primary)
                .nodes(cycle.path())
                .message("Circular dependency detected: " + cycle.pathString())
                .recommendation("Refactor to remove the circular dependency, e.g. extract the shared part "
                        + "or invert one dependency.")
                .signature(signature(FindingType.CIRCULAR_DEPENDENCY, cycle.canonicalKey()))
                .build();
    }

    private Finding violationFinding(BoundaryViolation violation) {
        String allowed = config.layers().stream()
                .filter(layer -> layer.name().equals(violation.fromLayer()))
                .findFirst()
                .map(layer -> String.join(" or ", layer.allowedDependencies()))
                .orElse(violation.fromLayer());
        return Finding.builder()
                .type(FindingType.LAYER_VIOLATION)
                .severity(Severity.HIGH)
                .nodeId(violation.edge().from())
                .nodes(List.of(violation.edge().from(), violation.edge().to()))
                .message(violation.message())
                .recommendation("Refactor to depend on the " + allowed + " layer instead.")
                .signature(signature(FindingType.LAYER_VIOLATION, violation.edge().formatted()))
                .build();
    }

    private Finding couplingFinding(NodeCoupling node) {
        int max = config.maxCoupling();
        return Finding.builder()
                .type(FindingType.HIGH_COUPLING)
                .severity(node.coupling() > max * 2 ? Severity.HIGH : Severity.MEDIUM)
                .nodeId(node.nodeId())
                .message("High coupling detected: " + node.coupling() + " dependencies (max: " + max + ")")
                .recommendation("Split the module to reduce its dependencies.")
                .signature(signature(FindingType.HIGH_COUPLING, node.nodeId()))
                .build();
    }

    private Finding driftFinding(DriftDetector.Drift drift) {
        return Finding.builder()
                .type(FindingType.ARCHITECTURE_DRIFT)
                .severity(Severity.MEDIUM)
                .nodeId(WORKSPACE_NODE)
                .message(drift.message())
                .recommendation("module".equals(drift.measure())
                        ? "Review recent changes to ensure architecture stability."
                        : "Review dependency changes to ensure they align with architecture goals.")
                .signature(signature(FindingType.ARCHITECTURE_DRIFT, drift.measure()))
                .build();
    }

    private static PatternSignature signature(FindingType type, String location) {
        return PatternSignature.of(DETECTOR_ID, type.label(), location, 0);
    }

    private ArchitectureMetrics metrics(DependencyGraph graph, int cycles, int violations, List<Finding> findings) {
        int modules = graph.nodeCount();
        double layerHealth = modules > 0 ? Math.max(0, 100 - (double) violations / modules * 100) : 100;
        long critical = findings.stream().filter(f -> f.severity() == Severity.CRITICAL).count();
        long high = findings.stream().filter(f -> f.severity() == Severity.HIGH).count();
        long medium = findings.stream().filter(f -> f.severity() == Severity.MEDIUM).count();
        double score = Math.max(0, 100 - (critical * 20 + high * 10 + medium * 5));
        return new ArchitectureMetrics(modules, graph.edgeCount(), cycles, violations,
                round2(couplingMetrics.averageCoupling(graph)), round2(layerHealth), round2(score));
    }

    private static double round2(double value) {
        return Math.round(value * 100) / 100.0;
    }
}
