package io.repoinsight.model;

import io.repoinsight.graph.Cycle;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Complete result of analysing one dependency graph.
 *
 * @param source            Where the graph came from, e.g. the adjacency file
 * @param analyzedAt        When the analysis started
 * @param duration          How long it took
 * @param findings          Reported findings, most severe first
 * @param suppressedCount   Findings withheld because their pattern is suppressed
 * @param cycles            Every distinct cycle
 * @param topologicalOrder  Dependency order of the acyclic part of the graph
 * @param excludedFromOrder Nodes left out of the order because of cycles
 * @param criticalPath      Longest dependency chain
 * @param changedNodes      Nodes given as changed, if any
 * @param affectedNodes     Nodes transitively depending on a changed node, with their distance
 * @param metrics           Summary numbers
 */
public record AnalysisReport(
        String source,
        Instant analyzedAt,
        Duration duration,
        List<Finding> findings,
        int suppressedCount,
        List<Cycle> cycles,
        List<String> topologicalOrder,
        List<String> excludedFromOrder,
        List<String> criticalPath,
        List<String> changedNodes,
        Map<String, Integer> affectedNodes,
        ArchitectureMetrics metrics
) {

    public AnalysisReport {
        if (metrics == null) {
            throw new IllegalArgumentException("metrics cannot be null");
        }
        findings = findings == null ? List.of() : List.copyOf(findings);
        cycles = cycles == null ? List.of() : List.copyOf(cycles);
        topologicalOrder = topologicalOrder == null ? List.of() : List.copyOf(topologicalOrder);
        excludedFromOrder = excludedFromOrder == null ? List.of() : List.copyOf(excludedFromOrder);
        criticalPath = criticalPath == null ? List.of() : List.copyOf(criticalPath);
        changedNodes = changedNodes == null ? List.of() : List.copyOf(changedNodes);
        affectedNodes = affectedNodes == null ? Map.of() : affectedNodes;
    }

    /**
     * Returns true if there are any findings at or above the given severity.
     */
    public boolean hasFindingsAtLeast(Severity threshold) {
        return findings.stream().anyMatch(f -> f.severity().isAtLeast(threshold));
    }

    public List<Finding> findingsAtLeast(Severity threshold) {
        return findings.stream()
                .filter(f -> f.severity().isAtLeast(threshold))
                .toList();
    }

    public Map<Severity, Long> findingCountsBySeverity() {
        return findings.stream()
                .collect(Collectors.groupingBy(Finding::severity, () -> new EnumMap<>(Severity.class),
                        Collectors.counting()));
    }

    public long countBySeverity(Severity severity) {
        return findings.stream().filter(f -> f.severity() == severity).count();
    }

    public int totalFindings() {
        return findings.size();
    }

    public long durationMs() {
        return duration != null ? duration.toMillis() : 0;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String source;
        private Instant analyzedAt;
        private Duration duration;
        private List<Finding> findings = List.of();
        private int suppressedCount;
        private List<Cycle> cycles = List.of();
        private List<String> topologicalOrder = List.of();
        private List<String> excludedFromOrder = List.of();
        private List<String> criticalPath = List.of();
        private List<String> changedNodes = List.of();
        private Map<String, Integer> affectedNodes = Map.of();
        private ArchitectureMetrics metrics;

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder analyzedAt(Instant analyzedAt) {
            this.analyzedAt = analyzedAt;
            return this;
        }

        public Builder duration(Duration duration) {
            this.duration = duration;
            return this;
        }

        public Builder findings(List<Finding> findings) {
            this.findings = findings;
            return this;
        }

        public Builder suppressedCount(int suppressedCount) {
            this.suppressedCount = suppressedCount;
            return this;
        }

        public Builder cycles(List<Cycle> cycles) {
            this.cycles = cycles;
            return this;
        }

        public Builder topologicalOrder(List<String> topologicalOrder) {
            this.topologicalOrder = topologicalOrder;
            return this;
        }

        public Builder excludedFromOrder(List<String> excludedFromOrder) {
            this.excludedFromOrder = excludedFromOrder;
            return this;
        }

        public Builder criticalPath(List<String> criticalPath) {
            this.criticalPath = criticalPath;
            return this;
        }

        public Builder changedNodes(List<String> changedNodes) {
            this.changedNodes = changedNodes;
            return this;
        }

        public Builder affectedNodes(Map<String, Integer> affectedNodes) {
            this.affectedNodes = affectedNodes;
            return this;
        }

        public Builder metrics(ArchitectureMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public AnalysisReport build() {
            return new AnalysisReport(source, analyzedAt, duration, findings, suppressedCount, cycles,
                    topologicalOrder, excludedFromOrder, criticalPath, changedNodes, affectedNodes, metrics);
        }
    }
}
