package io.repoinsight.model;

/**
 * Summary numbers of one graph analysis.
 *
 * @param totalModules         Number of nodes
 * @param totalDependencies    Number of edges
 * @param circularDependencies Number of distinct cycles
 * @param layerViolations      Number of edges crossing layers against the layer table
 * @param averageCoupling      Mean of fan-in plus fan-out, two decimals
 * @param layerHealth          {@code max(0, 100 - violations / modules * 100)}, 100 for an empty graph
 * @param architectureScore    {@code max(0, 100 - (critical * 20 + high * 10 + medium * 5))} over reported findings
 */
public record ArchitectureMetrics(
        int totalModules,
        int totalDependencies,
        int circularDependencies,
        int layerViolations,
        double averageCoupling,
        double layerHealth,
        double architectureScore
) {}
