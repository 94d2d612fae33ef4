package io.repoinsight.analysis;

import io.repoinsight.model.AnalysisReport;

import java.time.Instant;

/**
 * Graph size recorded by a previous analysis, used to detect architecture drift.
 *
 * @param source     Graph source of the recorded analysis
 * @param recordedAt When that analysis ran
 * @param nodeCount  Modules in the graph
 * @param edgeCount  Dependencies in the graph
 */
public record ArchitectureBaseline(String source, Instant recordedAt, int nodeCount, int edgeCount) {

    public ArchitectureBaseline {
        if (nodeCount < 0 || edgeCount < 0) {
            throw new IllegalArgumentException("counts must be >= 0, got " + nodeCount + " nodes and "
                    + edgeCount + " edges");
        }
    }

    public static ArchitectureBaseline of(AnalysisReport report) {
        return new ArchitectureBaseline(report.source(), report.analyzedAt(),
                report.metrics().totalModules(), report.metrics().totalDependencies());
    }
}
