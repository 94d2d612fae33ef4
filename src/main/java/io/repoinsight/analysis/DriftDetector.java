package io.repoinsight.analysis;

import io.repoinsight.graph.DependencyGraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Compares a graph's size with the baseline of a previous analysis.
 * <p>
 * A module count change above {@value #MODULE_CHANGE_THRESHOLD} or a dependency count change above
 * {@value #DEPENDENCY_CHANGE_THRESHOLD} (relative to the baseline) is drift. A zero baseline count
 * has no relative change and is never drift.
 */
public class DriftDetector {

    public static final double MODULE_CHANGE_THRESHOLD = 0.2;
    public static final double DEPENDENCY_CHANGE_THRESHOLD = 0.3;

    /**
     * One measure that moved past its threshold.
     *
     * @param measure  "module" or "dependency"
     * @param previous Count in the baseline
     * @param current  Count now
     * @param change   |current - previous| / previous
     */
    public record Drift(String measure, int previous, int current, double change) {

        public String message() {
            return String.format(Locale.ROOT, "Significant %s count change: %d -> %d (%.1f%%)",
                    measure, previous, current, change * 100);
        }
    }

    public List<Drift> detect(ArchitectureBaseline baseline, DependencyGraph graph) {
        List<Drift> drifts = new ArrayList<>();
        check("module", baseline.nodeCount(), graph.nodeCount(), MODULE_CHANGE_THRESHOLD, drifts);
        check("dependency", baseline.edgeCount(), graph.edgeCount(), DEPENDENCY_CHANGE_THRESHOLD, drifts);
        return drifts;
    }

    private static void check(String measure, int previous, int current, double threshold, List<Drift> drifts) {
        if (previous == 0) {
            return;
        }
        double change = Math.abs(current - previous) / (double) previous;
        if (change > threshold) {
            drifts.add(new Drift(measure, previous, current, change));
        }
    }
}
