package io.repoinsight.graph;

import io.repoinsight.model.Severity;

import java.util.List;
import java.util.TreeSet;

/**
 * A dependency cycle.
 *
 * @param path     Node ids in traversal order; the last node depends on the first
 * @param length   Number of distinct nodes in the cycle
 * @param severity Severity derived from the length
 */
public record Cycle(List<String> path, int length, Severity severity) {

    public Cycle {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("path cannot be null or empty");
        }
        path = List.copyOf(path);
    }

    public static Cycle of(List<String> path) {
        return new Cycle(path, path.size(), severityFor(path.size()));
    }

    /**
     * Direct two-node cycles (and self-loops) are the most disruptive.
     */
    public static Severity severityFor(int length) {
        if (length <= 2) {
            return Severity.HIGH;
        }
        if (length <= 4) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    /**
     * Sorted node ids joined with '|'. Two cycles over the same node set share this key.
     */
    public String canonicalKey() {
        return String.join("|", new TreeSet<>(path));
    }

    /**
     * Returns "a -> b -> c -> a".
     */
    public String pathString() {
        return String.join(" -> ", path) + " -> " + path.get(0);
    }
}
