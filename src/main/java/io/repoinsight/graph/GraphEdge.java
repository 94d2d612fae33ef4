package io.repoinsight.graph;

/**
 * A directed, typed, weighted edge: {@code from} depends on {@code to}.
 */
public record GraphEdge(String from, String to, EdgeKind kind, double weight) {

    public static final double DEFAULT_WEIGHT = 1.0;

    public GraphEdge {
        if (from == null || from.isBlank()) {
            throw new IllegalArgumentException("from cannot be null or blank");
        }
        if (to == null || to.isBlank()) {
            throw new IllegalArgumentException("to cannot be null or blank");
        }
        if (kind == null) {
            kind = EdgeKind.DEPENDENCY;
        }
        if (weight < 0 || Double.isNaN(weight)) {
            throw new IllegalArgumentException("weight must be a non-negative number: " + weight);
        }
    }

    public static GraphEdge of(String from, String to) {
        return new GraphEdge(from, to, EdgeKind.DEPENDENCY, DEFAULT_WEIGHT);
    }

    public boolean isSelfLoop() {
        return from.equals(to);
    }

    /**
     * Returns "from -> to".
     */
    public String formatted() {
        return from + " -> " + to;
    }
}
