package io.repoinsight.graph;

/**
 * An edge that crosses layers in a direction the layer table does not allow.
 */
public record BoundaryViolation(GraphEdge edge, String fromLayer, String toLayer) {

    public String message() {
        return "Layer violation: " + fromLayer + " layer should not depend on " + toLayer + " layer ("
                + edge.formatted() + ")";
    }
}
