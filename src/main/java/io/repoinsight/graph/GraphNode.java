package io.repoinsight.graph;

import java.util.Map;

/**
 * A file or package in the dependency graph. Identity is the id alone.
 *
 * @param id       Node id, usually a repository-relative path or a package name
 * @param kind     What the node stands for
 * @param metadata Free-form attributes supplied by the caller
 */
public record GraphNode(String id, NodeKind kind, Map<String, String> metadata) {

    public GraphNode {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (kind == null) {
            kind = NodeKind.FILE;
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static GraphNode file(String id) {
        return new GraphNode(id, NodeKind.FILE, Map.of());
    }

    public static GraphNode pkg(String id) {
        return new GraphNode(id, NodeKind.PACKAGE, Map.of());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof GraphNode other && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }
}
