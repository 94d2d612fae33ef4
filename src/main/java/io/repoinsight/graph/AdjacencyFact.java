package io.repoinsight.graph;

import java.util.List;

/**
 * One caller-supplied adjacency fact: a node and the nodes it depends on.
 *
 * @param nodeId   The depending node
 * @param targets  Nodes it depends on; unseen targets are registered implicitly
 * @param nodeKind Kind of {@code nodeId}
 * @param edgeKind Kind of every edge produced by this fact
 */
public record AdjacencyFact(String nodeId, List<String> targets, NodeKind nodeKind, EdgeKind edgeKind) {

    public AdjacencyFact {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("nodeId cannot be null or blank");
        }
        targets = targets == null ? List.of() : List.copyOf(targets);
        if (nodeKind == null) {
            nodeKind = NodeKind.FILE;
        }
        if (edgeKind == null) {
            edgeKind = EdgeKind.DEPENDENCY;
        }
    }

    public static AdjacencyFact of(String nodeId, String... targets) {
        return new AdjacencyFact(nodeId, List.of(targets), NodeKind.FILE, EdgeKind.DEPENDENCY);
    }

    public static AdjacencyFact of(String nodeId, List<String> targets) {
        return new AdjacencyFact(nodeId, targets, NodeKind.FILE, EdgeKind.DEPENDENCY);
    }
}
