package io.repoinsight.graph;

import java.util.Comparator;
import java.util.List;

/**
 * Fan-in/fan-out coupling metrics.
 */
public class CouplingMetrics {

    /**
     * Returns coupling for every node in graph order.
     */
    public List<NodeCoupling> compute(DependencyGraph graph) {
        return graph.nodeIds().stream()
                .map(id -> of(graph, id))
                .toList();
    }

    public NodeCoupling of(DependencyGraph graph, String nodeId) {
        return new NodeCoupling(nodeId, graph.fanIn(nodeId), graph.fanOut(nodeId));
    }

    /**
     * Mean of fanIn + fanOut over all nodes; 0 for an empty graph.
     */
    public double averageCoupling(DependencyGraph graph) {
        return compute(graph).stream()
                .mapToInt(NodeCoupling::coupling)
                .average()
                .orElse(0.0);
    }

    /**
     * Nodes whose coupling exceeds the limit, most coupled first.
     */
    public List<NodeCoupling> highlyCoupled(DependencyGraph graph, int maxCoupling) {
        return compute(graph).stream()
                .filter(c -> c.coupling() > maxCoupling)
                .sorted(Comparator.comparingInt(NodeCoupling::coupling).reversed())
                .toList();
    }
}
