package io.repoinsight.graph;

import java.util.*;

/**
 * Computes which nodes are affected when some nodes change.
 * <p>
 * Walks edges backwards (breadth-first) from the changed nodes: every node that depends on a
 * changed node, directly or transitively, is affected. The visited set makes cyclic graphs safe.
 */
public class ImpactAnalyzer {

    private final Set<EdgeKind> edgeKinds;

    public ImpactAnalyzer() {
        this(EnumSet.allOf(EdgeKind.class));
    }

    public ImpactAnalyzer(Set<EdgeKind> edgeKinds) {
        this.edgeKinds = Set.copyOf(edgeKinds);
    }

    /**
     * Returns the ancestors of the changed nodes. The changed nodes themselves are not included;
     * ids unknown to the graph are ignored.
     */
    public Set<String> getAffected(DependencyGraph graph, Set<String> changedNodeIds) {
        return Collections.unmodifiableSet(affectedWithDistance(graph, changedNodeIds).keySet());
    }

    /**
     * Returns each affected node with its shortest reverse distance to a changed node,
     * in discovery order.
     */
    public Map<String, Integer> affectedWithDistance(DependencyGraph graph, Set<String> changedNodeIds) {
        Map<String, Integer> distance = new LinkedHashMap<>();
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();

        for (String changed : changedNodeIds) {
            if (graph.contains(changed) && visited.add(changed)) {
                queue.add(changed);
            }
        }
        Map<String, Integer> depth = new HashMap<>();
        queue.forEach(id -> depth.put(id, 0));

        while (!queue.isEmpty()) {
            String current = queue.poll();
            int next = depth.get(current) + 1;
            for (String dependent : graph.predecessors(current, edgeKinds)) {
                if (visited.add(dependent)) {
                    depth.put(dependent, next);
                    distance.put(dependent, next);
                    queue.add(dependent);
                }
            }
        }
        return Collections.unmodifiableMap(distance);
    }
}
