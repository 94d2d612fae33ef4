package io.repoinsight.graph;

import java.util.*;

/**
 * Orders nodes so that every node comes before the nodes it depends on (Kahn's algorithm).
 * <p>
 * Only {@link EdgeKind#DEPENDENCY} edges are counted. Nodes on a cycle, and nodes that depend
 * on them only through it, never reach zero in-degree and are left out of the order. That
 * omission is how a cycle shows up here; it is not an error.
 */
public class TopologicalOrderer {

    private static final Set<EdgeKind> ORDERED_KINDS = EnumSet.of(EdgeKind.DEPENDENCY);

    /**
     * Result of one ordering pass.
     *
     * @param order    Node ids in dependency-respecting order
     * @param excluded Node ids that could not be ordered, in graph insertion order
     */
    public record Ordering(List<String> order, List<String> excluded) {
        public Ordering {
            order = List.copyOf(order);
            excluded = List.copyOf(excluded);
        }

        public boolean isComplete() {
            return excluded.isEmpty();
        }
    }

    /**
     * Returns the topological order, omitting nodes that cannot be ordered.
     */
    public List<String> getTopologicalOrder(DependencyGraph graph) {
        return order(graph).order();
    }

    public Ordering order(DependencyGraph graph) {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (String id : graph.nodeIds()) {
            inDegree.put(id, graph.predecessors(id, ORDERED_KINDS).size());
        }

        Deque<String> ready = new ArrayDeque<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                ready.add(id);
            }
        });

        List<String> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            String current = ready.poll();
            order.add(current);
            for (String next : graph.successors(current, ORDERED_KINDS)) {
                int remaining = inDegree.merge(next, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(next);
                }
            }
        }

        Set<String> ordered = new HashSet<>(order);
        List<String> excluded = graph.nodeIds().stream()
                .filter(id -> !ordered.contains(id))
                .toList();
        return new Ordering(order, excluded);
    }
}
