package io.repoinsight.graph;

import java.util.*;

/**
 * Finds dependency cycles with a depth-first traversal.
 * <p>
 * When the traversal reaches a node that is still on the recursion stack, the cycle is the
 * slice of the current path from that node's first occurrence to the current node. Cycles are
 * deduplicated by their sorted node set, so a cycle is reported once whichever node the
 * traversal entered it from. All traversal state is passed explicitly; instances hold no
 * mutable state and may be shared.
 */
public class CycleDetector {

    private final Set<EdgeKind> edgeKinds;

    /**
     * Detector over every edge kind.
     */
    public CycleDetector() {
        this(EnumSet.allOf(EdgeKind.class));
    }

    public CycleDetector(Set<EdgeKind> edgeKinds) {
        if (edgeKinds == null || edgeKinds.isEmpty()) {
            throw new IllegalArgumentException("edgeKinds cannot be null or empty");
        }
        this.edgeKinds = Set.copyOf(edgeKinds);
    }

    /**
     * Returns the distinct cycles of the graph in discovery order.
     */
    public List<Cycle> detectCycles(DependencyGraph graph) {
        Map<String, Cycle> unique = new LinkedHashMap<>();
        Set<String> visited = new HashSet<>();

        for (String start : graph.nodeIds()) {
            if (!visited.contains(start)) {
                visit(graph, start, visited, new HashSet<>(), new ArrayList<>(), unique);
            }
        }
        return List.copyOf(unique.values());
    }

    private void visit(DependencyGraph graph,
                       String node,
                       Set<String> visited,
                       Set<String> onStack,
                       List<String> path,
                       Map<String, Cycle> unique) {
        visited.add(node);
        onStack.add(node);
        path.add(node);

        for (String next : graph.successors(node, edgeKinds)) {
            if (onStack.contains(next)) {
                int from = path.indexOf(next);
                Cycle cycle = Cycle.of(new ArrayList<>(path.subList(from, path.size())));
                unique.putIfAbsent(cycle.canonicalKey(), cycle);
            } else if (!visited.contains(next)) {
                visit(graph, next, visited, onStack, path, unique);
            }
        }

        path.remove(path.size() - 1);
        onStack.remove(node);
    }
}
