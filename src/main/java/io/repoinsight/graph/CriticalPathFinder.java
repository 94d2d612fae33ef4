package io.repoinsight.graph;

import java.util.*;

/**
 * Finds the longest chain of internal dependencies (by node count).
 * <p>
 * Exhaustive depth-first search from every node over {@link EdgeKind#DEPENDENCY} edges. A node
 * already on the current path is never revisited, so cyclic input terminates. The search is
 * exponential in the worst case; callers bound the graph size. Ties keep the chain found first.
 */
public class CriticalPathFinder {

    private static final Set<EdgeKind> PATH_KINDS = EnumSet.of(EdgeKind.DEPENDENCY);

    /**
     * Returns the longest chain, or an empty list for an empty graph.
     */
    public List<String> getCriticalPath(DependencyGraph graph) {
        List<String> best = new ArrayList<>();
        for (String start : graph.nodeIds()) {
            List<String> path = new ArrayList<>();
            Set<String> onPath = new HashSet<>();
            best = extend(graph, start, path, onPath, best);
        }
        return List.copyOf(best);
    }

    private List<String> extend(DependencyGraph graph,
                                String node,
                                List<String> path,
                                Set<String> onPath,
                                List<String> best) {
        path.add(node);
        onPath.add(node);

        if (path.size() > best.size()) {
            best = new ArrayList<>(path);
        }
        for (String next : graph.successors(node, PATH_KINDS)) {
            if (!onPath.contains(next)) {
                best = extend(graph, next, path, onPath, best);
            }
        }

        onPath.remove(node);
        path.remove(path.size() - 1);
        return best;
    }
}
