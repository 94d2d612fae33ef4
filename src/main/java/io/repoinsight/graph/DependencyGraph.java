package io.repoinsight.graph;

import java.util.*;

/**
 * Directed dependency graph over files or packages.
 * <p>
 * Immutable once built. Nodes keep insertion order so every traversal over the graph is
 * deterministic. Any node referenced by an edge is registered implicitly, so construction
 * never fails on a dangling reference.
 */
public final class DependencyGraph {

    private final Map<String, GraphNode> nodes;
    private final List<GraphEdge> edges;
    private final Map<String, List<GraphEdge>> outgoing;
    private final Map<String, List<GraphEdge>> incoming;

    private DependencyGraph(Map<String, GraphNode> nodes, Collection<GraphEdge> edges) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.edges = List.copyOf(edges);

        Map<String, List<GraphEdge>> out = new LinkedHashMap<>();
        Map<String, List<GraphEdge>> in = new LinkedHashMap<>();
        for (String id : nodes.keySet()) {
            out.put(id, new ArrayList<>());
            in.put(id, new ArrayList<>());
        }
        for (GraphEdge edge : edges) {
            out.get(edge.from()).add(edge);
            in.get(edge.to()).add(edge);
        }
        this.outgoing = freeze(out);
        this.incoming = freeze(in);
    }

    private static Map<String, List<GraphEdge>> freeze(Map<String, List<GraphEdge>> map) {
        Map<String, List<GraphEdge>> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Builds a graph from adjacency facts. Unseen targets become nodes of kind {@link NodeKind#FILE}.
     */
    public static DependencyGraph fromAdjacency(List<AdjacencyFact> facts) {
        Builder builder = builder();
        for (AdjacencyFact fact : facts) {
            builder.addFact(fact);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<GraphNode> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    /**
     * Returns all nodes in insertion order.
     */
    public Collection<GraphNode> nodes() {
        return nodes.values();
    }

    /**
     * Returns all node ids in insertion order.
     */
    public List<String> nodeIds() {
        return List.copyOf(nodes.keySet());
    }

    public List<GraphEdge> edges() {
        return edges;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public List<GraphEdge> outgoing(String id) {
        return outgoing.getOrDefault(id, List.of());
    }

    public List<GraphEdge> incoming(String id) {
        return incoming.getOrDefault(id, List.of());
    }

    /**
     * Returns the ids this node depends on over edges of the given kinds, in edge order.
     */
    public List<String> successors(String id, Set<EdgeKind> kinds) {
        return outgoing(id).stream()
                .filter(e -> kinds.contains(e.kind()))
                .map(GraphEdge::to)
                .toList();
    }

    /**
     * Returns the ids that depend on this node over edges of the given kinds, in edge order.
     */
    public List<String> predecessors(String id, Set<EdgeKind> kinds) {
        return incoming(id).stream()
                .filter(e -> kinds.contains(e.kind()))
                .map(GraphEdge::from)
                .toList();
    }

    /**
     * Number of incoming edges (of any kind). Zero for unknown nodes.
     */
    public int fanIn(String id) {
        return incoming(id).size();
    }

    /**
     * Number of outgoing edges (of any kind). Zero for unknown nodes.
     */
    public int fanOut(String id) {
        return outgoing(id).size();
    }

    /**
     * Builder for constructing the graph incrementally.
     */
    public static class Builder {
        private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
        private final Set<String> implicitNodes = new HashSet<>();
        private final Map<EdgeKey, GraphEdge> edges = new LinkedHashMap<>();

        private record EdgeKey(String from, String to, EdgeKind kind) {}

        /**
         * Adds or replaces a node. An explicit node replaces one that was registered implicitly
         * or added earlier.
         */
        public Builder addNode(GraphNode node) {
            nodes.put(node.id(), node);
            implicitNodes.remove(node.id());
            return this;
        }

        public Builder addNode(String id, NodeKind kind) {
            return addNode(new GraphNode(id, kind, Map.of()));
        }

        public Builder addEdge(String from, String to) {
            return addEdge(new GraphEdge(from, to, EdgeKind.DEPENDENCY, GraphEdge.DEFAULT_WEIGHT));
        }

        public Builder addEdge(String from, String to, EdgeKind kind) {
            return addEdge(new GraphEdge(from, to, kind, GraphEdge.DEFAULT_WEIGHT));
        }

        /**
         * Adds an edge, registering either endpoint if unseen. A repeated
         * (from, to, kind) edge is merged into the existing one by summing weights.
         */
        public Builder addEdge(GraphEdge edge) {
            registerImplicitly(edge.from());
            registerImplicitly(edge.to());
            edges.merge(new EdgeKey(edge.from(), edge.to(), edge.kind()), edge,
                    (existing, added) -> new GraphEdge(existing.from(), existing.to(), existing.kind(),
                            existing.weight() + added.weight()));
            return this;
        }

        /**
         * Adds one adjacency fact. The fact's node kind applies unless the node was
         * already added explicitly.
         */
        public Builder addFact(AdjacencyFact fact) {
            if (!nodes.containsKey(fact.nodeId()) || implicitNodes.contains(fact.nodeId())) {
                addNode(fact.nodeId(), fact.nodeKind());
            }
            for (String target : fact.targets()) {
                if (target == null || target.isBlank()) {
                    continue;
                }
                addEdge(new GraphEdge(fact.nodeId(), target, fact.edgeKind(), GraphEdge.DEFAULT_WEIGHT));
            }
            return this;
        }

        private void registerImplicitly(String id) {
            if (!nodes.containsKey(id)) {
                nodes.put(id, new GraphNode(id, NodeKind.FILE, Map.of()));
                implicitNodes.add(id);
            }
        }

        public DependencyGraph build() {
            return new DependencyGraph(nodes, edges.values());
        }
    }
}
