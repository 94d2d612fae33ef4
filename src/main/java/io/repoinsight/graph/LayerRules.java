package io.repoinsight.graph;

import java.util.*;
import java.util.function.Function;

/**
 * Checks dependency edges against an allowed-transition table between layers.
 * <p>
 * The table is the partial order itself, already transitively closed: a layer may depend on the
 * layers listed for it and always on itself. {@code UI -> Services} and {@code Services -> Data}
 * do not imply {@code UI -> Data}. Edges with an endpoint outside every layer are not checked.
 */
public class LayerRules {

    private final Function<String, Optional<String>> classifier;
    private final Map<String, Set<String>> allowed;

    /**
     * @param classifier         Maps a node id to its layer, or empty when the node is unclassified
     * @param allowedTransitions Layer -> every layer it may depend on
     */
    public LayerRules(Function<String, Optional<String>> classifier, Map<String, Set<String>> allowedTransitions) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        Map<String, Set<String>> table = new HashMap<>();
        allowedTransitions.forEach((layer, targets) -> table.put(layer, Set.copyOf(targets)));
        this.allowed = Map.copyOf(table);
    }

    /**
     * Rules from layer definitions; a node belongs to the first layer whose glob matches.
     */
    public static LayerRules fromDefinitions(List<LayerDefinition> layers) {
        List<LayerDefinition> ordered = List.copyOf(layers);
        Map<String, Set<String>> table = new LinkedHashMap<>();
        for (LayerDefinition layer : ordered) {
            table.put(layer.name(), layer.allowedDependencies());
        }
        Function<String, Optional<String>> classifier = nodeId -> ordered.stream()
                .filter(layer -> layer.matches(nodeId))
                .map(LayerDefinition::name)
                .findFirst();
        return new LayerRules(classifier, table);
    }

    public Optional<String> layerOf(String nodeId) {
        return classifier.apply(nodeId);
    }

    /**
     * Returns true if code in {@code fromLayer} may depend on code in {@code toLayer}.
     */
    public boolean isAllowed(String fromLayer, String toLayer) {
        if (fromLayer.equals(toLayer)) {
            return true;
        }
        return allowed.getOrDefault(fromLayer, Set.of()).contains(toLayer);
    }

    /**
     * Returns every edge whose target layer is not allowed for its source layer.
     */
    public List<BoundaryViolation> boundaryViolations(DependencyGraph graph) {
        Map<String, Optional<String>> layerCache = new HashMap<>();
        List<BoundaryViolation> violations = new ArrayList<>();

        for (GraphEdge edge : graph.edges()) {
            Optional<String> fromLayer = layerCache.computeIfAbsent(edge.from(), this::layerOf);
            Optional<String> toLayer = layerCache.computeIfAbsent(edge.to(), this::layerOf);
            if (fromLayer.isEmpty() || toLayer.isEmpty()) {
                continue;
            }
            if (!isAllowed(fromLayer.get(), toLayer.get())) {
                violations.add(new BoundaryViolation(edge, fromLayer.get(), toLayer.get()));
            }
        }
        return violations;
    }
}
