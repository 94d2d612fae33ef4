package io.repoinsight.config;

import io.repoinsight.graph.LayerDefinition;
import io.repoinsight.graph.LayerRules;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Layer table and coupling limit used by structural analysis.
 *
 * @param maxCoupling Fan-in plus fan-out above which a node is reported as highly coupled
 * @param layers      Ordered layer definitions; a node belongs to the first matching layer
 */
public record ArchitectureConfig(int maxCoupling, List<LayerDefinition> layers) {

    public static final int DEFAULT_MAX_COUPLING = 10;

    public ArchitectureConfig {
        if (maxCoupling < 0) {
            throw new IllegalArgumentException("maxCoupling must be >= 0, got " + maxCoupling);
        }
        layers = layers == null ? List.of() : List.copyOf(layers);
    }

    /**
     * UI, Services, Data and Utils, each allowed to depend on the layers below it.
     */
    public static ArchitectureConfig defaults() {
        return new ArchitectureConfig(DEFAULT_MAX_COUPLING, List.of(
                new LayerDefinition("UI", "**/components/**", new LinkedHashSet<>(List.of("UI", "Services", "Utils"))),
                new LayerDefinition("Services", "**/services/**", new LinkedHashSet<>(List.of("Services", "Data", "Utils"))),
                new LayerDefinition("Data", "**/data/**", new LinkedHashSet<>(List.of("Data", "Utils"))),
                new LayerDefinition("Utils", "**/utils/**", new LinkedHashSet<>(List.of("Utils")))
        ));
    }

    public LayerRules layerRules() {
        return LayerRules.fromDefinitions(layers);
    }

    /**
     * Reads the {@code architecture} YAML section. A {@code layers} list replaces the base table.
     */
    static ArchitectureConfig fromMap(Map<String, Object> section, ArchitectureConfig base) {
        if (section == null) {
            return base;
        }
        ConfigValues values = new ConfigValues("architecture", section);
        int maxCoupling = values.integer("maxCoupling").orElse(base.maxCoupling());
        List<LayerDefinition> layers = values.maps("layers")
                .map(ArchitectureConfig::parseLayers)
                .orElse(base.layers());
        return new ArchitectureConfig(maxCoupling, layers);
    }

    private static List<LayerDefinition> parseLayers(List<Map<String, Object>> entries) {
        List<LayerDefinition> layers = new ArrayList<>();
        for (Map<String, Object> entry : entries) {
            ConfigValues layer = new ConfigValues("architecture.layers", entry);
            String name = layer.string("name")
                    .orElseThrow(() -> new IllegalArgumentException("architecture.layers entry is missing 'name'"));
            String pattern = layer.string("pattern")
                    .orElseThrow(() -> new IllegalArgumentException("layer " + name + " is missing 'pattern'"));
            List<String> allowed = layer.strings("allowedDependencies").orElse(List.of());
            layers.add(new LayerDefinition(name, pattern, new LinkedHashSet<>(allowed)));
        }
        return layers;
    }
}
