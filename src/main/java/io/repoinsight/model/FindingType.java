package io.repoinsight.model;

import com.fasterxml.jackson.annotation.JsonValue;
import io.repoinsight.confidence.ConfidenceFactors;

/**
 * Kinds of structural findings derived from a dependency graph.
 * Each kind carries the raw confidence factors its findings are scored with.
 */
public enum FindingType {
    CIRCULAR_DEPENDENCY("circular-dependency", "Circular Dependency",
            ConfidenceFactors.of(100, 90, 80)),
    LAYER_VIOLATION("layer-violation", "Layer Violation",
            ConfidenceFactors.of(90, 75, 70)),
    HIGH_COUPLING("high-coupling", "High Coupling",
            ConfidenceFactors.of(80, 60, 60)),
    ARCHITECTURE_DRIFT("architecture-drift", "Architecture Drift",
            ConfidenceFactors.of(70, 60, 50));

    private final String label;
    private final String displayName;
    private final ConfidenceFactors factors;

    FindingType(String label, String displayName, ConfidenceFactors factors) {
        this.label = label;
        this.displayName = displayName;
        this.factors = factors;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public String displayName() {
        return displayName;
    }

    public ConfidenceFactors factors() {
        return factors;
    }
}
