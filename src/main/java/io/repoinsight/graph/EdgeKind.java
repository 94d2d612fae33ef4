package io.repoinsight.graph;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Types of dependency edges.
 */
public enum EdgeKind {
    /**
     * Runtime/production dependency (an import, a package dependency).
     */
    DEPENDENCY("dependency"),

    /**
     * Development-only dependency (tests, build tooling).
     */
    DEV_DEPENDENCY("dev-dependency");

    private final String label;

    EdgeKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static EdgeKind fromLabel(String value) {
        for (EdgeKind kind : values()) {
            if (kind.label.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown edge kind: " + value);
    }
}
