package io.repoinsight.graph;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What a graph node stands for.
 */
public enum NodeKind {
    FILE("file"),
    PACKAGE("package");

    private final String label;

    NodeKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static NodeKind fromLabel(String value) {
        for (NodeKind kind : values()) {
            if (kind.label.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown node kind: " + value);
    }
}
