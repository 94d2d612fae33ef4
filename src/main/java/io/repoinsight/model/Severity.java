package io.repoinsight.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity levels for structural findings.
 * Lower rank = more disruptive.
 */
public enum Severity {
    /**
     * Blocks a healthy architecture outright.
     */
    CRITICAL(1, "critical"),

    /**
     * Immediate mutual coupling, e.g. a direct two-node cycle.
     */
    HIGH(2, "high"),

    /**
     * Worth fixing, usually a longer cycle or moderate coupling.
     */
    MEDIUM(3, "medium"),

    /**
     * Long-range structure smell, unlikely to hurt on its own.
     */
    LOW(4, "low"),

    /**
     * Informational only.
     */
    INFO(5, "info");

    private final int rank;
    private final String label;

    Severity(int rank, String label) {
        this.rank = rank;
        this.label = label;
    }

    public int rank() {
        return rank;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Returns true if this severity is at least as severe as the given threshold.
     */
    public boolean isAtLeast(Severity threshold) {
        return this.rank <= threshold.rank;
    }

    /**
     * Parses a label such as "high" (case-insensitive).
     *
     * @throws IllegalArgumentException if the label is unknown
     */
    public static Severity fromLabel(String value) {
        for (Severity severity : values()) {
            if (severity.label.equalsIgnoreCase(value)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + value);
    }
}
