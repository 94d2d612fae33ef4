package io.repoinsight.confidence;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Confidence bands over the 0-100 score.
 */
public enum ConfidenceLevel {
    VERY_HIGH("very-high", 90),
    HIGH("high", 75),
    MEDIUM("medium", 50),
    LOW("low", 30),
    VERY_LOW("very-low", 0);

    private final String label;
    private final int minScore;

    ConfidenceLevel(String label, int minScore) {
        this.label = label;
        this.minScore = minScore;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public int minScore() {
        return minScore;
    }

    public static ConfidenceLevel fromScore(int score) {
        for (ConfidenceLevel level : values()) {
            if (score >= level.minScore) {
                return level;
            }
        }
        return VERY_LOW;
    }
}
