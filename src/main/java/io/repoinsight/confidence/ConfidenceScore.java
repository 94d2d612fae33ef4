package io.repoinsight.confidence;

/**
 * A calibrated confidence with the contributions that produced it.
 *
 * @param score       Final score, 0-100
 * @param level       Band of {@code score}
 * @param breakdown   Weighted contribution of each factor
 * @param explanation Human-readable summary
 */
public record ConfidenceScore(int score, ConfidenceLevel level, Breakdown breakdown, String explanation) {

    public ConfidenceScore {
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("score must be within 0..100, got " + score);
        }
        if (level == null) {
            level = ConfidenceLevel.fromScore(score);
        }
    }

    /**
     * Weighted, rounded contribution of each factor to the base score.
     */
    public record Breakdown(int patternMatch, int context, int structure, int historical) {}
}
