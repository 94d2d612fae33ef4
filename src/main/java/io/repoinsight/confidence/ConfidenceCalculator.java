package io.repoinsight.confidence;

import java.util.ArrayList;
import java.util.List;

/**
 * Weighted-factor confidence scoring. Stateless.
 * <p>
 * {@code score = round(0.4 * pattern + 0.3 * context + 0.2 * structure + 0.1 * historical)},
 * with every factor clamped to 0..100 first.
 */
public class ConfidenceCalculator {

    static final double PATTERN_WEIGHT = 0.4;
    static final double CONTEXT_WEIGHT = 0.3;
    static final double STRUCTURE_WEIGHT = 0.2;
    static final double HISTORICAL_WEIGHT = 0.1;

    public ConfidenceScore calculate(ConfidenceFactors factors) {
        double pattern = clamp(factors.patternMatch()) * PATTERN_WEIGHT;
        double context = clamp(factors.context()) * CONTEXT_WEIGHT;
        double structure = clamp(factors.structure()) * STRUCTURE_WEIGHT;
        double historical = clamp(factors.historicalOrDefault()) * HISTORICAL_WEIGHT;

        int score = (int) Math.max(0, Math.min(100, Math.round(pattern + context + structure + historical)));
        ConfidenceLevel level = ConfidenceLevel.fromScore(score);
        ConfidenceScore.Breakdown breakdown = new ConfidenceScore.Breakdown(
                (int) Math.round(pattern),
                (int) Math.round(context),
                (int) Math.round(structure),
                (int) Math.round(historical));
        return new ConfidenceScore(score, level, breakdown, explain(score, level, factors));
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0;
        }
        return Math.max(0, Math.min(100, value));
    }

    static String explain(int score, ConfidenceLevel level, ConfidenceFactors factors) {
        List<String> parts = new ArrayList<>(4);
        double pattern = clamp(factors.patternMatch());
        double context = clamp(factors.context());
        double structure = clamp(factors.structure());
        double historical = clamp(factors.historicalOrDefault());

        if (pattern >= 90) {
            parts.add("exact pattern match");
        } else if (pattern >= 70) {
            parts.add("strong pattern match");
        } else if (pattern >= 50) {
            parts.add("moderate pattern match");
        } else {
            parts.add("weak pattern match");
        }

        if (context >= 80) {
            parts.add("highly appropriate context");
        } else if (context >= 60) {
            parts.add("appropriate context");
        } else if (context >= 40) {
            parts.add("questionable context");
        } else {
            parts.add("wrong context - likely false positive");
        }

        if (structure >= 70) {
            parts.add("good code structure");
        } else if (structure >= 50) {
            parts.add("acceptable structure");
        } else {
            parts.add("poor structure");
        }

        if (historical >= 85) {
            parts.add("excellent historical accuracy");
        } else if (historical >= 70) {
            parts.add("good historical accuracy");
        } else if (historical >= 50) {
            parts.add("moderate historical accuracy");
        } else {
            parts.add("low historical accuracy");
        }

        return score + "% " + level.label() + ": " + String.join(", ", parts);
    }
}
