package io.repoinsight.config;

import java.nio.file.Path;
import java.util.Map;

/**
 * Options of the pattern-learning store.
 *
 * @param enabled                   When false, outcomes are still recorded but scores are not adjusted
 * @param minDetectionsForStability Detections needed before history adjusts a score or auto-skips
 * @param deprecateAfterDays        Age after which deprecated patterns are deleted by cleanup
 * @param autoSkipThreshold         False-positive rate above which a pattern is suppressed
 * @param confidenceBoost           Fraction of 100 added for consistently correct patterns
 * @param confidencePenalty         Fraction of 100 removed for frequently wrong patterns
 * @param enableAutoFixSuggestions  Whether stored fixes are offered
 * @param autoFixMinConfidence      Minimum confidence for a fix to be offered
 * @param statePath                 File the learned state is persisted to
 */
public record LearningConfig(
        boolean enabled,
        int minDetectionsForStability,
        int deprecateAfterDays,
        double autoSkipThreshold,
        double confidenceBoost,
        double confidencePenalty,
        boolean enableAutoFixSuggestions,
        int autoFixMinConfidence,
        Path statePath
) {

    public static final Path DEFAULT_STATE_PATH = Path.of(".repo-insight", "patterns.json");

    public LearningConfig {
        if (minDetectionsForStability < 0) {
            throw new IllegalArgumentException("minDetectionsForStability must be >= 0, got " + minDetectionsForStability);
        }
        if (deprecateAfterDays < 0) {
            throw new IllegalArgumentException("deprecateAfterDays must be >= 0, got " + deprecateAfterDays);
        }
        requireFraction("autoSkipThreshold", autoSkipThreshold);
        requireFraction("confidenceBoost", confidenceBoost);
        requireFraction("confidencePenalty", confidencePenalty);
        if (autoFixMinConfidence < 0 || autoFixMinConfidence > 100) {
            throw new IllegalArgumentException("autoFixMinConfidence must be within 0..100, got " + autoFixMinConfidence);
        }
        if (statePath == null) {
            statePath = DEFAULT_STATE_PATH;
        }
    }

    private static void requireFraction(String name, double value) {
        if (Double.isNaN(value) || value < 0 || value > 1) {
            throw new IllegalArgumentException(name + " must be within 0..1, got " + value);
        }
    }

    public static LearningConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .enabled(enabled)
                .minDetectionsForStability(minDetectionsForStability)
                .deprecateAfterDays(deprecateAfterDays)
                .autoSkipThreshold(autoSkipThreshold)
                .confidenceBoost(confidenceBoost)
                .confidencePenalty(confidencePenalty)
                .enableAutoFixSuggestions(enableAutoFixSuggestions)
                .autoFixMinConfidence(autoFixMinConfidence)
                .statePath(statePath);
    }

    /**
     * Reads the {@code learning} YAML section; missing keys keep the values of {@code base}.
     */
    static LearningConfig fromMap(Map<String, Object> section, LearningConfig base) {
        Builder builder = base.toBuilder();
        if (section == null) {
            return builder.build();
        }
        ConfigValues values = new ConfigValues("learning", section);
        values.bool("enabled").ifPresent(builder::enabled);
        values.integer("minDetectionsForStability").ifPresent(builder::minDetectionsForStability);
        values.integer("deprecateAfterDays").ifPresent(builder::deprecateAfterDays);
        values.decimal("autoSkipThreshold").ifPresent(builder::autoSkipThreshold);
        values.decimal("confidenceBoost").ifPresent(builder::confidenceBoost);
        values.decimal("confidencePenalty").ifPresent(builder::confidencePenalty);
        values.bool("enableAutoFixSuggestions").ifPresent(builder::enableAutoFixSuggestions);
        values.integer("autoFixMinConfidence").ifPresent(builder::autoFixMinConfidence);
        values.string("statePath").ifPresent(path -> builder.statePath(Path.of(path)));
        return builder.build();
    }

    public static class Builder {
        private boolean enabled = true;
        private int minDetectionsForStability = 10;
        private int deprecateAfterDays = 90;
        private double autoSkipThreshold = 0.7;
        private double confidenceBoost = 0.15;
        private double confidencePenalty = 0.25;
        private boolean enableAutoFixSuggestions;
        private int autoFixMinConfidence = 85;
        private Path statePath = DEFAULT_STATE_PATH;

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder minDetectionsForStability(int minDetectionsForStability) {
            this.minDetectionsForStability = minDetectionsForStability;
            return this;
        }

        public Builder deprecateAfterDays(int deprecateAfterDays) {
            this.deprecateAfterDays = deprecateAfterDays;
            return this;
        }

        public Builder autoSkipThreshold(double autoSkipThreshold) {
            this.autoSkipThreshold = autoSkipThreshold;
            return this;
        }

        public Builder confidenceBoost(double confidenceBoost) {
            this.confidenceBoost = confidenceBoost;
            return this;
        }

        public Builder confidencePenalty(double confidencePenalty) {
            this.confidencePenalty = confidencePenalty;
            return this;
        }

        public Builder enableAutoFixSuggestions(boolean enableAutoFixSuggestions) {
            this.enableAutoFixSuggestions = enableAutoFixSuggestions;
            return this;
        }

        public Builder autoFixMinConfidence(int autoFixMinConfidence) {
            this.autoFixMinConfidence = autoFixMinConfidence;
            return this;
        }

        public Builder statePath(Path statePath) {
            this.statePath = statePath;
            return this;
        }

        public LearningConfig build() {
            return new LearningConfig(enabled, minDetectionsForStability, deprecateAfterDays, autoSkipThreshold,
                    confidenceBoost, confidencePenalty, enableAutoFixSuggestions, autoFixMinConfidence, statePath);
        }
    }
}
