package io.repoinsight.confidence;

import io.repoinsight.learning.PatternContext;
import io.repoinsight.learning.PatternSignature;
import io.repoinsight.learning.PatternStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalDouble;

/**
 * Confidence scoring adjusted by what the {@link PatternStore} has learned.
 * <p>
 * Historical accuracy comes from, in order: the pattern's own success rate, its detector's
 * aggregate success rate, the caller's value, and the default of the detector's
 * {@link io.repoinsight.learning.PatternCategory}. Any store failure degrades to the plain
 * calculator result.
 */
public class AdaptiveConfidence {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveConfidence.class);

    static final String SUPPRESSED_NOTE = " (suppressed: pattern is skipped after repeated false positives)";

    private final PatternStore store;
    private final ConfidenceCalculator calculator;

    public AdaptiveConfidence(PatternStore store, ConfidenceCalculator calculator) {
        this.store = store;
        this.calculator = calculator != null ? calculator : new ConfidenceCalculator();
    }

    public AdaptiveConfidence(PatternStore store) {
        this(store, new ConfidenceCalculator());
    }

    /**
     * Scoring without a store: historical accuracy falls back to the caller's value or the
     * category default and no adjustment is applied.
     */
    public static AdaptiveConfidence withoutLearning() {
        return new AdaptiveConfidence(null, new ConfidenceCalculator());
    }

    public ConfidenceScore score(ConfidenceFactors factors, PatternSignature signature) {
        if (store == null) {
            return calculator.calculate(factors.withHistorical(fallbackAccuracy(factors, signature)));
        }
        try {
            return adjusted(factors, signature);
        } catch (RuntimeException e) {
            log.debug("Pattern store unavailable for {}: {}; using base confidence",
                    signature.patternId(), e.getMessage());
            return calculator.calculate(factors.withHistorical(fallbackAccuracy(factors, signature)));
        }
    }

    private ConfidenceScore adjusted(ConfidenceFactors factors, PatternSignature signature) {
        OptionalDouble learned = store.patternAccuracy(signature);
        double accuracy = learned.isPresent() ? learned.getAsDouble() * 100 : fallbackAccuracy(factors, signature);
        ConfidenceScore base = calculator.calculate(factors.withHistorical(accuracy));

        if (store.isSuppressed(signature)) {
            return new ConfidenceScore(0, ConfidenceLevel.VERY_LOW, base.breakdown(),
                    base.explanation() + SUPPRESSED_NOTE);
        }

        int score = store.adjustConfidence(signature, base.score());
        if (score == base.score()) {
            return base;
        }
        int delta = score - base.score();
        String note = " (adjusted " + (delta > 0 ? "+" : "") + delta + "% based on "
                + Math.round(accuracy) + "% historical accuracy)";
        return new ConfidenceScore(score, ConfidenceLevel.fromScore(score), base.breakdown(),
                base.explanation() + note);
    }

    private static double fallbackAccuracy(ConfidenceFactors factors, PatternSignature signature) {
        if (factors.historical() != null) {
            return factors.historical();
        }
        return signature.category().defaultAccuracy();
    }

    /**
     * True when the store suppresses the pattern. False without a store or when the store fails.
     */
    public boolean isSuppressed(PatternSignature signature) {
        if (store == null) {
            return false;
        }
        try {
            return store.isSuppressed(signature);
        } catch (RuntimeException e) {
            log.debug("Pattern store unavailable for {}: {}", signature.patternId(), e.getMessage());
            return false;
        }
    }

    /**
     * Feeds ground truth back to the store.
     *
     * @return false if there is no store or the store rejected the outcome
     */
    public boolean recordOutcome(PatternSignature signature, boolean correct, double confidence, PatternContext context) {
        if (store == null) {
            return false;
        }
        try {
            if (correct) {
                store.recordSuccess(signature, confidence, context);
            } else {
                store.recordFailure(signature, confidence, context);
            }
            return true;
        } catch (RuntimeException e) {
            log.debug("Failed to record outcome for {}: {}", signature.patternId(), e.getMessage());
            return false;
        }
    }
}
