package io.repoinsight.confidence;

/**
 * Raw factor scores of one finding, each on a 0-100 scale.
 *
 * @param patternMatch Strength of the heuristic match
 * @param context      How appropriate the surrounding context is for the finding
 * @param structure    Quality of the surrounding code structure
 * @param historical   Historical accuracy of this kind of finding, or null when unknown
 */
public record ConfidenceFactors(double patternMatch, double context, double structure, Double historical) {

    public static final double DEFAULT_HISTORICAL = 75;

    public static ConfidenceFactors of(double patternMatch, double context, double structure) {
        return new ConfidenceFactors(patternMatch, context, structure, null);
    }

    public static ConfidenceFactors of(double patternMatch, double context, double structure, double historical) {
        return new ConfidenceFactors(patternMatch, context, structure, historical);
    }

    public ConfidenceFactors withHistorical(double historical) {
        return new ConfidenceFactors(patternMatch, context, structure, historical);
    }

    public double historicalOrDefault() {
        return historical != null ? historical : DEFAULT_HISTORICAL;
    }
}
