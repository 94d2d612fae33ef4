package io.repoinsight.learning;

/**
 * Aggregate statistics over every learned pattern.
 */
public record GlobalStats(
        int totalPatterns,
        int activePatterns,
        int deprecatedPatterns,
        long totalDetections,
        long totalCorrections,
        double overallSuccessRate,
        double overallFalsePositiveRate
) {
    public static GlobalStats empty() {
        return new GlobalStats(0, 0, 0, 0, 0, 0, 0);
    }
}
