package io.repoinsight.learning;

/**
 * Outcome counters and running averages of one learned pattern.
 * <p>
 * {@code successRate = successCount / detectionCount} and
 * {@code falsePositiveRate = failureCount / detectionCount}; both are 0 while nothing has been
 * detected. Rates are recomputed by every mutating method.
 */
public class PatternPerformance {

    private int detectionCount;
    private int successCount;
    private int failureCount;
    private int autoFixSuccessCount;
    private int autoFixFailureCount;
    private double successRate;
    private double falsePositiveRate;
    private double avgConfidence;
    private double avgSuccessConfidence;
    private double avgFailureConfidence;

    /**
     * Records one labelled detection and folds its confidence into the running means
     * with {@code avg' = (avg * (n - 1) + x) / n}.
     */
    public void recordOutcome(boolean success, double confidence) {
        detectionCount++;
        avgConfidence = incrementalMean(avgConfidence, detectionCount, confidence);
        if (success) {
            successCount++;
            avgSuccessConfidence = incrementalMean(avgSuccessConfidence, successCount, confidence);
        } else {
            failureCount++;
            avgFailureConfidence = incrementalMean(avgFailureConfidence, failureCount, confidence);
        }
        recomputeRates();
    }

    /**
     * Records a detection whose outcome is not known yet. Only the overall average moves.
     */
    public void recordDetection(double confidence) {
        detectionCount++;
        avgConfidence = incrementalMean(avgConfidence, detectionCount, confidence);
        recomputeRates();
    }

    public void recordAutoFix(boolean succeeded) {
        if (succeeded) {
            autoFixSuccessCount++;
        } else {
            autoFixFailureCount++;
        }
    }

    public void recomputeRates() {
        if (detectionCount == 0) {
            successRate = 0;
            falsePositiveRate = 0;
            return;
        }
        successRate = (double) successCount / detectionCount;
        falsePositiveRate = (double) failureCount / detectionCount;
    }

    private static double incrementalMean(double mean, int n, double value) {
        return (mean * (n - 1) + value) / n;
    }

    public PatternPerformance copy() {
        PatternPerformance copy = new PatternPerformance();
        copy.detectionCount = detectionCount;
        copy.successCount = successCount;
        copy.failureCount = failureCount;
        copy.autoFixSuccessCount = autoFixSuccessCount;
        copy.autoFixFailureCount = autoFixFailureCount;
        copy.successRate = successRate;
        copy.falsePositiveRate = falsePositiveRate;
        copy.avgConfidence = avgConfidence;
        copy.avgSuccessConfidence = avgSuccessConfidence;
        copy.avgFailureConfidence = avgFailureConfidence;
        return copy;
    }

    public int getDetectionCount() {
        return detectionCount;
    }

    public void setDetectionCount(int detectionCount) {
        this.detectionCount = detectionCount;
    }

    public int getSuccessCount() {
        return successCount;
    }

    public void setSuccessCount(int successCount) {
        this.successCount = successCount;
    }

    public int getFailureCount() {
        return failureCount;
    }

    public void setFailureCount(int failureCount) {
        this.failureCount = failureCount;
    }

    public int getAutoFixSuccessCount() {
        return autoFixSuccessCount;
    }

    public void setAutoFixSuccessCount(int autoFixSuccessCount) {
        this.autoFixSuccessCount = autoFixSuccessCount;
    }

    public int getAutoFixFailureCount() {
        return autoFixFailureCount;
    }

    public void setAutoFixFailureCount(int autoFixFailureCount) {
        this.autoFixFailureCount = autoFixFailureCount;
    }

    public double getSuccessRate() {
        return successRate;
    }

    public void setSuccessRate(double successRate) {
        this.successRate = successRate;
    }

    public double getFalsePositiveRate() {
        return falsePositiveRate;
    }

    public void setFalsePositiveRate(double falsePositiveRate) {
        this.falsePositiveRate = falsePositiveRate;
    }

    public double getAvgConfidence() {
        return avgConfidence;
    }

    public void setAvgConfidence(double avgConfidence) {
        this.avgConfidence = avgConfidence;
    }

    public double getAvgSuccessConfidence() {
        return avgSuccessConfidence;
    }

    public void setAvgSuccessConfidence(double avgSuccessConfidence) {
        this.avgSuccessConfidence = avgSuccessConfidence;
    }

    public double getAvgFailureConfidence() {
        return avgFailureConfidence;
    }

    public void setAvgFailureConfidence(double avgFailureConfidence) {
        this.avgFailureConfidence = avgFailureConfidence;
    }
}
