package io.repoinsight.learning;

/**
 * Aggregate statistics over the patterns of one detector.
 *
 * @param patternCount      Number of patterns learned for the detector
 * @param successRate       Successes / detections over all its patterns
 * @param falsePositiveRate Failures / detections over all its patterns
 * @param avgConfidence     Detection-weighted mean of the patterns' average confidence
 */
public record DetectorStats(int patternCount, double successRate, double falsePositiveRate, double avgConfidence) {}
