package io.repoinsight.learning;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One piece of human feedback on a finding.
 *
 * @param timestamp  When the feedback was given
 * @param valid      True if the finding was a real issue
 * @param reason     Optional explanation
 * @param userId     Optional reviewer id
 * @param confidence Confidence the finding was reported with
 */
public record Correction(
        Instant timestamp,
        @JsonProperty("isValid") boolean valid,
        String reason,
        String userId,
        double confidence
) {}
