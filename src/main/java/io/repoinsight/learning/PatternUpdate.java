package io.repoinsight.learning;

/**
 * Manual update of one pattern, addressed by pattern id.
 * Every field is optional; the store applies the set ones in declaration order.
 *
 * @param patternId       Target pattern
 * @param detection       Records a plain detection (no outcome) with this confidence
 * @param success         Records a true-positive outcome with this confidence
 * @param failure         Records a false-positive outcome with this confidence
 * @param correction      Appends a correction
 * @param suggestedFix    Replaces the suggested fix
 * @param deprecate       Marks the pattern inactive
 * @param skipInFuture    Sets or clears suppression
 * @param notes           Replaces the notes
 */
public record PatternUpdate(
        String patternId,
        Double detection,
        Double success,
        Double failure,
        Correction correction,
        String suggestedFix,
        boolean deprecate,
        Boolean skipInFuture,
        String notes
) {

    public PatternUpdate {
        if (patternId == null || patternId.isBlank()) {
            throw new IllegalArgumentException("patternId cannot be null or blank");
        }
    }

    public static Builder forPattern(String patternId) {
        return new Builder(patternId);
    }

    public static class Builder {
        private final String patternId;
        private Double detection;
        private Double success;
        private Double failure;
        private Correction correction;
        private String suggestedFix;
        private boolean deprecate;
        private Boolean skipInFuture;
        private String notes;

        private Builder(String patternId) {
            this.patternId = patternId;
        }

        public Builder recordDetection(double confidence) {
            this.detection = confidence;
            return this;
        }

        public Builder recordSuccess(double confidence) {
            this.success = confidence;
            return this;
        }

        public Builder recordFailure(double confidence) {
            this.failure = confidence;
            return this;
        }

        public Builder addCorrection(Correction correction) {
            this.correction = correction;
            return this;
        }

        public Builder suggestedFix(String suggestedFix) {
            this.suggestedFix = suggestedFix;
            return this;
        }

        public Builder deprecate() {
            this.deprecate = true;
            return this;
        }

        public Builder skipInFuture(boolean skipInFuture) {
            this.skipInFuture = skipInFuture;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public PatternUpdate build() {
            return new PatternUpdate(patternId, detection, success, failure, correction,
                    suggestedFix, deprecate, skipInFuture, notes);
        }
    }
}
