package io.repoinsight.learning;

import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Filter, sort order and limit for {@link PatternStore#query(PatternQuery)}.
 * Unset filters match every record.
 */
public record PatternQuery(
        String detectorId,
        String patternKind,
        String filePathContains,
        String tag,
        Double minSuccessRate,
        Double maxFalsePositiveRate,
        boolean activeOnly,
        SortField sortBy,
        boolean descending,
        Integer limit
) {

    public PatternQuery {
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, got " + limit);
        }
    }

    public static PatternQuery all() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Sortable record attributes.
     */
    public enum SortField {
        SUCCESS_RATE("success-rate"),
        DETECTION_COUNT("detection-count"),
        CONFIDENCE("confidence"),
        LAST_SEEN("last-seen");

        private final String label;

        SortField(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }

        public static SortField fromLabel(String value) {
            String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
            for (SortField field : values()) {
                if (field.label.equals(normalized)) {
                    return field;
                }
            }
            throw new IllegalArgumentException("Unknown sort field: " + value);
        }

        Comparator<PatternRecord> comparator() {
            return switch (this) {
                case SUCCESS_RATE -> Comparator.comparingDouble(r -> r.getPerformance().getSuccessRate());
                case DETECTION_COUNT -> Comparator.comparingInt(r -> r.getPerformance().getDetectionCount());
                case CONFIDENCE -> Comparator.comparingDouble(r -> r.getPerformance().getAvgConfidence());
                case LAST_SEEN -> Comparator.comparing(r -> r.getLifecycle().getLastSeen(),
                        Comparator.nullsFirst(Comparator.naturalOrder()));
            };
        }
    }

    Predicate<PatternRecord> toPredicate() {
        return record -> {
            PatternSignature signature = record.getSignature();
            PatternPerformance performance = record.getPerformance();
            if (detectorId != null && !detectorId.equals(signature.detectorId())) {
                return false;
            }
            if (patternKind != null && !patternKind.equals(signature.patternKind())) {
                return false;
            }
            if (filePathContains != null && !signature.location().filePath().contains(filePathContains)) {
                return false;
            }
            if (tag != null && !record.getContext().hasTag(tag)) {
                return false;
            }
            if (minSuccessRate != null && performance.getSuccessRate() < minSuccessRate) {
                return false;
            }
            if (maxFalsePositiveRate != null && performance.getFalsePositiveRate() > maxFalsePositiveRate) {
                return false;
            }
            return !activeOnly || (record.getLifecycle().isActive() && !record.getLifecycle().isSkipInFuture());
        };
    }

    Optional<Comparator<PatternRecord>> comparator() {
        if (sortBy == null) {
            return Optional.empty();
        }
        Comparator<PatternRecord> comparator = sortBy.comparator();
        return Optional.of(descending ? comparator.reversed() : comparator);
    }

    public static class Builder {
        private String detectorId;
        private String patternKind;
        private String filePathContains;
        private String tag;
        private Double minSuccessRate;
        private Double maxFalsePositiveRate;
        private boolean activeOnly;
        private SortField sortBy;
        private boolean descending;
        private Integer limit;

        public Builder detectorId(String detectorId) {
            this.detectorId = detectorId;
            return this;
        }

        public Builder patternKind(String patternKind) {
            this.patternKind = patternKind;
            return this;
        }

        public Builder filePathContains(String filePathContains) {
            this.filePathContains = filePathContains;
            return this;
        }

        public Builder tag(String tag) {
            this.tag = tag;
            return this;
        }

        public Builder minSuccessRate(double minSuccessRate) {
            this.minSuccessRate = minSuccessRate;
            return this;
        }

        public Builder maxFalsePositiveRate(double maxFalsePositiveRate) {
            this.maxFalsePositiveRate = maxFalsePositiveRate;
            return this;
        }

        public Builder activeOnly(boolean activeOnly) {
            this.activeOnly = activeOnly;
            return this;
        }

        public Builder sortBy(SortField sortBy) {
            this.sortBy = sortBy;
            return this;
        }

        public Builder descending(boolean descending) {
            this.descending = descending;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public PatternQuery build() {
            return new PatternQuery(detectorId, patternKind, filePathContains, tag,
                    minSuccessRate, maxFalsePositiveRate, activeOnly, sortBy, descending, limit);
        }
    }
}
