package io.repoinsight.learning;

import io.repoinsight.config.LearningConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Persisted memory of how each {@link PatternSignature} has performed.
 * <p>
 * State is loaded lazily on first use and every mutation writes the full snapshot back through
 * the {@link PatternStateRepository}. Load and save failures are logged and absorbed: an
 * unreadable state file yields an empty store, a failed save leaves the in-memory state intact.
 * <p>
 * Thread-safe within one process. Concurrent processes sharing a state file can lose updates.
 */
public class PatternStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PatternStore.class);

    static final double HIGH_SUCCESS_RATE = 0.9;
    static final int HIGH_SUCCESS_MIN_DETECTIONS = 20;
    static final double HIGH_FALSE_POSITIVE_RATE = 0.5;
    static final int HIGH_FALSE_POSITIVE_MIN_DETECTIONS = 10;
    static final double NEUTRAL_SUCCESS_RATE = 0.75;
    static final double NEUTRAL_SCALE = 20;

    private final LearningConfig config;
    private final PatternStateRepository repository;
    private final Clock clock;

    private PatternSnapshot state;
    private boolean dirty;

    public PatternStore(LearningConfig config, PatternStateRepository repository, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.repository = Objects.requireNonNull(repository, "repository");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public PatternStore(LearningConfig config, PatternStateRepository repository) {
        this(config, repository, Clock.systemUTC());
    }

    /**
     * Store backed by the JSON file at {@link LearningConfig#statePath()}.
     */
    public static PatternStore open(LearningConfig config) {
        return new PatternStore(config, new JsonFileStateRepository(config.statePath()));
    }

    public LearningConfig config() {
        return config;
    }

    // ---- Outcome recording ----

    /**
     * Records a confirmed true positive, creating the record on first sight.
     */
    public synchronized PatternRecord recordSuccess(PatternSignature signature, double confidence, PatternContext context) {
        return recordOutcome(signature, true, confidence, context);
    }

    /**
     * Records a confirmed false positive, creating the record on first sight.
     * May auto-skip the pattern.
     */
    public synchronized PatternRecord recordFailure(PatternSignature signature, double confidence, PatternContext context) {
        return recordOutcome(signature, false, confidence, context);
    }

    private PatternRecord recordOutcome(PatternSignature signature, boolean success, double confidence,
                                        PatternContext context) {
        Instant now = now();
        PatternRecord record = upsert(signature, context, now);
        record.getPerformance().recordOutcome(success, confidence);
        if (!success) {
            applyAutoSkip(record);
        }
        record.getLifecycle().setLastSeen(now);
        record.getLifecycle().setLastUpdated(now);
        commit(now);
        return record.copy();
    }

    /**
     * Applies human feedback to an existing pattern.
     *
     * @return false if the pattern has never been recorded; nothing changes in that case
     */
    public synchronized boolean learnFromCorrection(PatternSignature signature, boolean valid, double confidence,
                                                    String reason, String userId) {
        PatternRecord record = state().getPatterns().get(signature.patternId());
        if (record == null) {
            log.warn("Ignoring correction for unknown pattern {}", signature.patternId());
            return false;
        }
        Instant now = now();
        record.getCorrections().add(new Correction(now, valid, reason, userId, confidence));
        record.getPerformance().recordOutcome(valid, confidence);
        if (!valid) {
            applyAutoSkip(record);
        }
        record.getLifecycle().setLastUpdated(now);
        commit(now);
        return true;
    }

    private void applyAutoSkip(PatternRecord record) {
        PatternPerformance performance = record.getPerformance();
        if (record.getLifecycle().isSkipInFuture()) {
            return;
        }
        if (performance.getFalsePositiveRate() > config.autoSkipThreshold()
                && performance.getDetectionCount() >= config.minDetectionsForStability()) {
            record.getLifecycle().setSkipInFuture(true);
            record.setNotes(String.format(Locale.ROOT, "Auto-skipped: FP rate %.1f%% exceeds threshold",
                    performance.getFalsePositiveRate() * 100));
            log.info("Auto-skipped pattern {} after {} detections", record.getId(), performance.getDetectionCount());
        }
    }

    /**
     * Records whether an applied fix for the pattern held.
     *
     * @return false if the pattern has never been recorded
     */
    public synchronized boolean recordAutoFixOutcome(PatternSignature signature, boolean succeeded) {
        PatternRecord record = state().getPatterns().get(signature.patternId());
        if (record == null) {
            log.warn("Ignoring auto-fix outcome for unknown pattern {}", signature.patternId());
            return false;
        }
        Instant now = now();
        record.getPerformance().recordAutoFix(succeeded);
        record.getLifecycle().setLastUpdated(now);
        commit(now);
        return true;
    }

    /**
     * Applies a manual update to the pattern with the given id.
     *
     * @return false if no such pattern exists
     */
    public synchronized boolean updatePattern(PatternUpdate update) {
        PatternRecord record = state().getPatterns().get(update.patternId());
        if (record == null) {
            log.warn("Ignoring update for unknown pattern {}", update.patternId());
            return false;
        }
        Instant now = now();
        PatternPerformance performance = record.getPerformance();
        PatternLifecycle lifecycle = record.getLifecycle();
        if (update.detection() != null) {
            performance.recordDetection(update.detection());
            lifecycle.setLastSeen(now);
        }
        if (update.success() != null) {
            performance.recordOutcome(true, update.success());
        }
        if (update.failure() != null) {
            performance.recordOutcome(false, update.failure());
            applyAutoSkip(record);
        }
        if (update.correction() != null) {
            record.getCorrections().add(update.correction());
        }
        if (update.suggestedFix() != null) {
            record.setSuggestedFix(update.suggestedFix());
        }
        if (update.deprecate()) {
            lifecycle.setActive(false);
        }
        if (update.skipInFuture() != null) {
            lifecycle.setSkipInFuture(update.skipInFuture());
        }
        if (update.notes() != null) {
            record.setNotes(update.notes());
        }
        lifecycle.setLastUpdated(now);
        commit(now);
        return true;
    }

    /**
     * Deletes deprecated patterns not seen for {@code deprecateAfterDays}.
     *
     * @return number of deleted patterns
     */
    public synchronized int cleanupDeprecatedPatterns(Instant now) {
        Instant horizon = now.minus(Duration.ofDays(config.deprecateAfterDays()));
        int removed = 0;
        Iterator<PatternRecord> it = state().getPatterns().values().iterator();
        while (it.hasNext()) {
            PatternLifecycle lifecycle = it.next().getLifecycle();
            Instant lastSeen = lifecycle.getLastSeen();
            if (!lifecycle.isActive() && (lastSeen == null || lastSeen.isBefore(horizon))) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Removed {} deprecated patterns", removed);
            commit(now);
        }
        return removed;
    }

    public synchronized int cleanupDeprecatedPatterns() {
        return cleanupDeprecatedPatterns(now());
    }

    // ---- Scoring support ----

    /**
     * Adjusts a base confidence (0-100) by the pattern's history.
     * <ol>
     *   <li>learning disabled or unknown pattern: unchanged</li>
     *   <li>suppressed: 0</li>
     *   <li>fewer than {@code minDetectionsForStability} detections: unchanged</li>
     *   <li>success rate at least 0.9 over 20+ detections: boosted</li>
     *   <li>false-positive rate at least 0.5 over 10+ detections: penalized</li>
     *   <li>otherwise nudged by {@code (successRate - 0.75) * 20}</li>
     * </ol>
     * The result is clamped to 0..100.
     */
    public synchronized int adjustConfidence(PatternSignature signature, int baseConfidence) {
        if (!config.enabled()) {
            return baseConfidence;
        }
        PatternRecord record = state().getPatterns().get(signature.patternId());
        if (record == null) {
            return baseConfidence;
        }
        if (record.getLifecycle().isSkipInFuture()) {
            return 0;
        }
        PatternPerformance performance = record.getPerformance();
        int detections = performance.getDetectionCount();
        if (detections < config.minDetectionsForStability()) {
            return baseConfidence;
        }
        double adjusted;
        if (performance.getSuccessRate() >= HIGH_SUCCESS_RATE && detections >= HIGH_SUCCESS_MIN_DETECTIONS) {
            adjusted = baseConfidence + config.confidenceBoost() * 100;
        } else if (performance.getFalsePositiveRate() >= HIGH_FALSE_POSITIVE_RATE
                && detections >= HIGH_FALSE_POSITIVE_MIN_DETECTIONS) {
            adjusted = baseConfidence - config.confidencePenalty() * 100;
        } else {
            adjusted = baseConfidence + (performance.getSuccessRate() - NEUTRAL_SUCCESS_RATE) * NEUTRAL_SCALE;
        }
        return (int) Math.max(0, Math.min(100, Math.round(adjusted)));
    }

    /**
     * True when learning is enabled and the pattern has been auto-skipped or manually suppressed.
     */
    public synchronized boolean isSuppressed(PatternSignature signature) {
        if (!config.enabled()) {
            return false;
        }
        PatternRecord record = state().getPatterns().get(signature.patternId());
        return record != null && record.isSuppressed();
    }

    /**
     * Observed accuracy (0..1): the pattern's own success rate when it has detections, otherwise
     * the success rate over all patterns of its detector, otherwise empty.
     */
    public synchronized OptionalDouble patternAccuracy(PatternSignature signature) {
        PatternRecord record = state().getPatterns().get(signature.patternId());
        if (record != null && record.getPerformance().getDetectionCount() > 0) {
            return OptionalDouble.of(record.getPerformance().getSuccessRate());
        }
        long detections = 0;
        long successes = 0;
        for (PatternRecord candidate : state().getPatterns().values()) {
            if (candidate.detectorId().equals(signature.detectorId())) {
                detections += candidate.getPerformance().getDetectionCount();
                successes += candidate.getPerformance().getSuccessCount();
            }
        }
        if (detections == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((double) successes / detections);
    }

    /**
     * The stored fix for the pattern, offered only when suggestions are enabled, the pattern is
     * active and not suppressed, and the confidence reaches {@code autoFixMinConfidence}.
     */
    public synchronized Optional<String> suggestedFix(PatternSignature signature, int confidence) {
        if (!config.enableAutoFixSuggestions() || confidence < config.autoFixMinConfidence()) {
            return Optional.empty();
        }
        PatternRecord record = state().getPatterns().get(signature.patternId());
        if (record == null || !record.getLifecycle().isActive() || record.isSuppressed()) {
            return Optional.empty();
        }
        return Optional.ofNullable(record.getSuggestedFix());
    }

    // ---- Queries ----

    public synchronized Optional<PatternRecord> find(PatternSignature signature) {
        return findById(signature.patternId());
    }

    public synchronized Optional<PatternRecord> findById(String patternId) {
        return Optional.ofNullable(state().getPatterns().get(patternId)).map(PatternRecord::copy);
    }

    public synchronized List<PatternRecord> query(PatternQuery query) {
        Stream<PatternRecord> stream = state().getPatterns().values().stream()
                .filter(query.toPredicate());
        Optional<Comparator<PatternRecord>> comparator = query.comparator();
        if (comparator.isPresent()) {
            stream = stream.sorted(comparator.get());
        }
        if (query.limit() != null) {
            stream = stream.limit(query.limit());
        }
        return stream.map(PatternRecord::copy).toList();
    }

    public synchronized GlobalStats globalStats() {
        return state().getGlobalStats();
    }

    public synchronized Map<String, DetectorStats> detectorStats() {
        return Collections.unmodifiableMap(new TreeMap<>(state().getDetectorStats()));
    }

    public synchronized Optional<DetectorStats> detectorStats(String detectorId) {
        return Optional.ofNullable(state().getDetectorStats().get(detectorId));
    }

    public synchronized PatternSnapshot snapshot() {
        return state().copy();
    }

    // ---- Lifecycle ----

    /**
     * Writes the current state, propagating any failure.
     */
    public synchronized void flush() throws IOException {
        if (state != null) {
            repository.save(state);
            dirty = false;
        }
    }

    /**
     * Drops the cached state; the next call reloads it from the repository.
     */
    public synchronized void reset() {
        state = null;
        dirty = false;
    }

    /**
     * Retries a save that failed earlier. Read-only use never writes.
     */
    @Override
    public synchronized void close() {
        if (state == null || !dirty) {
            return;
        }
        try {
            repository.save(state);
            dirty = false;
        } catch (IOException e) {
            log.warn("Failed to save pattern state to {}: {}", repository.describe(), e.getMessage());
        }
    }

    // ---- Internals ----

    private PatternSnapshot state() {
        if (state == null) {
            state = load();
        }
        return state;
    }

    private PatternSnapshot load() {
        try {
            Optional<PatternSnapshot> loaded = repository.load();
            if (loaded.isPresent()) {
                PatternSnapshot snapshot = loaded.get();
                if (snapshot.getVersion() == null) {
                    snapshot.setVersion(PatternSnapshot.CURRENT_VERSION);
                }
                recomputeStatistics(snapshot);
                log.debug("Loaded {} patterns from {}", snapshot.getPatterns().size(), repository.describe());
                return snapshot;
            }
        } catch (StateCorruptException e) {
            log.warn("{}; starting with an empty pattern store", e.getMessage());
        } catch (IOException e) {
            log.warn("Failed to load pattern state from {}: {}; starting empty", repository.describe(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Unusable pattern state in {}: {}; starting empty", repository.describe(), e.toString());
        }
        return PatternSnapshot.empty(now());
    }

    private PatternRecord upsert(PatternSignature signature, PatternContext context, Instant now) {
        Map<String, PatternRecord> patterns = state().getPatterns();
        PatternRecord record = patterns.get(signature.patternId());
        if (record == null) {
            record = PatternRecord.create(signature, context, now);
            patterns.put(record.getId(), record);
        } else if (context != null) {
            record.setContext(context);
        }
        return record;
    }

    private void commit(Instant now) {
        PatternSnapshot snapshot = state();
        recomputeStatistics(snapshot);
        snapshot.setLastUpdated(now);
        dirty = true;
        try {
            repository.save(snapshot);
            dirty = false;
        } catch (IOException e) {
            log.warn("Failed to save pattern state to {}: {}", repository.describe(), e.getMessage());
        }
    }

    static void recomputeStatistics(PatternSnapshot snapshot) {
        int active = 0;
        long detections = 0;
        long successes = 0;
        long failures = 0;
        long corrections = 0;
        Map<String, DetectorTotals> perDetector = new TreeMap<>();

        for (PatternRecord record : snapshot.getPatterns().values()) {
            PatternPerformance performance = record.getPerformance();
            if (record.getLifecycle().isActive()) {
                active++;
            }
            detections += performance.getDetectionCount();
            successes += performance.getSuccessCount();
            failures += performance.getFailureCount();
            corrections += record.getCorrections().size();
            perDetector.computeIfAbsent(record.detectorId(), id -> new DetectorTotals()).add(performance);
        }

        int total = snapshot.getPatterns().size();
        snapshot.setGlobalStats(new GlobalStats(total, active, total - active, detections, corrections,
                ratio(successes, detections), ratio(failures, detections)));

        Map<String, DetectorStats> detectorStats = new TreeMap<>();
        perDetector.forEach((id, totals) -> detectorStats.put(id, totals.toStats()));
        snapshot.setDetectorStats(detectorStats);
    }

    private static double ratio(long numerator, long denominator) {
        return denominator == 0 ? 0 : (double) numerator / denominator;
    }

    private Instant now() {
        return Instant.now(clock);
    }

    private static final class DetectorTotals {
        private int patterns;
        private long detections;
        private long successes;
        private long failures;
        private double weightedConfidence;

        void add(PatternPerformance performance) {
            patterns++;
            detections += performance.getDetectionCount();
            successes += performance.getSuccessCount();
            failures += performance.getFailureCount();
            weightedConfidence += performance.getAvgConfidence() * performance.getDetectionCount();
        }

        DetectorStats toStats() {
            return new DetectorStats(patterns, ratio(successes, detections), ratio(failures, detections),
                    detections == 0 ? 0 : weightedConfidence / detections);
        }
    }
}
