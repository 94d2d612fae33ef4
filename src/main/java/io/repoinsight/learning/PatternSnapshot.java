package io.repoinsight.learning;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * The persisted learning state. Its JSON form is the on-disk compatibility contract.
 */
public class PatternSnapshot {

    public static final String CURRENT_VERSION = "3.0.0";

    private String version = CURRENT_VERSION;
    private Instant created;
    private Instant lastUpdated;
    private Map<String, PatternRecord> patterns = new LinkedHashMap<>();
    private GlobalStats globalStats = GlobalStats.empty();
    private Map<String, DetectorStats> detectorStats = new TreeMap<>();

    public static PatternSnapshot empty(Instant now) {
        PatternSnapshot snapshot = new PatternSnapshot();
        snapshot.created = now;
        snapshot.lastUpdated = now;
        return snapshot;
    }

    /**
     * Deep copy; records are copied, immutable values are shared.
     */
    public PatternSnapshot copy() {
        PatternSnapshot copy = new PatternSnapshot();
        copy.version = version;
        copy.created = created;
        copy.lastUpdated = lastUpdated;
        patterns.forEach((id, record) -> copy.patterns.put(id, record.copy()));
        copy.globalStats = globalStats;
        copy.detectorStats = new TreeMap<>(detectorStats);
        return copy;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public Instant getCreated() {
        return created;
    }

    public void setCreated(Instant created) {
        this.created = created;
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }

    public void setLastUpdated(Instant lastUpdated) {
        this.lastUpdated = lastUpdated;
    }

    public Map<String, PatternRecord> getPatterns() {
        return patterns;
    }

    public void setPatterns(Map<String, PatternRecord> patterns) {
        this.patterns = patterns != null ? new LinkedHashMap<>(patterns) : new LinkedHashMap<>();
    }

    public GlobalStats getGlobalStats() {
        return globalStats;
    }

    public void setGlobalStats(GlobalStats globalStats) {
        this.globalStats = globalStats != null ? globalStats : GlobalStats.empty();
    }

    public Map<String, DetectorStats> getDetectorStats() {
        return detectorStats;
    }

    public void setDetectorStats(Map<String, DetectorStats> detectorStats) {
        this.detectorStats = detectorStats != null ? new TreeMap<>(detectorStats) : new TreeMap<>();
    }
}
