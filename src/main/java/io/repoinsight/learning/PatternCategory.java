package io.repoinsight.learning;

import java.util.Locale;
import java.util.Set;

/**
 * Closed set of finding families. Each family carries the historical accuracy assumed for a
 * detector of that family before any outcome has been recorded.
 */
public enum PatternCategory {
    DATABASE(85, Set.of("db", "database", "sql", "orm", "query", "connection")),
    SECURITY(75, Set.of("security", "secret", "secrets", "sast", "auth", "crypto", "injection")),
    PERFORMANCE(70, Set.of("performance", "perf", "memory", "latency")),
    RUNTIME(65, Set.of("runtime", "exception", "crash", "null")),
    ARCHITECTURE(70, Set.of("architecture", "circular", "cycle", "layer", "coupling", "isolation")),
    DEPENDENCY(70, Set.of("dependency", "dependencies", "deps", "package", "license")),
    OTHER(70, Set.of());

    private final int defaultAccuracy;
    private final Set<String> keywords;

    PatternCategory(int defaultAccuracy, Set<String> keywords) {
        this.defaultAccuracy = defaultAccuracy;
        this.keywords = keywords;
    }

    /**
     * Historical accuracy (0-100) assumed when nothing has been learned yet.
     */
    public int defaultAccuracy() {
        return defaultAccuracy;
    }

    /**
     * Resolves the family of a detector from the tokens of its id,
     * e.g. "enhanced-db" is {@link #DATABASE}. Unknown ids are {@link #OTHER}.
     */
    public static PatternCategory forDetector(String detectorId) {
        if (detectorId == null || detectorId.isBlank()) {
            return OTHER;
        }
        String[] tokens = detectorId.toLowerCase(Locale.ROOT).split("[^a-z0-9]+");
        for (PatternCategory category : values()) {
            for (String token : tokens) {
                if (category.keywords.contains(token)) {
                    return category;
                }
            }
        }
        return OTHER;
    }
}
