package io.repoinsight.learning;

import java.io.IOException;
import java.util.Optional;

/**
 * Durable storage of a {@link PatternSnapshot}.
 */
public interface PatternStateRepository {

    /**
     * Loads the stored snapshot, or empty if nothing has been stored yet.
     *
     * @throws StateCorruptException if stored state exists but is unreadable
     * @throws IOException           on any other I/O failure
     */
    Optional<PatternSnapshot> load() throws IOException;

    /**
     * Replaces the stored snapshot.
     */
    void save(PatternSnapshot snapshot) throws IOException;

    /**
     * Human-readable location, for logs.
     */
    String describe();
}
