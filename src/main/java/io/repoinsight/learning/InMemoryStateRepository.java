package io.repoinsight.learning;

import java.util.Optional;

/**
 * Keeps the snapshot in memory. Saved snapshots are copied so later store mutations do not leak in.
 */
public class InMemoryStateRepository implements PatternStateRepository {

    private PatternSnapshot stored;
    private int saveCount;

    @Override
    public synchronized Optional<PatternSnapshot> load() {
        return Optional.ofNullable(stored).map(PatternSnapshot::copy);
    }

    @Override
    public synchronized void save(PatternSnapshot snapshot) {
        stored = snapshot.copy();
        saveCount++;
    }

    public synchronized int saveCount() {
        return saveCount;
    }

    @Override
    public String describe() {
        return "memory";
    }
}
