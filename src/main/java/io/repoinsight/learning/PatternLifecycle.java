package io.repoinsight.learning;

import java.time.Instant;

/**
 * Lifecycle flags and timestamps of a learned pattern.
 * <p>
 * Created active and not skipped. Auto-skip sets {@code skipInFuture}; only an explicit update
 * clears it. Deprecation clears {@code active}; cleanup later deletes the record.
 */
public class PatternLifecycle {

    private boolean active = true;
    private boolean skipInFuture;
    private Instant firstDetected;
    private Instant lastSeen;
    private Instant lastUpdated;

    public static PatternLifecycle createdAt(Instant now) {
        PatternLifecycle lifecycle = new PatternLifecycle();
        lifecycle.firstDetected = now;
        lifecycle.lastSeen = now;
        lifecycle.lastUpdated = now;
        return lifecycle;
    }

    public PatternLifecycle copy() {
        PatternLifecycle copy = new PatternLifecycle();
        copy.active = active;
        copy.skipInFuture = skipInFuture;
        copy.firstDetected = firstDetected;
        copy.lastSeen = lastSeen;
        copy.lastUpdated = lastUpdated;
        return copy;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public boolean isSkipInFuture() {
        return skipInFuture;
    }

    public void setSkipInFuture(boolean skipInFuture) {
        this.skipInFuture = skipInFuture;
    }

    public Instant getFirstDetected() {
        return firstDetected;
    }

    public void setFirstDetected(Instant firstDetected) {
        this.firstDetected = firstDetected;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }

    public void setLastSeen(Instant lastSeen) {
        this.lastSeen = lastSeen;
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }

    public void setLastUpdated(Instant lastUpdated) {
        this.lastUpdated = lastUpdated;
    }
}
