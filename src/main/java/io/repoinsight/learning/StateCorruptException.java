package io.repoinsight.learning;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when persisted learning state exists but cannot be parsed.
 */
public class StateCorruptException extends IOException {

    private final Path path;

    public StateCorruptException(Path path, Throwable cause) {
        super("Corrupt pattern state at " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
