package io.repoinsight.learning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Optional;

/**
 * Stores the snapshot as one pretty-printed JSON document with ISO-8601 timestamps.
 * <p>
 * Writes go to a sibling temp file that is then moved over the target, so a crash mid-write
 * leaves the previous document intact. There is no cross-process locking.
 */
public class JsonFileStateRepository implements PatternStateRepository {

    private final Path path;
    private final ObjectMapper mapper;

    public JsonFileStateRepository(Path path) {
        this.path = path;
        this.mapper = createMapper();
    }

    static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }

    @Override
    public Optional<PatternSnapshot> load() throws IOException {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            PatternSnapshot snapshot = mapper.readValue(path.toFile(), PatternSnapshot.class);
            if (snapshot == null) {
                throw new StateCorruptException(path, new IOException("document is empty"));
            }
            validate(snapshot);
            return Optional.of(snapshot);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new StateCorruptException(path, e);
        }
    }

    private void validate(PatternSnapshot snapshot) throws StateCorruptException {
        for (Map.Entry<String, PatternRecord> entry : snapshot.getPatterns().entrySet()) {
            PatternRecord record = entry.getValue();
            if (record == null) {
                throw new StateCorruptException(path, new IOException("pattern " + entry.getKey() + " is null"));
            }
            if (record.getSignature() == null) {
                throw new StateCorruptException(path, new IOException("pattern " + entry.getKey() + " has no signature"));
            }
            if (record.getId() == null) {
                record.setId(entry.getKey());
            }
        }
    }

    @Override
    public void save(PatternSnapshot snapshot) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = (parent != null ? parent : Path.of("."))
                .resolve(path.getFileName().toString() + ".tmp");
        mapper.writeValue(temp.toFile(), snapshot);
        try {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    public Path path() {
        return path;
    }

    @Override
    public String describe() {
        return path.toString();
    }
}
