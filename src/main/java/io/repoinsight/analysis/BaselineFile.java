package io.repoinsight.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Keeps the {@link ArchitectureBaseline} of the last analysis in a JSON file.
 * <p>
 * A missing or unreadable file means there is no baseline; drift detection is then skipped.
 */
public class BaselineFile {

    private static final Logger log = LoggerFactory.getLogger(BaselineFile.class);

    private final Path path;
    private final ObjectMapper mapper;

    public BaselineFile(Path path) {
        this.path = path;
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Optional<ArchitectureBaseline> load() {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(mapper.readValue(path.toFile(), ArchitectureBaseline.class));
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable baseline {}: {}", path, e.getOriginalMessage());
        } catch (IOException e) {
            log.warn("Failed to read baseline {}: {}", path, e.getMessage());
        }
        return Optional.empty();
    }

    public void save(ArchitectureBaseline baseline) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = (parent != null ? parent : Path.of("."))
                .resolve(path.getFileName().toString() + ".tmp");
        mapper.writeValue(temp.toFile(), baseline);
        try {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    public Path path() {
        return path;
    }
}
