package io.repoinsight.config;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Top-level configuration, loaded from YAML.
 * <p>
 * The document has two optional sections, {@code learning} and {@code architecture}. A file
 * loaded on top of another keeps every key it does not mention.
 */
public final class InsightConfig {

    public static final String DEFAULT_CONFIG = "/repo-insight.yaml";
    public static final String PROJECT_CONFIG_FILE = "repo-insight.yaml";

    private final LearningConfig learning;
    private final ArchitectureConfig architecture;

    public InsightConfig(LearningConfig learning, ArchitectureConfig architecture) {
        this.learning = learning != null ? learning : LearningConfig.defaults();
        this.architecture = architecture != null ? architecture : ArchitectureConfig.defaults();
    }

    public static InsightConfig defaults() {
        return new InsightConfig(LearningConfig.defaults(), ArchitectureConfig.defaults());
    }

    /**
     * Loads the default configuration from the classpath.
     */
    public static InsightConfig loadDefault() {
        try (InputStream is = InsightConfig.class.getResourceAsStream(DEFAULT_CONFIG)) {
            if (is == null) {
                throw new IllegalStateException("Default configuration not found: " + DEFAULT_CONFIG);
            }
            return defaults().overlay(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load default configuration", e);
        }
    }

    /**
     * Loads a file over the built-in defaults.
     */
    public static InsightConfig loadFromFile(Path path) throws IOException {
        return loadDefault().overlay(path);
    }

    /**
     * Returns this configuration with the file's values applied on top.
     *
     * @throws IOException if the file cannot be read or is not a valid configuration
     */
    public InsightConfig overlay(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return overlay(is);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid configuration " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Returns this configuration with the stream's values applied on top.
     *
     * @throws IOException if the stream is not valid YAML
     */
    public InsightConfig overlay(InputStream is) throws IOException {
        Map<String, Object> document = parse(is);
        return new InsightConfig(
                LearningConfig.fromMap(section(document, "learning"), learning),
                ArchitectureConfig.fromMap(section(document, "architecture"), architecture));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> parse(InputStream is) throws IOException {
        try {
            Object loaded = new Yaml().load(is);
            if (loaded == null) {
                return Map.of();
            }
            if (!(loaded instanceof Map<?, ?> map)) {
                throw new IllegalArgumentException("configuration root must be a mapping");
            }
            return new HashMap<>((Map<String, Object>) map);
        } catch (YAMLException e) {
            throw new IOException("Malformed YAML: " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> document, String name) {
        Object value = document.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("'" + name + "' must be a mapping");
        }
        return (Map<String, Object>) map;
    }

    public InsightConfig withLearning(LearningConfig learning) {
        return new InsightConfig(learning, architecture);
    }

    public LearningConfig learning() {
        return learning;
    }

    public ArchitectureConfig architecture() {
        return architecture;
    }
}
