package io.repoinsight.cli;

import io.repoinsight.config.InsightConfig;
import io.repoinsight.config.LearningConfig;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Configuration options shared by the subcommands.
 */
public class ConfigOptions {

    @Option(
            names = {"-c", "--config"},
            description = "Path to configuration YAML file (defaults to ./repo-insight.yaml when present)"
    )
    Path configFile;

    @Option(
            names = {"--state"},
            description = "Pattern state file (overrides learning.statePath)"
    )
    Path statePath;

    /**
     * Built-in defaults, overlaid with the given or discovered configuration file.
     */
    public InsightConfig load(Path workingDir) throws IOException {
        InsightConfig config = InsightConfig.loadDefault();
        if (configFile != null) {
            if (!Files.exists(configFile)) {
                throw new IOException("Configuration file does not exist: " + configFile);
            }
            config = config.overlay(configFile);
        } else {
            Path projectConfig = workingDir.resolve(InsightConfig.PROJECT_CONFIG_FILE);
            if (Files.exists(projectConfig)) {
                config = config.overlay(projectConfig);
            }
        }
        if (statePath != null) {
            LearningConfig learning = config.learning().toBuilder().statePath(statePath).build();
            config = config.withLearning(learning);
        }
        return config;
    }
}
