package io.repoinsight.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.repoinsight.config.LearningConfig;
import io.repoinsight.learning.JsonFileStateRepository;
import io.repoinsight.learning.PatternContext;
import io.repoinsight.learning.PatternSignature;
import io.repoinsight.learning.PatternStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PatternsCommandTest {

    private static final PatternSignature LEAK =
            PatternSignature.of("enhanced-db", "connection-leak", "src/api/users.ts", 12);
    private static final PatternSignature SECRET =
            PatternSignature.of("security", "hardcoded-secret", "src/config.ts", 3);

    @TempDir
    Path tempDir;

    private Path stateFile;
    private ByteArrayOutputStream output;

    @BeforeEach
    void setUp() {
        stateFile = tempDir.resolve("patterns.json");
        output = new ByteArrayOutputStream();
        try (PatternStore store = openStore()) {
            for (int i = 0; i < 3; i++) {
                store.recordSuccess(LEAK, 80, new PatternContext("prisma", "api-route", List.of(), List.of()));
            }
            store.recordFailure(LEAK, 60, null);
            store.recordSuccess(SECRET, 70, null);
        }
    }

    private PatternStore openStore() {
        return new PatternStore(LearningConfig.defaults(), new JsonFileStateRepository(stateFile));
    }

    private int run(String... args) {
        PrintStream out = new PrintStream(output, true, StandardCharsets.UTF_8);
        String[] withState = new String[args.length + 2];
        withState[0] = "--state";
        withState[1] = stateFile.toString();
        System.arraycopy(args, 0, withState, 2, args.length);
        return new CommandLine(new PatternsCommand(out)).execute(withState);
    }

    private String output() {
        return output.toString(StandardCharsets.UTF_8);
    }

    @Test
    void patterns_listsEveryPattern() {
        assertThat(run()).isZero();

        assertThat(output()).contains(LEAK.patternId(), SECRET.patternId());
        assertThat(output()).contains("active");
    }

    @Test
    void patterns_filtersByDetector() {
        assertThat(run("--detector", "security")).isZero();

        assertThat(output()).contains(SECRET.patternId()).doesNotContain(LEAK.patternId());
    }

    @Test
    void patterns_filtersByFrameworkTag() {
        assertThat(run("--tag", "prisma")).isZero();

        assertThat(output()).contains(LEAK.patternId()).doesNotContain(SECRET.patternId());
    }

    @Test
    void patterns_sortsAndLimits() {
        assertThat(run("--sort", "detection-count", "--desc", "--limit", "1")).isZero();

        assertThat(output()).contains(LEAK.patternId()).doesNotContain(SECRET.patternId());
    }

    @Test
    void patterns_rejectsUnknownSortField() {
        assertThat(run("--sort", "popularity")).isEqualTo(1);
    }

    @Test
    void patterns_noMatches() {
        assertThat(run("--detector", "runtime")).isZero();

        assertThat(output()).contains("No patterns match.");
    }

    @Test
    void patterns_skipSuppressesAndPersists() {
        assertThat(run("--skip", LEAK.patternId())).isZero();

        assertThat(output()).contains("Suppressed " + LEAK.patternId());
        assertThat(output()).contains("suppressed");
        try (PatternStore store = openStore()) {
            assertThat(store.isSuppressed(LEAK)).isTrue();
        }

        run("--unskip", LEAK.patternId());
        try (PatternStore store = openStore()) {
            assertThat(store.isSuppressed(LEAK)).isFalse();
        }
    }

    @Test
    void patterns_deprecateUnknownIdIsReported() {
        assertThat(run("--deprecate", "nope")).isZero();

        assertThat(output()).contains("Unknown pattern: nope");
    }

    @Test
    void patterns_deprecateThenHideWithActiveOnly() {
        run("--deprecate", SECRET.patternId());
        output.reset();

        assertThat(run("--active-only")).isZero();

        assertThat(output()).contains(LEAK.patternId()).doesNotContain(SECRET.patternId());
    }

    @Test
    void patterns_cleanupReportsRemovedCount() {
        assertThat(run("--cleanup")).isZero();

        assertThat(output()).contains("Removed 0 deprecated pattern(s)");
    }

    @Test
    void patterns_statsSummarizesDetectors() {
        assertThat(run("--stats")).isZero();

        assertThat(output()).contains("Patterns: 2 (2 active, 0 deprecated)");
        assertThat(output()).contains("Detections: 5 | Corrections: 0");
        assertThat(output()).contains("enhanced-db", "security");
    }

    @Test
    void patterns_jsonOutput() throws IOException {
        assertThat(run("--json", "--stats")).isZero();

        JsonNode json = new ObjectMapper().readTree(output());
        assertThat(json.get("patterns")).hasSize(2);
        assertThat(json.at("/globalStats/totalPatterns").asInt()).isEqualTo(2);
        assertThat(json.at("/detectorStats/enhanced-db/patternCount").asInt()).isEqualTo(1);
        assertThat(json.at("/patterns/0/performance/detectionCount").asInt()).isEqualTo(4);
    }
}
