package io.repoinsight.learning;

import io.repoinsight.config.LearningConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileStateRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final PatternSignature LEAK =
            PatternSignature.of("enhanced-db", "connection-leak", "src/api/users.ts", 12);

    @TempDir
    Path tempDir;

    @Test
    void load_missingFileIsEmpty() throws IOException {
        JsonFileStateRepository repository = new JsonFileStateRepository(tempDir.resolve("patterns.json"));

        assertThat(repository.load()).isEmpty();
    }

    @Test
    void save_createsParentDirectoriesAndLeavesNoTempFile() throws IOException {
        Path path = tempDir.resolve(".repo-insight").resolve("patterns.json");
        JsonFileStateRepository repository = new JsonFileStateRepository(path);

        repository.save(PatternSnapshot.empty(NOW));

        assertThat(path).exists();
        assertThat(path.resolveSibling("patterns.json.tmp")).doesNotExist();
        String json = Files.readString(path);
        assertThat(json).contains("\"version\" : \"3.0.0\"");
        assertThat(json).contains("\"created\" : \"2026-03-01T10:00:00Z\"");
    }

    @Test
    void store_roundTripsThroughFile() throws IOException {
        Path path = tempDir.resolve("patterns.json");
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        PatternStore writer = new PatternStore(LearningConfig.defaults(), new JsonFileStateRepository(path), clock);
        writer.recordSuccess(LEAK, 80, new PatternContext("prisma", "api-route", List.of("@prisma/client"), List.of("orm")));
        writer.recordFailure(LEAK, 40, null);
        writer.learnFromCorrection(LEAK, true, 90, "confirmed leak", "alice");

        PatternStore reader = new PatternStore(LearningConfig.defaults(), new JsonFileStateRepository(path), clock);
        PatternRecord record = reader.find(LEAK).orElseThrow();

        assertThat(record.getSignature()).isEqualTo(LEAK);
        assertThat(record.getContext().framework()).isEqualTo("prisma");
        assertThat(record.getContext().imports()).containsExactly("@prisma/client");
        assertThat(record.getPerformance().getDetectionCount()).isEqualTo(3);
        assertThat(record.getPerformance().getSuccessCount()).isEqualTo(2);
        assertThat(record.getPerformance().getAvgConfidence()).isEqualTo(70);
        assertThat(record.getCorrections()).singleElement()
                .satisfies(c -> assertThat(c.valid()).isTrue());
        assertThat(record.getLifecycle().getFirstDetected()).isEqualTo(NOW);
        assertThat(reader.globalStats()).isEqualTo(writer.globalStats());
        assertThat(reader.detectorStats()).isEqualTo(writer.detectorStats());
    }

    @Test
    void save_writesCorrectionValidityAsIsValid() throws IOException {
        Path path = tempDir.resolve("patterns.json");
        PatternStore store = new PatternStore(LearningConfig.defaults(), new JsonFileStateRepository(path),
                Clock.fixed(NOW, ZoneOffset.UTC));
        store.recordSuccess(LEAK, 80, null);
        store.learnFromCorrection(LEAK, false, 80, "not a leak", null);

        assertThat(Files.readString(path)).contains("\"isValid\" : false");
    }

    @Test
    void load_corruptFileThrowsStateCorrupt() throws IOException {
        Path path = tempDir.resolve("patterns.json");
        Files.writeString(path, "{ \"patterns\": [ not json");
        JsonFileStateRepository repository = new JsonFileStateRepository(path);

        assertThatThrownBy(repository::load)
                .isInstanceOf(StateCorruptException.class)
                .hasMessageContaining("Corrupt pattern state at");
    }

    @Test
    void store_startsEmptyOnCorruptFile() throws IOException {
        Path path = tempDir.resolve("patterns.json");
        Files.writeString(path, "garbage");
        PatternStore store = new PatternStore(LearningConfig.defaults(), new JsonFileStateRepository(path),
                Clock.fixed(NOW, ZoneOffset.UTC));

        assertThat(store.query(PatternQuery.all())).isEmpty();
        assertThat(store.adjustConfidence(LEAK, 60)).isEqualTo(60);
    }

    @Test
    void load_ignoresUnknownFields() throws IOException {
        Path path = tempDir.resolve("patterns.json");
        Files.writeString(path, "{\"version\":\"3.0.0\",\"patterns\":{},\"futureField\":true}");

        assertThat(new JsonFileStateRepository(path).load()).isPresent();
    }

    @Test
    void load_recordWithoutSignatureIsCorrupt() throws IOException {
        Path path = tempDir.resolve("patterns.json");
        Files.writeString(path, "{\"patterns\":{\"p1\":{}}}");

        assertThatThrownBy(new JsonFileStateRepository(path)::load)
                .isInstanceOf(StateCorruptException.class)
                .hasMessageContaining("pattern p1 has no signature");
    }

    @Test
    void load_nullRecordIsCorrupt() throws IOException {
        Path path = tempDir.resolve("patterns.json");
        Files.writeString(path, "{\"patterns\":{\"p1\":null}}");

        assertThatThrownBy(new JsonFileStateRepository(path)::load)
                .isInstanceOf(StateCorruptException.class)
                .hasMessageContaining("pattern p1 is null");
    }

    @Test
    void store_startsEmptyOnIncompleteRecords() throws IOException {
        Path path = tempDir.resolve("patterns.json");
        Files.writeString(path, "{\"patterns\":{\"p1\":{}}}");
        PatternStore store = new PatternStore(LearningConfig.defaults(), new JsonFileStateRepository(path),
                Clock.fixed(NOW, ZoneOffset.UTC));

        assertThat(store.globalStats().totalPatterns()).isZero();
        PatternRecord record = store.recordSuccess(LEAK, 80, null);

        assertThat(record.getPerformance().getDetectionCount()).isEqualTo(1);
        assertThat(store.query(PatternQuery.all())).hasSize(1);
        assertThat(new JsonFileStateRepository(path).load()).isPresent();
    }

    @Test
    void store_startsEmptyOnNullRecord() throws IOException {
        Path path = tempDir.resolve("patterns.json");
        Files.writeString(path, "{\"patterns\":{\"p1\":null}}");
        PatternStore store = new PatternStore(LearningConfig.defaults(), new JsonFileStateRepository(path),
                Clock.fixed(NOW, ZoneOffset.UTC));

        assertThat(store.globalStats().totalPatterns()).isZero();
        assertThat(store.query(PatternQuery.all())).isEmpty();
    }
}
