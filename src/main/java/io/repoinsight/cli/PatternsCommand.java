package io.repoinsight.cli;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.repoinsight.config.InsightConfig;
import io.repoinsight.learning.DetectorStats;
import io.repoinsight.learning.GlobalStats;
import io.repoinsight.learning.PatternPerformance;
import io.repoinsight.learning.PatternQuery;
import io.repoinsight.learning.PatternRecord;
import io.repoinsight.learning.PatternStore;
import io.repoinsight.learning.PatternUpdate;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Inspects and maintains the learned pattern state.
 */
@Command(
        name = "patterns",
        mixinStandardHelpOptions = true,
        description = "Lists, filters and maintains learned finding patterns."
)
public class PatternsCommand implements Callable<Integer> {

    @Mixin
    private ConfigOptions configOptions = new ConfigOptions();

    @Option(names = {"--detector"}, description = "Only patterns of this detector id")
    private String detector;

    @Option(names = {"--kind"}, description = "Only patterns of this pattern kind")
    private String kind;

    @Option(names = {"--file"}, description = "Only patterns whose file path contains this text")
    private String file;

    @Option(names = {"--tag"}, description = "Only patterns whose context has this tag or framework")
    private String tag;

    @Option(names = {"--active-only"}, description = "Hide deprecated and suppressed patterns")
    private boolean activeOnly;

    @Option(
            names = {"--sort"},
            description = "Sort by: success-rate, detection-count, confidence, last-seen"
    )
    private String sort;

    @Option(names = {"--desc"}, description = "Sort descending")
    private boolean descending;

    @Option(names = {"--limit"}, description = "Maximum number of patterns to list")
    private Integer limit;

    @Option(names = {"--deprecate"}, description = "Deprecate the pattern with this id", split = ",")
    private List<String> deprecate;

    @Option(names = {"--skip"}, description = "Suppress the pattern with this id", split = ",")
    private List<String> skip;

    @Option(names = {"--unskip"}, description = "Stop suppressing the pattern with this id", split = ",")
    private List<String> unskip;

    @Option(names = {"--cleanup"}, description = "Delete deprecated patterns older than deprecateAfterDays")
    private boolean cleanup;

    @Option(names = {"--stats"}, description = "Show global and per-detector statistics")
    private boolean stats;

    @Option(names = {"--json"}, description = "Print JSON instead of a table")
    private boolean json;

    private final PrintStream out;

    public PatternsCommand() {
        this(System.out);
    }

    PatternsCommand(PrintStream out) {
        this.out = out;
    }

    @Override
    public Integer call() {
        try {
            InsightConfig config = configOptions.load(Path.of(""));
            PatternQuery query = buildQuery();
            try (PatternStore store = PatternStore.open(config.learning())) {
                List<String> messages = applyMaintenance(store);
                List<PatternRecord> patterns = store.query(query);
                if (json) {
                    printJson(store, patterns);
                } else {
                    messages.forEach(out::println);
                    if (stats) {
                        printStats(store.globalStats(), store.detectorStats());
                    }
                    printTable(patterns);
                }
            }
            return 0;
        } catch (IOException | RuntimeException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private PatternQuery buildQuery() {
        PatternQuery.Builder builder = PatternQuery.builder()
                .detectorId(detector)
                .patternKind(kind)
                .filePathContains(file)
                .tag(tag)
                .activeOnly(activeOnly)
                .descending(descending);
        if (sort != null) {
            builder.sortBy(PatternQuery.SortField.fromLabel(sort));
        }
        if (limit != null) {
            builder.limit(limit);
        }
        return builder.build();
    }

    private List<String> applyMaintenance(PatternStore store) {
        List<String> messages = new ArrayList<>();
        for (String id : orEmpty(deprecate)) {
            messages.add(report(store.updatePattern(PatternUpdate.forPattern(id).deprecate().build()), "Deprecated", id));
        }
        for (String id : orEmpty(skip)) {
            messages.add(report(store.updatePattern(PatternUpdate.forPattern(id).skipInFuture(true).build()), "Suppressed", id));
        }
        for (String id : orEmpty(unskip)) {
            messages.add(report(store.updatePattern(PatternUpdate.forPattern(id).skipInFuture(false).build()), "Unsuppressed", id));
        }
        if (cleanup) {
            messages.add("Removed " + store.cleanupDeprecatedPatterns() + " deprecated pattern(s)");
        }
        return messages;
    }

    private static String report(boolean applied, String action, String id) {
        return applied ? action + " " + id : "Unknown pattern: " + id;
    }

    private static List<String> orEmpty(List<String> ids) {
        return ids != null ? ids : List.of();
    }

    private void printStats(GlobalStats global, Map<String, DetectorStats> detectors) {
        out.println("Patterns: " + global.totalPatterns() + " (" + global.activePatterns() + " active, "
                + global.deprecatedPatterns() + " deprecated)");
        out.println("Detections: " + global.totalDetections() + " | Corrections: " + global.totalCorrections());
        out.println(String.format("Success rate: %.1f%% | False-positive rate: %.1f%%",
                global.overallSuccessRate() * 100, global.overallFalsePositiveRate() * 100));
        if (!detectors.isEmpty()) {
            out.println();
            out.println(String.format("%-24s %8s %9s %9s %8s", "DETECTOR", "PATTERNS", "SUCCESS", "FP", "AVG CONF"));
            detectors.entrySet().stream()
                    .sorted(Map.Entry.comparingByKey())
                    .forEach(e -> out.println(String.format("%-24s %8d %8.1f%% %8.1f%% %8.1f",
                            e.getKey(), e.getValue().patternCount(), e.getValue().successRate() * 100,
                            e.getValue().falsePositiveRate() * 100, e.getValue().avgConfidence())));
        }
        out.println();
    }

    private void printTable(List<PatternRecord> patterns) {
        if (patterns.isEmpty()) {
            out.println("No patterns match.");
            return;
        }
        out.println(String.format("%-48s %6s %9s %9s %s", "PATTERN", "SEEN", "SUCCESS", "FP", "STATUS"));
        for (PatternRecord record : patterns) {
            PatternPerformance performance = record.getPerformance();
            out.println(String.format("%-48s %6d %8.1f%% %8.1f%% %s",
                    record.getId(), performance.getDetectionCount(), performance.getSuccessRate() * 100,
                    performance.getFalsePositiveRate() * 100, status(record)));
        }
    }

    private static String status(PatternRecord record) {
        if (!record.getLifecycle().isActive()) {
            return "deprecated";
        }
        return record.isSuppressed() ? "suppressed" : "active";
    }

    private void printJson(PatternStore store, List<PatternRecord> patterns) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);

        Map<String, Object> document = new LinkedHashMap<>();
        if (stats) {
            document.put("globalStats", store.globalStats());
            document.put("detectorStats", store.detectorStats());
        }
        document.put("patterns", patterns);
        mapper.writeValue(out, document);
        out.println();
    }
}
