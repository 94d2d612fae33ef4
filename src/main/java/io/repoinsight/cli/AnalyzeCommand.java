package io.repoinsight.cli;

import io.repoinsight.analysis.ArchitectureBaseline;
import io.repoinsight.analysis.BaselineFile;
import io.repoinsight.analysis.GraphAnalyzer;
import io.repoinsight.confidence.AdaptiveConfidence;
import io.repoinsight.config.InsightConfig;
import io.repoinsight.graph.AdjacencyFileReader;
import io.repoinsight.graph.DependencyGraph;
import io.repoinsight.learning.PatternStore;
import io.repoinsight.model.AnalysisReport;
import io.repoinsight.model.Severity;
import io.repoinsight.report.ConsoleReporter;
import io.repoinsight.report.JsonReporter;
import io.repoinsight.report.MermaidExporter;
import io.repoinsight.report.Reporter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Analyses a dependency graph read from an adjacency file.
 */
@Command(
        name = "analyze",
        mixinStandardHelpOptions = true,
        description = "Detects cycles, layer violations, high coupling and architecture drift in a dependency graph."
)
public class AnalyzeCommand implements Callable<Integer> {

    @Parameters(
            index = "0",
            description = "Adjacency JSON file: an object of node -> targets, or an array of facts"
    )
    private Path adjacencyFile;

    @Mixin
    private ConfigOptions configOptions = new ConfigOptions();

    @Option(
            names = {"-o", "--output-format"},
            description = "Output format: console (default), json",
            defaultValue = "console"
    )
    private OutputFormat outputFormat;

    @Option(
            names = {"-f", "--output-file"},
            description = "Output file path (defaults to stdout)"
    )
    private Path outputFile;

    @Option(
            names = {"--changed"},
            description = "Changed node ids to compute impact for (comma-separated)",
            split = ","
    )
    private List<String> changed;

    @Option(
            names = {"--baseline"},
            description = "Baseline file: compared for architecture drift, then overwritten with this run"
    )
    private Path baselineFile;

    @Option(
            names = {"--mermaid"},
            description = "Also write the graph as a Mermaid diagram to this file"
    )
    private Path mermaidFile;

    @Option(
            names = {"--no-learning"},
            description = "Score findings without the learned pattern state"
    )
    private boolean noLearning;

    @Option(
            names = {"--fail-on"},
            description = "Exit with code 2 if findings at this level or higher: critical, high, medium, low",
            defaultValue = "critical"
    )
    private String failOnLevel;

    @Option(
            names = {"--no-color"},
            description = "Disable ANSI colors in console output"
    )
    private boolean noColor;

    @Option(
            names = {"-v", "--verbose"},
            description = "Print stack traces on errors"
    )
    private boolean verbose;

    public enum OutputFormat {
        console,
        json
    }

    @Override
    public Integer call() {
        try {
            if (!Files.isRegularFile(adjacencyFile)) {
                System.err.println("Error: Adjacency file does not exist: " + adjacencyFile);
                return 1;
            }
            Severity failLevel = parseSeverity(failOnLevel);
            if (failLevel == null) return 1;

            InsightConfig config = configOptions.load(Path.of(""));
            DependencyGraph graph = new AdjacencyFileReader().readGraph(adjacencyFile);
            Set<String> changedIds = changed != null ? new LinkedHashSet<>(changed) : Set.of();
            BaselineFile baselines = baselineFile != null ? new BaselineFile(baselineFile) : null;
            ArchitectureBaseline baseline = baselines != null ? baselines.load().orElse(null) : null;

            AnalysisReport report;
            if (noLearning || !config.learning().enabled()) {
                report = new GraphAnalyzer(config.architecture(), AdaptiveConfidence.withoutLearning())
                        .analyze(graph, adjacencyFile.toString(), changedIds, baseline);
            } else {
                try (PatternStore store = PatternStore.open(config.learning())) {
                    report = new GraphAnalyzer(config.architecture(), new AdaptiveConfidence(store))
                            .analyze(graph, adjacencyFile.toString(), changedIds, baseline);
                }
            }

            writeReport(report, createReporter());
            if (mermaidFile != null) {
                new MermaidExporter().write(graph, report.cycles(), mermaidFile);
                if (outputFormat == OutputFormat.console) {
                    System.out.println("Mermaid diagram written to: " + mermaidFile);
                }
            }
            if (baselines != null) {
                baselines.save(ArchitectureBaseline.of(report));
            }

            if (report.hasFindingsAtLeast(failLevel)) {
                if (outputFormat == OutputFormat.console) {
                    System.err.println();
                    System.err.println("Failing due to findings at " + failLevel.label() + " level or higher.");
                }
                return 2;
            }
            return 0;
        } catch (IOException | RuntimeException e) {
            System.err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return 1;
        }
    }

    private Reporter createReporter() {
        return switch (outputFormat) {
            case console -> new ConsoleReporter(!noColor);
            case json -> new JsonReporter(true);
        };
    }

    private void writeReport(AnalysisReport report, Reporter reporter) throws IOException {
        if (outputFile != null) {
            reporter.write(report, outputFile);
            if (outputFormat == OutputFormat.console) {
                System.out.println("Report written to: " + outputFile);
            }
        } else {
            reporter.write(report, new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
        }
    }

    private Severity parseSeverity(String value) {
        try {
            return Severity.fromLabel(value);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: Invalid value for --fail-on: " + value);
            System.err.println("Valid values: critical, high, medium, low, info");
            return null;
        }
    }
}
