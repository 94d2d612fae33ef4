package io.repoinsight.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.repoinsight.confidence.ConfidenceScore;
import io.repoinsight.graph.Cycle;
import io.repoinsight.model.AnalysisReport;
import io.repoinsight.model.ArchitectureMetrics;
import io.repoinsight.model.Finding;
import io.repoinsight.model.Severity;

import java.io.IOException;
import java.io.Writer;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Formats analysis results as JSON for machine processing.
 */
public class JsonReporter implements Reporter {

    private final ObjectMapper mapper;
    private final boolean prettyPrint;

    public JsonReporter() {
        this(true);
    }

    public JsonReporter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
        this.mapper = createMapper();
    }

    private ObjectMapper createMapper() {
        ObjectMapper m = new ObjectMapper();
        m.registerModule(new JavaTimeModule());
        m.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        m.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // stdout must stay open after the report
        m.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        if (prettyPrint) {
            m.enable(SerializationFeature.INDENT_OUTPUT);
        }
        return m;
    }

    @Override
    public String format() {
        return "json";
    }

    @Override
    public void write(AnalysisReport report, Writer writer) throws IOException {
        mapper.writeValue(writer, toJsonReport(report));
    }

    JsonReport toJsonReport(AnalysisReport report) {
        Map<Severity, Long> counts = report.findingCountsBySeverity();
        return new JsonReport(
                new JsonReport.Metadata(report.source(), report.analyzedAt(), report.durationMs()),
                new JsonReport.Summary(
                        counts.getOrDefault(Severity.CRITICAL, 0L).intValue(),
                        counts.getOrDefault(Severity.HIGH, 0L).intValue(),
                        counts.getOrDefault(Severity.MEDIUM, 0L).intValue(),
                        counts.getOrDefault(Severity.LOW, 0L).intValue(),
                        counts.getOrDefault(Severity.INFO, 0L).intValue(),
                        report.totalFindings(),
                        report.suppressedCount()
                ),
                report.metrics(),
                report.findings().stream().map(this::toJsonFinding).toList(),
                report.cycles().stream()
                        .map(cycle -> new JsonReport.CycleEntry(cycle.path(), cycle.length(), cycle.severity()))
                        .toList(),
                report.topologicalOrder(),
                report.excludedFromOrder().isEmpty() ? null : report.excludedFromOrder(),
                report.criticalPath(),
                report.changedNodes().isEmpty() ? null : new JsonReport.Impact(report.changedNodes(), report.affectedNodes())
        );
    }

    private JsonReport.Finding toJsonFinding(Finding finding) {
        ConfidenceScore confidence = finding.confidence();
        return new JsonReport.Finding(
                finding.type().label(),
                finding.severity(),
                finding.nodeId(),
                finding.nodes().size() > 1 ? finding.nodes() : null,
                finding.message(),
                finding.recommendation(),
                finding.signature() != null ? finding.signature().patternId() : null,
                confidence
        );
    }

    /**
     * JSON structure for the report.
     */
    public record JsonReport(
            Metadata metadata,
            Summary summary,
            ArchitectureMetrics metrics,
            List<Finding> findings,
            List<CycleEntry> cycles,
            List<String> topologicalOrder,
            List<String> excludedFromOrder,
            List<String> criticalPath,
            Impact impact
    ) {
        public record Metadata(String source, Instant analyzedAt, long durationMs) {}

        public record Summary(int critical, int high, int medium, int low, int info, int total, int suppressed) {}

        public record Finding(
                String type,
                Severity severity,
                String nodeId,
                List<String> nodes,
                String message,
                String recommendation,
                String patternId,
                ConfidenceScore confidence
        ) {}

        public record CycleEntry(List<String> path, int length, Severity severity) {}

        public record Impact(List<String> changed, Map<String, Integer> affected) {}
    }
}
