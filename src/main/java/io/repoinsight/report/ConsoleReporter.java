package io.repoinsight.report;

import io.repoinsight.graph.Cycle;
import io.repoinsight.model.AnalysisReport;
import io.repoinsight.model.ArchitectureMetrics;
import io.repoinsight.model.Finding;
import io.repoinsight.model.Severity;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.util.List;
import java.util.Map;

/**
 * Formats analysis results for console output with ANSI colors.
 * <p>
 * Sections: summary, metrics, findings grouped by severity, dependency order and change impact.
 */
public class ConsoleReporter implements Reporter {

    // ANSI color codes
    private static final String RESET = "\u001B[0m";
    private static final String BOLD = "\u001B[1m";
    private static final String RED = "\u001B[31m";
    private static final String YELLOW = "\u001B[33m";
    private static final String GREEN = "\u001B[32m";
    private static final String CYAN = "\u001B[36m";

    private static final int WIDTH = 70;
    private static final int MAX_LISTED_NODES = 20;

    private final boolean useColors;

    public ConsoleReporter() {
        this(true);
    }

    public ConsoleReporter(boolean useColors) {
        this.useColors = useColors;
    }

    @Override
    public String format() {
        return "console";
    }

    @Override
    public void write(AnalysisReport report, Writer writer) throws IOException {
        PrintWriter out = new PrintWriter(writer);

        printHeader(out, report);
        printSummary(out, report);
        printMetrics(out, report.metrics());
        printFindings(out, report);
        printOrdering(out, report);
        if (!report.changedNodes().isEmpty()) {
            printImpact(out, report);
        }
        printFooter(out, report);
        out.flush();
    }

    private void printHeader(PrintWriter out, AnalysisReport report) {
        out.println();
        out.println(line('=', WIDTH));
        out.println(center("REPO-INSIGHT REPORT", WIDTH));
        out.println(line('=', WIDTH));
        out.println();
        if (report.source() != null) {
            out.println("Source: " + report.source());
        }
        if (report.analyzedAt() != null) {
            out.println("Analyzed: " + report.analyzedAt());
        }
        out.println();
    }

    private void printSummary(PrintWriter out, AnalysisReport report) {
        out.println(bold("SUMMARY"));
        out.println(line('-', WIDTH));

        ArchitectureMetrics metrics = report.metrics();
        out.println(String.format("Graph: %,d nodes | %,d edges | %.1fs",
                metrics.totalModules(), metrics.totalDependencies(), report.durationMs() / 1000.0));

        long critical = report.countBySeverity(Severity.CRITICAL);
        long high = report.countBySeverity(Severity.HIGH);
        long medium = report.countBySeverity(Severity.MEDIUM);
        long low = report.countBySeverity(Severity.LOW);

        StringBuilder findings = new StringBuilder("Findings: ");
        findings.append(critical > 0 ? color(RED, critical + " critical") : "0 critical").append(" | ");
        findings.append(high > 0 ? color(YELLOW, high + " high") : "0 high").append(" | ");
        findings.append(medium).append(" medium | ").append(low).append(" low");
        if (report.suppressedCount() > 0) {
            findings.append(" (").append(report.suppressedCount()).append(" suppressed)");
        }
        out.println(findings);
        out.println();
    }

    private void printMetrics(PrintWriter out, ArchitectureMetrics metrics) {
        out.println(bold("METRICS"));
        out.println(line('-', WIDTH));
        out.println(String.format("Cycles: %d | Layer violations: %d | Avg coupling: %.2f",
                metrics.circularDependencies(), metrics.layerViolations(), metrics.averageCoupling()));
        out.println(String.format("Layer health: %.0f/100 | Architecture score: %s",
                metrics.layerHealth(), scoreColor(metrics.architectureScore())));
        out.println();
    }

    private void printFindings(PrintWriter out, AnalysisReport report) {
        if (report.findings().isEmpty()) {
            return;
        }
        out.println(bold("FINDINGS"));
        out.println(line('=', WIDTH));
        int index = 1;
        for (Severity severity : Severity.values()) {
            List<Finding> group = report.findings().stream()
                    .filter(f -> f.severity() == severity)
                    .toList();
            if (group.isEmpty()) {
                continue;
            }
            out.println(getSeverityIndicator(severity) + " " + bold(severity.name())
                    + color(CYAN, " (" + group.size() + ")"));
            out.println(line('-', WIDTH));
            for (Finding finding : group) {
                printFinding(out, index++, finding);
            }
        }
    }

    private void printFinding(PrintWriter out, int index, Finding finding) {
        out.println("[" + index + "] " + bold(finding.type().displayName()) + "  " + finding.nodeId());
        out.println("    " + finding.message());
        if (finding.confidence() != null) {
            out.println("    Confidence: " + finding.confidence().explanation());
        }
        if (finding.recommendation() != null) {
            out.println("    " + color(GREEN, "Recommendation: " + finding.recommendation()));
        }
        out.println();
    }

    private void printOrdering(PrintWriter out, AnalysisReport report) {
        out.println(bold("DEPENDENCY ORDER"));
        out.println(line('-', WIDTH));
        out.println("Order: " + abbreviate(report.topologicalOrder()));
        if (!report.excludedFromOrder().isEmpty()) {
            out.println(color(YELLOW, "Excluded (cyclic): " + abbreviate(report.excludedFromOrder())));
        }
        if (!report.criticalPath().isEmpty()) {
            out.println("Critical path (" + report.criticalPath().size() + "): "
                    + String.join(" -> ", report.criticalPath()));
        }
        for (Cycle cycle : report.cycles()) {
            out.println("  Cycle: " + cycle.pathString());
        }
        out.println();
    }

    private void printImpact(PrintWriter out, AnalysisReport report) {
        out.println(bold("CHANGE IMPACT") + color(CYAN, " (" + report.affectedNodes().size() + " affected)"));
        out.println(line('-', WIDTH));
        out.println("Changed: " + String.join(", ", report.changedNodes()));
        for (Map.Entry<String, Integer> entry : report.affectedNodes().entrySet()) {
            out.println("  " + entry.getKey() + color(CYAN, " (distance " + entry.getValue() + ")"));
        }
        out.println();
    }

    private void printFooter(PrintWriter out, AnalysisReport report) {
        out.println(line('=', WIDTH));
        long critical = report.countBySeverity(Severity.CRITICAL);
        long high = report.countBySeverity(Severity.HIGH);
        if (critical > 0) {
            out.println(color(RED, bold("ACTION REQUIRED: " + critical + " critical finding(s).")));
        } else if (high > 0) {
            out.println(color(YELLOW, "ATTENTION: " + high + " high-severity finding(s) should be reviewed."));
        } else {
            out.println(color(GREEN, "No high-severity issues found."));
        }
        out.println();
    }

    private String abbreviate(List<String> ids) {
        if (ids.isEmpty()) {
            return "(none)";
        }
        if (ids.size() <= MAX_LISTED_NODES) {
            return String.join(", ", ids);
        }
        return String.join(", ", ids.subList(0, MAX_LISTED_NODES))
                + " ... (" + (ids.size() - MAX_LISTED_NODES) + " more)";
    }

    private String scoreColor(double score) {
        String text = String.format("%.0f/100", score);
        if (score >= 80) {
            return color(GREEN, text);
        }
        if (score >= 50) {
            return color(YELLOW, text);
        }
        return color(RED, text);
    }

    private String getSeverityIndicator(Severity severity) {
        return switch (severity) {
            case CRITICAL -> color(RED, "[CRIT]");
            case HIGH -> color(YELLOW, "[HIGH]");
            case MEDIUM -> "[MED]";
            case LOW -> "[LOW]";
            case INFO -> color(CYAN, "[INFO]");
        };
    }

    private String color(String color, String text) {
        if (!useColors) return text;
        return color + text + RESET;
    }

    private String bold(String text) {
        if (!useColors) return text;
        return BOLD + text + RESET;
    }

    private String line(char c, int length) {
        return String.valueOf(c).repeat(length);
    }

    private String center(String text, int width) {
        if (text.length() >= width) return text;
        int padding = (width - text.length()) / 2;
        return " ".repeat(padding) + text;
    }
}
