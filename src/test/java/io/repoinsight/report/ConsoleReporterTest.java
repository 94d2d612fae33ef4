package io.repoinsight.report;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConsoleReporterTest {

    @Test
    void write_rendersAllSections() {
        String output = new ConsoleReporter(false).toString(ReportFixtures.reportWithCycle());

        assertThat(output).contains("REPO-INSIGHT REPORT");
        assertThat(output).contains("Source: layered.json");
        assertThat(output).contains("SUMMARY", "METRICS", "FINDINGS", "DEPENDENCY ORDER", "CHANGE IMPACT");
        assertThat(output).contains("Findings: 0 critical | 1 high | 0 medium | 0 low (2 suppressed)");
        assertThat(output).contains("[HIGH] HIGH (1)");
        assertThat(output).contains("[1] Circular Dependency  " + ReportFixtures.REPO);
        assertThat(output).contains("Recommendation: Invert one dependency.");
        assertThat(output).contains("Confidence: 90% very-high: exact pattern match");
    }

    @Test
    void write_rendersOrderingAndImpact() {
        String output = new ConsoleReporter(false).toString(ReportFixtures.reportWithCycle());

        assertThat(output).contains("Order: " + ReportFixtures.UTIL);
        assertThat(output).contains("Excluded (cyclic): " + ReportFixtures.SERVICE + ", " + ReportFixtures.REPO);
        assertThat(output).contains("Critical path (2): " + ReportFixtures.REPO + " -> " + ReportFixtures.SERVICE);
        assertThat(output).contains("Cycle: " + ReportFixtures.REPO + " -> " + ReportFixtures.SERVICE
                + " -> " + ReportFixtures.REPO);
        assertThat(output).contains("CHANGE IMPACT (2 affected)");
        assertThat(output).contains(ReportFixtures.SERVICE + " (distance 1)");
        assertThat(output).contains("ATTENTION: 1 high-severity finding(s) should be reviewed.");
    }

    @Test
    void write_cleanReportHasNoFindingsSection() {
        String output = new ConsoleReporter(false).toString(ReportFixtures.cleanReport());

        assertThat(output).doesNotContain("FINDINGS", "CHANGE IMPACT", "Excluded (cyclic)");
        assertThat(output).contains("No high-severity issues found.");
    }

    @Test
    void write_withoutColorsHasNoEscapeCodes() {
        assertThat(new ConsoleReporter(false).toString(ReportFixtures.reportWithCycle())).doesNotContain("\u001B[");
        assertThat(new ConsoleReporter(true).toString(ReportFixtures.reportWithCycle())).contains("\u001B[");
    }
}
