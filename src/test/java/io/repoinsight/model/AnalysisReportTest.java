package io.repoinsight.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisReportTest {

    private static Finding finding(Severity severity, String nodeId) {
        return Finding.builder()
                .type(FindingType.HIGH_COUPLING)
                .severity(severity)
                .nodeId(nodeId)
                .message("High coupling detected: 12 dependencies (max: 10)")
                .build();
    }

    private static AnalysisReport report(Finding... findings) {
        return AnalysisReport.builder()
                .findings(List.of(findings))
                .metrics(new ArchitectureMetrics(0, 0, 0, 0, 0, 100, 100))
                .build();
    }

    @Test
    void hasFindingsAtLeast_respectsRank() {
        AnalysisReport report = report(finding(Severity.MEDIUM, "a"), finding(Severity.LOW, "b"));

        assertThat(report.hasFindingsAtLeast(Severity.HIGH)).isFalse();
        assertThat(report.hasFindingsAtLeast(Severity.MEDIUM)).isTrue();
        assertThat(report.findingsAtLeast(Severity.MEDIUM)).extracting(Finding::nodeId).containsExactly("a");
    }

    @Test
    void findingCountsBySeverity_groupsFindings() {
        AnalysisReport report = report(finding(Severity.HIGH, "a"), finding(Severity.HIGH, "b"),
                finding(Severity.LOW, "c"));

        assertThat(report.findingCountsBySeverity())
                .containsEntry(Severity.HIGH, 2L)
                .containsEntry(Severity.LOW, 1L)
                .doesNotContainKey(Severity.CRITICAL);
        assertThat(report.totalFindings()).isEqualTo(3);
        assertThat(report.durationMs()).isZero();
    }

    @Test
    void finding_defaultsNodesToPrimaryNode() {
        Finding finding = finding(Severity.MEDIUM, "a");

        assertThat(finding.nodes()).containsExactly("a");
        assertThat(finding.confidenceScore()).isEqualTo(-1);
    }

    @Test
    void finding_requiresMessage() {
        assertThatThrownBy(() -> Finding.builder()
                .type(FindingType.LAYER_VIOLATION)
                .severity(Severity.HIGH)
                .nodeId("a")
                .build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void severity_parsesLabelsCaseInsensitively() {
        assertThat(Severity.fromLabel("HIGH")).isEqualTo(Severity.HIGH);
        assertThat(Severity.CRITICAL.isAtLeast(Severity.HIGH)).isTrue();
        assertThat(Severity.LOW.isAtLeast(Severity.HIGH)).isFalse();
        assertThatThrownBy(() -> Severity.fromLabel("severe"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown severity: severe");
    }
}
