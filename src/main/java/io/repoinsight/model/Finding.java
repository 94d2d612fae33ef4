package io.repoinsight.model;

import io.repoinsight.confidence.ConfidenceScore;
import io.repoinsight.learning.PatternSignature;

import java.util.List;

/**
 * A structural problem found in a dependency graph.
 *
 * @param type           Kind of finding
 * @param severity       Severity of the finding
 * @param nodeId         Primary node of the finding
 * @param nodes          Every node involved, in path order for cycles
 * @param message        Human-readable description
 * @param recommendation Recommended action
 * @param signature      Learning identity of the finding
 * @param confidence     Calibrated confidence, if scored
 */
public record Finding(
        FindingType type,
        Severity severity,
        String nodeId,
        List<String> nodes,
        String message,
        String recommendation,
        PatternSignature signature,
        ConfidenceScore confidence
) {

    public Finding {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null");
        }
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("nodeId cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        nodes = nodes == null ? List.of(nodeId) : List.copyOf(nodes);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Finding withConfidence(ConfidenceScore confidence) {
        return new Finding(type, severity, nodeId, nodes, message, recommendation, signature, confidence);
    }

    /**
     * Confidence score, or -1 when the finding has not been scored.
     */
    public int confidenceScore() {
        return confidence != null ? confidence.score() : -1;
    }

    public static class Builder {
        private FindingType type;
        private Severity severity;
        private String nodeId;
        private List<String> nodes;
        private String message;
        private String recommendation;
        private PatternSignature signature;
        private ConfidenceScore confidence;

        public Builder type(FindingType type) {
            this.type = type;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder nodeId(String nodeId) {
            this.nodeId = nodeId;
            return this;
        }

        public Builder nodes(List<String> nodes) {
            this.nodes = nodes;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder recommendation(String recommendation) {
            this.recommendation = recommendation;
            return this;
        }

        public Builder signature(PatternSignature signature) {
            this.signature = signature;
            return this;
        }

        public Builder confidence(ConfidenceScore confidence) {
            this.confidence = confidence;
            return this;
        }

        public Finding build() {
            return new Finding(type, severity, nodeId, nodes, message, recommendation, signature, confidence);
        }
    }
}
