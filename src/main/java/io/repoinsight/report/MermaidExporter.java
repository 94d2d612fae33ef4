package io.repoinsight.report;

import io.repoinsight.graph.Cycle;
import io.repoinsight.graph.DependencyGraph;
import io.repoinsight.graph.GraphEdge;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Renders a dependency graph as a Mermaid {@code graph TD} diagram.
 * <p>
 * Only the first {@value #DEFAULT_MAX_NODES} nodes (in insertion order) and the edges between them
 * are drawn. Every cycle is drawn as dashed {@code cycle} edges.
 */
public class MermaidExporter {

    public static final int DEFAULT_MAX_NODES = 50;

    private final int maxNodes;

    public MermaidExporter() {
        this(DEFAULT_MAX_NODES);
    }

    public MermaidExporter(int maxNodes) {
        if (maxNodes < 1) {
            throw new IllegalArgumentException("maxNodes must be >= 1, got " + maxNodes);
        }
        this.maxNodes = maxNodes;
    }

    public void write(DependencyGraph graph, List<Cycle> cycles, Writer writer) throws IOException {
        PrintWriter out = new PrintWriter(writer);
        out.print("graph TD\n");

        Set<String> shown = new LinkedHashSet<>();
        for (String id : graph.nodeIds()) {
            if (shown.size() == maxNodes) {
                break;
            }
            shown.add(id);
            out.print("  " + mermaidId(id) + "[\"" + label(id) + "\"]\n");
        }

        for (GraphEdge edge : graph.edges()) {
            if (shown.contains(edge.from()) && shown.contains(edge.to())) {
                out.print("  " + mermaidId(edge.from()) + " --> " + mermaidId(edge.to()) + "\n");
            }
        }

        for (Cycle cycle : cycles) {
            List<String> path = cycle.path();
            if (path.size() < 2) {
                continue;
            }
            out.print("\n  %% Circular dependency\n");
            for (int i = 0; i < path.size(); i++) {
                String from = mermaidId(path.get(i));
                String to = mermaidId(path.get((i + 1) % path.size()));
                out.print("  " + from + " -.->|cycle| " + to + "\n");
            }
        }

        out.print("\n  classDef circularNode fill:#f96,stroke:#333,stroke-width:2px\n");
        out.flush();
        if (out.checkError()) {
            throw new IOException("Failed to write Mermaid diagram");
        }
    }

    public void write(DependencyGraph graph, List<Cycle> cycles, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path)) {
            write(graph, cycles, writer);
        }
    }

    public String toString(DependencyGraph graph, List<Cycle> cycles) {
        try {
            StringWriter writer = new StringWriter();
            write(graph, cycles, writer);
            return writer.toString();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to generate Mermaid diagram", e);
        }
    }

    /**
     * Node ids with every character outside [A-Za-z0-9] replaced by '_'.
     */
    static String mermaidId(String nodeId) {
        return nodeId.replaceAll("[^a-zA-Z0-9]", "_");
    }

    /**
     * Last path segment of the node id.
     */
    static String label(String nodeId) {
        String trimmed = nodeId.endsWith("/") ? nodeId.substring(0, nodeId.length() - 1) : nodeId;
        int slash = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf('\\'));
        String name = slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
        return name.replace("\"", "#quot;");
    }
}
