package io.repoinsight.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads adjacency facts from JSON.
 * <p>
 * Two shapes are accepted. An object maps each node id to its targets:
 * <pre>{ "a.ts": ["b.ts", "c.ts"], "b.ts": [] }</pre>
 * An array lists one fact per entry, with optional kinds:
 * <pre>[ { "nodeId": "app", "targets": ["lib"], "kind": "package", "edgeKind": "dev-dependency" } ]</pre>
 */
public class AdjacencyFileReader {

    private final ObjectMapper mapper = new ObjectMapper();

    public List<AdjacencyFact> read(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return read(is, path.toString());
        }
    }

    public DependencyGraph readGraph(Path path) throws IOException {
        return DependencyGraph.fromAdjacency(read(path));
    }

    /**
     * @param source Name used in error messages
     * @throws IOException if the input is not valid JSON or has neither accepted shape
     */
    public List<AdjacencyFact> read(InputStream is, String source) throws IOException {
        JsonNode root;
        try {
            root = mapper.readTree(is);
        } catch (JsonProcessingException e) {
            throw new IOException("Invalid JSON in " + source + ": " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            return List.of();
        }
        try {
            if (root.isObject()) {
                return fromObject(root, source);
            }
            if (root.isArray()) {
                return fromArray(root, source);
            }
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid adjacency in " + source + ": " + e.getMessage(), e);
        }
        throw new IOException("Adjacency in " + source + " must be a JSON object or array");
    }

    private List<AdjacencyFact> fromObject(JsonNode root, String source) throws IOException {
        List<AdjacencyFact> facts = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            facts.add(AdjacencyFact.of(field.getKey(), targets(field.getValue(), field.getKey(), source)));
        }
        return facts;
    }

    private List<AdjacencyFact> fromArray(JsonNode root, String source) throws IOException {
        List<AdjacencyFact> facts = new ArrayList<>();
        int index = 0;
        for (JsonNode entry : root) {
            if (!entry.isObject() || !entry.path("nodeId").isTextual()) {
                throw new IOException("Entry " + index + " in " + source + " needs a string 'nodeId'");
            }
            String nodeId = entry.get("nodeId").asText();
            NodeKind kind = entry.hasNonNull("kind") ? NodeKind.fromLabel(entry.get("kind").asText()) : NodeKind.FILE;
            EdgeKind edgeKind = entry.hasNonNull("edgeKind")
                    ? EdgeKind.fromLabel(entry.get("edgeKind").asText())
                    : EdgeKind.DEPENDENCY;
            facts.add(new AdjacencyFact(nodeId, targets(entry.path("targets"), nodeId, source), kind, edgeKind));
            index++;
        }
        return facts;
    }

    private static List<String> targets(JsonNode node, String nodeId, String source) throws IOException {
        if (node.isMissingNode() || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new IOException("Targets of " + nodeId + " in " + source + " must be an array");
        }
        List<String> targets = new ArrayList<>();
        for (JsonNode target : node) {
            if (!target.isTextual()) {
                throw new IOException("Targets of " + nodeId + " in " + source + " must be strings");
            }
            targets.add(target.asText());
        }
        return targets;
    }
}
