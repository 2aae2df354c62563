package io.taintscan.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reads the JSON call-graph representation produced by an external front end.
 * <p>
 * Expected shape:
 * <pre>
 * {
 *   "name": "...",
 *   "nodes": [{"id": "...", "kind": "ENTRY_POINT", "label": "...", "tags": {"role": "source"}}],
 *   "edges": [{"from": "...", "to": "...", "condition": "NEVER"}],
 *   "registeredEntryPoints": ["..."]
 * }
 * </pre>
 * Syntax and shape problems surface as {@link GraphFormatException}; structural problems
 * (duplicate ids, dangling edges, bad registrations) as {@link StructuralGraphException}.
 */
public class GraphLoader {

    private final ObjectMapper mapper;

    public GraphLoader() {
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Ingestion document, mirrors the JSON shape.
     */
    record GraphDocument(
            String name,
            List<NodeDocument> nodes,
            List<EdgeDocument> edges,
            List<String> registeredEntryPoints
    ) {}

    record NodeDocument(
            String id,
            String kind,
            String label,
            Map<String, Object> tags
    ) {}

    record EdgeDocument(
            String from,
            String to,
            String condition
    ) {}

    /**
     * Loads a graph from a file.
     */
    public TaintGraph load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    /**
     * Loads a graph from an input stream.
     */
    public TaintGraph load(InputStream in) throws IOException {
        GraphDocument document;
        try {
            document = mapper.readValue(in, GraphDocument.class);
        } catch (JsonProcessingException e) {
            throw new GraphFormatException("Invalid graph JSON: " + e.getOriginalMessage(), e);
        }
        return toGraph(document);
    }

    /**
     * Parses a graph from a JSON string.
     */
    public TaintGraph parse(String json) throws IOException {
        GraphDocument document;
        try {
            document = mapper.readValue(json, GraphDocument.class);
        } catch (JsonProcessingException e) {
            throw new GraphFormatException("Invalid graph JSON: " + e.getOriginalMessage(), e);
        }
        return toGraph(document);
    }

    private TaintGraph toGraph(GraphDocument document) throws GraphFormatException {
        if (document == null) {
            throw new GraphFormatException("Empty graph document");
        }
        if (document.nodes() == null) {
            throw new GraphFormatException("Graph document must specify 'nodes'");
        }

        TaintGraph.Builder builder = TaintGraph.builder().name(document.name());

        for (NodeDocument nodeDoc : document.nodes()) {
            builder.addNode(toNode(nodeDoc));
        }

        if (document.edges() != null) {
            for (EdgeDocument edgeDoc : document.edges()) {
                builder.addEdge(toEdge(edgeDoc));
            }
        }

        if (document.registeredEntryPoints() != null) {
            for (String id : document.registeredEntryPoints()) {
                builder.markEntryRegistered(id);
            }
        }

        return builder.build();
    }

    private Node toNode(NodeDocument doc) throws GraphFormatException {
        if (doc == null || doc.id() == null || doc.id().isBlank()) {
            throw new GraphFormatException("Every node must have a non-blank 'id'");
        }

        NodeKind kind;
        try {
            kind = NodeKind.parse(doc.kind());
        } catch (IllegalArgumentException e) {
            throw new GraphFormatException("Node '" + doc.id() + "' has invalid kind: " + doc.kind(), e);
        }

        Map<String, String> tags = new LinkedHashMap<>();
        if (doc.tags() != null) {
            doc.tags().forEach((key, value) -> {
                if (value instanceof Collection<?> values) {
                    tags.put(key, values.stream().map(String::valueOf).collect(Collectors.joining(",")));
                } else if (value != null) {
                    tags.put(key, String.valueOf(value));
                }
            });
        }

        return Node.builder()
                .id(doc.id())
                .kind(kind)
                .label(doc.label())
                .tags(tags)
                .build();
    }

    private Edge toEdge(EdgeDocument doc) throws GraphFormatException {
        if (doc == null || isBlank(doc.from()) || isBlank(doc.to())) {
            throw new GraphFormatException("Every edge must have 'from' and 'to'");
        }

        BranchCondition condition;
        try {
            condition = BranchCondition.parse(doc.condition());
        } catch (IllegalArgumentException e) {
            throw new GraphFormatException("Edge " + doc.from() + " -> " + doc.to()
                    + " has invalid condition: " + doc.condition(), e);
        }
        return new Edge(doc.from(), doc.to(), condition);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
