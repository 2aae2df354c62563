package io.taintscan.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * A node of the taint graph. Immutable once constructed.
 * <p>
 * The node's semantic role is never stored here: it is derived from the declared
 * {@code tags} by the node classifier.
 *
 * @param id    Unique id within the graph
 * @param kind  Structural kind
 * @param label Human-readable name (defaults to the id)
 * @param tags  Declared metadata, keys lower-cased (e.g. {@code role=validator, strength=strict})
 */
public record Node(
        String id,
        NodeKind kind,
        String label,
        Map<String, String> tags
) {
    public static final String TAG_ROLE = "role";
    public static final String TAG_STRENGTH = "strength";
    public static final String TAG_PROTECTS = "protects";
    public static final String TAG_SINK = "sink";

    public Node {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Node id cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Node kind cannot be null: " + id);
        }
        if (label == null || label.isBlank()) {
            label = id;
        }
        tags = normalizeTags(tags);
    }

    private static Map<String, String> normalizeTags(Map<String, String> tags) {
        if (tags == null || tags.isEmpty()) {
            return Map.of();
        }
        Map<String, String> normalized = new LinkedHashMap<>();
        tags.forEach((key, value) -> {
            if (key != null && value != null) {
                normalized.put(key.trim().toLowerCase(Locale.ROOT), value.trim());
            }
        });
        return Collections.unmodifiableMap(normalized);
    }

    /**
     * Creates a node with no tags.
     */
    public static Node of(String id, NodeKind kind) {
        return new Node(id, kind, null, Map.of());
    }

    /**
     * Returns the value of a declared tag.
     */
    public Optional<String> tag(String key) {
        return Optional.ofNullable(tags.get(key.toLowerCase(Locale.ROOT)));
    }

    public boolean isSink() {
        return kind == NodeKind.SINK;
    }

    public boolean isEntryPoint() {
        return kind == NodeKind.ENTRY_POINT;
    }

    /**
     * Builder for creating Node instances.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private NodeKind kind = NodeKind.CALL;
        private String label;
        private final Map<String, String> tags = new LinkedHashMap<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder kind(NodeKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder tag(String key, String value) {
            this.tags.put(key, value);
            return this;
        }

        public Builder tags(Map<String, String> tags) {
            if (tags != null) {
                this.tags.putAll(tags);
            }
            return this;
        }

        public Node build() {
            return new Node(id, kind, label, tags);
        }
    }
}
