package com.stardust.core.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed walker for dotted field paths over a JSON document tree.
 *
 * A path such as {@code content.mediaFiles.0.transcript} is split into segments. A segment
 * addresses an object member by name, or an array element when the segment is a
 * non-negative integer and the current node is an array. Reads never create nodes; writes
 * only replace values that already exist, so a path that does not resolve is left alone.
 */
public final class DocumentPath {

    private final String dotted;
    private final List<String> segments;

    private DocumentPath(String dotted, List<String> segments) {
        this.dotted = dotted;
        this.segments = segments;
    }

    public static DocumentPath parse(String dotted) {
        if (dotted == null || dotted.isBlank()) {
            throw new IllegalArgumentException("Field path must not be blank");
        }
        var parts = new ArrayList<String>();
        for (String part : dotted.split("\\.", -1)) {
            if (part.isEmpty()) {
                throw new IllegalArgumentException("Empty segment in field path: " + dotted);
            }
            parts.add(part);
        }
        return new DocumentPath(dotted, Collections.unmodifiableList(parts));
    }

    /**
     * Value at this path, empty when any segment is missing or the value is JSON null.
     */
    public Optional<JsonNode> read(JsonNode root) {
        JsonNode current = root;
        for (String segment : segments) {
            current = child(current, segment);
            if (current == null) {
                return Optional.empty();
            }
        }
        if (current.isNull() || current.isMissingNode()) {
            return Optional.empty();
        }
        return Optional.of(current);
    }

    /**
     * Replaces the value at this path.
     *
     * @return false when the parent container or the leaf does not exist
     */
    public boolean write(JsonNode root, JsonNode value) {
        JsonNode parent = parentOf(root);
        String leaf = leaf();
        if (parent instanceof ObjectNode object) {
            if (!object.has(leaf)) {
                return false;
            }
            object.set(leaf, value);
            return true;
        }
        if (parent instanceof ArrayNode array) {
            int index = indexOf(leaf);
            if (index < 0 || index >= array.size()) {
                return false;
            }
            array.set(index, value);
            return true;
        }
        return false;
    }

    /**
     * Removes the member at this path. Array elements are not removed, indexes must stay stable.
     */
    public boolean remove(JsonNode root) {
        JsonNode parent = parentOf(root);
        if (parent instanceof ObjectNode object && object.has(leaf())) {
            object.remove(leaf());
            return true;
        }
        return false;
    }

    private JsonNode parentOf(JsonNode root) {
        JsonNode current = root;
        for (int i = 0; i < segments.size() - 1; i++) {
            current = child(current, segments.get(i));
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    private static JsonNode child(JsonNode node, String segment) {
        if (node == null) {
            return null;
        }
        if (node.isObject()) {
            return node.get(segment);
        }
        if (node.isArray()) {
            int index = indexOf(segment);
            return index < 0 ? null : node.get(index);
        }
        return null;
    }

    private static int indexOf(String segment) {
        if (segment.isEmpty() || segment.length() > 9) {
            return -1;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return -1;
            }
        }
        return Integer.parseInt(segment);
    }

    private String leaf() {
        return segments.get(segments.size() - 1);
    }

    public List<String> segments() {
        return segments;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DocumentPath other)) return false;
        return dotted.equals(other.dotted);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dotted);
    }

    @Override
    public String toString() {
        return dotted;
    }
}
