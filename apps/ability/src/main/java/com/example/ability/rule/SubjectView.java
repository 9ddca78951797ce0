package com.example.ability.rule;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only view over a subject instance, backed by Jackson's tree model so that records,
 * beans and plain maps are all read the same way. Paths are dotted ({@code entity.id}).
 */
public final class SubjectView {

    private final JsonNode node;

    private SubjectView(JsonNode node) {
        this.node = node;
    }

    public static SubjectView of(@NonNull Object subject, @NonNull ObjectMapper objectMapper) {
        if (subject instanceof SubjectView view) {
            return view;
        }
        if (subject instanceof JsonNode json) {
            return new SubjectView(json);
        }
        return new SubjectView(objectMapper.valueToTree(subject));
    }

    /**
     * Node at the given path; {@link MissingNode} when any segment is absent.
     */
    @NonNull
    public JsonNode node(@NonNull String path) {
        JsonNode current = node;
        for (String segment : path.split("\\.")) {
            if (current == null || !current.isObject()) {
                return MissingNode.getInstance();
            }
            current = current.get(segment);
        }
        return current == null ? MissingNode.getInstance() : current;
    }

    /**
     * Scalar value at the given path as text. Null when absent, null, blank or not a scalar.
     */
    @Nullable
    public String text(@NonNull String path) {
        JsonNode value = node(path);
        if (!value.isValueNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    /**
     * Array of scalars at the given path. Empty when absent or not an array.
     */
    @NonNull
    public List<String> texts(@NonNull String path) {
        JsonNode value = node(path);
        if (!value.isArray()) {
            return List.of();
        }
        List<String> texts = new ArrayList<>(value.size());
        for (JsonNode element : value) {
            if (element.isValueNode() && !element.isNull()) {
                texts.add(element.asText());
            }
        }
        return texts;
    }

    @NonNull
    public JsonNode asJson() {
        return node;
    }

    @Override
    public String toString() {
        return node.toString();
    }
}
