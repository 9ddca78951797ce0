package com.example.ability.engine;

import com.example.ability.exception.UndefinedVariableException;
import com.example.ability.model.User;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.Iterator;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code ${path.to.value}} placeholders in a conditions template.
 *
 * <p>Only strings that consist entirely of one placeholder are replaced, by the value found at
 * the dotted path inside the variables (which may be any JSON type). Numeric segments index into
 * arrays ({@code user.roles.0.name}). Everything else is copied
 * unchanged. The template itself is never modified.</p>
 */
@RequiredArgsConstructor
public class ConditionsTemplateResolver {

    private static final Pattern PLACEHOLDER = Pattern.compile("^\\$\\{([^{}]+)}$");

    private static final Pattern ARRAY_INDEX = Pattern.compile("\\d{1,9}");

    private static final String USER_VARIABLE = "user";

    private final ObjectMapper objectMapper;

    /**
     * Resolve a declaration's conditions against the acting user.
     *
     * @throws UndefinedVariableException if a placeholder path does not resolve
     */
    @Nullable
    public JsonNode resolve(@Nullable Map<String, Object> template, @NonNull User user) {
        if (template == null) {
            return null;
        }
        return resolve(objectMapper.valueToTree(template), Map.of(USER_VARIABLE, user));
    }

    /**
     * Resolve a template against arbitrary variables.
     *
     * @throws UndefinedVariableException if a placeholder path does not resolve
     */
    @NonNull
    public JsonNode resolve(@NonNull JsonNode template, @NonNull Map<String, ?> variables) {
        JsonNode scope = objectMapper.valueToTree(variables);
        return substitute(template, scope);
    }

    private JsonNode substitute(JsonNode node, JsonNode variables) {
        if (node.isTextual()) {
            Matcher matcher = PLACEHOLDER.matcher(node.textValue());
            return matcher.matches() ? lookup(variables, matcher.group(1).trim()) : node;
        }
        if (node.isArray()) {
            ArrayNode copy = objectMapper.createArrayNode();
            for (JsonNode element : node) {
                copy.add(substitute(element, variables));
            }
            return copy;
        }
        if (node.isObject()) {
            ObjectNode copy = objectMapper.createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                copy.set(field.getKey(), substitute(field.getValue(), variables));
            }
            return copy;
        }
        return node.deepCopy();
    }

    private JsonNode lookup(JsonNode variables, String path) {
        JsonNode current = variables;
        for (String segment : path.split("\\.")) {
            current = step(current, segment);
            if (current == null || current.isNull()) {
                throw new UndefinedVariableException(path);
            }
        }
        return current.deepCopy();
    }

    @Nullable
    private static JsonNode step(JsonNode node, String segment) {
        if (node.isObject()) {
            return node.get(segment);
        }
        if (node.isArray() && ARRAY_INDEX.matcher(segment).matches()) {
            return node.get(Integer.parseInt(segment));
        }
        return null;
    }
}
