package com.example.ability.rule;

import com.example.ability.exception.AbilityException;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.Iterator;
import java.util.Map;

/**
 * Matches a resolved conditions document against a subject.
 *
 * <p>Supported: plain field equality (an array field matches when any element is equal),
 * and the operators {@code $eq}, {@code $ne}, {@code $in}, {@code $nin} and {@code $exists}.
 * Field names may be dotted paths. Numbers compare by value ({@code 1} equals {@code 1.0}); other
 * scalars compare by their text form, so {@code "5"} equals {@code 5}.</p>
 */
public final class ConditionsMatcher {

    private ConditionsMatcher() {}

    public static boolean matches(@Nullable JsonNode conditions, @NonNull SubjectView subject) {
        if (conditions == null || conditions.isNull()) {
            return true;
        }
        if (!conditions.isObject()) {
            throw new AbilityException("conditions must be an object, got " + conditions.getNodeType());
        }

        Iterator<Map.Entry<String, JsonNode>> fields = conditions.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!matchesField(subject.node(field.getKey()), field.getValue())) {
                return false;
            }
        }
        return true;
    }

    private static boolean matchesField(JsonNode actual, JsonNode expected) {
        if (!isOperatorDocument(expected)) {
            return equalsValue(actual, expected);
        }

        Iterator<Map.Entry<String, JsonNode>> operators = expected.fields();
        while (operators.hasNext()) {
            Map.Entry<String, JsonNode> operator = operators.next();
            JsonNode operand = operator.getValue();
            boolean satisfied = switch (operator.getKey()) {
                case "$eq" -> equalsValue(actual, operand);
                case "$ne" -> !equalsValue(actual, operand);
                case "$in" -> in(actual, operand);
                case "$nin" -> !in(actual, operand);
                case "$exists" -> operand.asBoolean() == !actual.isMissingNode();
                default -> throw new AbilityException("unsupported condition operator " + operator.getKey());
            };
            if (!satisfied) {
                return false;
            }
        }
        return true;
    }

    private static boolean in(JsonNode actual, JsonNode candidates) {
        if (!candidates.isArray()) {
            throw new AbilityException("$in and $nin expect an array, got " + candidates.getNodeType());
        }
        for (JsonNode candidate : candidates) {
            if (equalsValue(actual, candidate)) {
                return true;
            }
        }
        return false;
    }

    private static boolean equalsValue(JsonNode actual, JsonNode expected) {
        if (actual.isMissingNode()) {
            return expected.isNull();
        }
        if (actual.isArray() && !expected.isArray()) {
            for (JsonNode element : actual) {
                if (sameValue(element, expected)) {
                    return true;
                }
            }
            return false;
        }
        return sameValue(actual, expected);
    }

    private static boolean sameValue(JsonNode left, JsonNode right) {
        if (left.isNull() || right.isNull()) {
            return left.isNull() && right.isNull();
        }
        if (left.isNumber() && right.isNumber()) {
            return left.decimalValue().compareTo(right.decimalValue()) == 0;
        }
        if (left.isValueNode() && right.isValueNode()) {
            return left.asText().equals(right.asText());
        }
        return left.equals(right);
    }

    private static boolean isOperatorDocument(JsonNode expected) {
        if (!expected.isObject() || expected.isEmpty()) {
            return false;
        }
        Iterator<String> names = expected.fieldNames();
        while (names.hasNext()) {
            if (!names.next().startsWith("$")) {
                return false;
            }
        }
        return true;
    }
}
