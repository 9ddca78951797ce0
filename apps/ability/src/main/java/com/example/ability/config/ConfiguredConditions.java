package com.example.ability.config;

import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Restores the lists inside conditions bound from configuration.
 *
 * <p>Spring Boot binds a list nested in a {@code Map<String, Object>} as a map keyed
 * {@code "0".."n-1"}. Any map whose keys are exactly those indexes becomes a list again,
 * recursively. Operator keys must be bracket-escaped in configuration ({@code "[$in]"}) to keep
 * their {@code $}.</p>
 */
final class ConfiguredConditions {

    private ConfiguredConditions() {}

    @Nullable
    static Map<String, Object> normalize(@Nullable Map<String, Object> conditions) {
        if (conditions == null) {
            return null;
        }
        Map<String, Object> normalized = new LinkedHashMap<>();
        conditions.forEach((key, value) -> normalized.put(key, normalizeValue(value)));
        return normalized;
    }

    private static Object normalizeValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            if (isIndexed(map)) {
                List<Object> list = new ArrayList<>(map.size());
                for (int i = 0; i < map.size(); i++) {
                    list.add(normalizeValue(indexed(map, i)));
                }
                return list;
            }
            Map<String, Object> nested = new LinkedHashMap<>();
            map.forEach((key, nestedValue) -> nested.put(String.valueOf(key), normalizeValue(nestedValue)));
            return nested;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(normalizeValue(element));
            }
            return copy;
        }
        return value;
    }

    private static boolean isIndexed(Map<?, ?> map) {
        if (map.isEmpty()) {
            return false;
        }
        for (int i = 0; i < map.size(); i++) {
            if (!map.containsKey(String.valueOf(i)) && !map.containsKey(i)) {
                return false;
            }
        }
        return true;
    }

    private static Object indexed(Map<?, ?> map, int index) {
        Object value = map.get(String.valueOf(index));
        return value != null ? value : map.get(index);
    }
}
