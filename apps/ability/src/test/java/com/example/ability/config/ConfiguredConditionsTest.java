package com.example.ability.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ConfiguredConditions")
class ConfiguredConditionsTest {

    @Test
    @DisplayName("should return null for missing conditions")
    void nullConditions() {
        assertThat(ConfiguredConditions.normalize(null)).isNull();
    }

    @Test
    @DisplayName("should turn index-keyed maps back into lists, in index order")
    void indexedMaps() {
        Map<String, Object> statuses = new LinkedHashMap<>();
        statuses.put("1", "pending");
        statuses.put("0", "active");

        Map<String, Object> normalized = ConfiguredConditions.normalize(Map.of("status", Map.of("$in", statuses)));

        assertThat(normalized).containsEntry("status", Map.of("$in", List.of("active", "pending")));
    }

    @Test
    @DisplayName("should normalize nested lists of maps")
    void nested() {
        Map<String, Object> normalized = ConfiguredConditions.normalize(Map.of(
                "visits", Map.of("0", Map.of("codes", Map.of("0", "a", "1", "b")))));

        assertThat(normalized).containsEntry("visits", List.of(Map.of("codes", List.of("a", "b"))));
    }

    @Test
    @DisplayName("should keep maps whose keys are not a full index range")
    void partialIndexes() {
        Map<String, Object> normalized = ConfiguredConditions.normalize(Map.of(
                "gaps", Map.of("0", "a", "2", "c"),
                "address", Map.of("city", "Lyon")));

        assertThat(normalized)
                .containsEntry("gaps", Map.of("0", "a", "2", "c"))
                .containsEntry("address", Map.of("city", "Lyon"));
    }
}
