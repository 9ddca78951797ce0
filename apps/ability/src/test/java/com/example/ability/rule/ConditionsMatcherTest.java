package com.example.ability.rule;

import com.example.ability.exception.AbilityException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.example.ability.util.AbilityTestSupport.OBJECT_MAPPER;
import static com.example.ability.util.AbilityTestSupport.view;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ConditionsMatcher")
class ConditionsMatcherTest {

    private static final Map<String, Object> PATIENT = Map.of(
            "id", "p1",
            "age", 42,
            "caregiverId", "nurse-1",
            "entityIds", List.of("hta1", "hta2"),
            "address", Map.of("city", "Lyon"));

    private static boolean matches(String json) throws Exception {
        return ConditionsMatcher.matches(OBJECT_MAPPER.readTree(json), view(PATIENT));
    }

    @Nested
    @DisplayName("equality")
    class Equality {

        @Test
        @DisplayName("null or empty conditions should always match")
        void emptyMatches() throws Exception {
            assertThat(ConditionsMatcher.matches(null, view(PATIENT))).isTrue();
            assertThat(ConditionsMatcher.matches(NullNode.getInstance(), view(PATIENT))).isTrue();
            assertThat(matches("{}")).isTrue();
        }

        @Test
        @DisplayName("should require every field to match")
        void allFields() throws Exception {
            assertThat(matches("{\"id\":\"p1\",\"caregiverId\":\"nurse-1\"}")).isTrue();
            assertThat(matches("{\"id\":\"p1\",\"caregiverId\":\"nurse-2\"}")).isFalse();
        }

        @Test
        @DisplayName("should compare scalars by text form")
        void textForm() throws Exception {
            assertThat(matches("{\"age\":\"42\"}")).isTrue();
            assertThat(matches("{\"age\":42}")).isTrue();
        }

        @Test
        @DisplayName("should compare numbers by value")
        void numbersByValue() throws Exception {
            assertThat(matches("{\"age\":42.0}")).isTrue();
            assertThat(matches("{\"age\":{\"$in\":[41.5,42.00]}}")).isTrue();
            assertThat(matches("{\"age\":42.5}")).isFalse();
        }

        @Test
        @DisplayName("should match an array field when any element is equal")
        void arrayMembership() throws Exception {
            assertThat(matches("{\"entityIds\":\"hta2\"}")).isTrue();
            assertThat(matches("{\"entityIds\":\"se1\"}")).isFalse();
        }

        @Test
        @DisplayName("should follow dotted paths")
        void dottedPath() throws Exception {
            assertThat(matches("{\"address.city\":\"Lyon\"}")).isTrue();
            assertThat(matches("{\"address.zip\":\"69000\"}")).isFalse();
        }

        @Test
        @DisplayName("a missing field should only equal null")
        void missingEqualsNull() throws Exception {
            assertThat(matches("{\"deletedAt\":null}")).isTrue();
            assertThat(matches("{\"deletedAt\":\"2024-01-01\"}")).isFalse();
        }
    }

    @Nested
    @DisplayName("operators")
    class Operators {

        @Test
        @DisplayName("$eq and $ne")
        void eqNe() throws Exception {
            assertThat(matches("{\"id\":{\"$eq\":\"p1\"}}")).isTrue();
            assertThat(matches("{\"id\":{\"$ne\":\"p1\"}}")).isFalse();
            assertThat(matches("{\"id\":{\"$ne\":\"p2\"}}")).isTrue();
        }

        @Test
        @DisplayName("$in and $nin")
        void inNin() throws Exception {
            assertThat(matches("{\"caregiverId\":{\"$in\":[\"nurse-1\",\"nurse-2\"]}}")).isTrue();
            assertThat(matches("{\"caregiverId\":{\"$nin\":[\"nurse-1\"]}}")).isFalse();
            assertThat(matches("{\"entityIds\":{\"$in\":[\"se1\",\"hta1\"]}}")).isTrue();
        }

        @Test
        @DisplayName("$exists")
        void exists() throws Exception {
            assertThat(matches("{\"caregiverId\":{\"$exists\":true}}")).isTrue();
            assertThat(matches("{\"caregiverIds\":{\"$exists\":true}}")).isFalse();
            assertThat(matches("{\"caregiverIds\":{\"$exists\":false}}")).isTrue();
        }

        @Test
        @DisplayName("should combine operators on one field")
        void combined() throws Exception {
            assertThat(matches("{\"age\":{\"$exists\":true,\"$ne\":18}}")).isTrue();
        }

        @Test
        @DisplayName("should reject unknown operators")
        void unknownOperator() {
            assertThatThrownBy(() -> matches("{\"age\":{\"$gt\":18}}"))
                    .isInstanceOf(AbilityException.class)
                    .hasMessageContaining("$gt");
        }

        @Test
        @DisplayName("should reject a non-array operand for $in")
        void inOperandMustBeArray() {
            assertThatThrownBy(() -> matches("{\"id\":{\"$in\":\"p1\"}}"))
                    .isInstanceOf(AbilityException.class);
        }

        @Test
        @DisplayName("should reject conditions that are not an object")
        void nonObject() {
            JsonNode conditions = TextNode.valueOf("id");

            assertThatThrownBy(() -> ConditionsMatcher.matches(conditions, view(PATIENT)))
                    .isInstanceOf(AbilityException.class);
        }
    }
}
