package com.example.ability.scope;

import com.example.ability.rule.SubjectView;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Supported subject shapes, each with its own way of resolving the entity ids it belongs to.
 * Prospective subjects carry a singular {@code entityId} which wins over the persisted fields.
 */
public enum SubjectKind {

    /**
     * A user belongs to one entity: {@code entityId}, else {@code entity.id}.
     */
    USER {
        @Override
        public List<String> entityIds(SubjectView subject) {
            return single(firstPresent(subject.text(PROSPECTIVE_ENTITY_ID), subject.text("entity.id")));
        }
    },

    /**
     * An entity "belongs" to itself: {@code entityId}, else {@code id}.
     */
    ENTITY {
        @Override
        public List<String> entityIds(SubjectView subject) {
            return single(firstPresent(subject.text(PROSPECTIVE_ENTITY_ID), subject.text("id")));
        }
    },

    /**
     * Patient-like subjects belong to many entities: {@code [entityId]}, else {@code entityIds}.
     */
    ENTITY_LIST {
        @Override
        public List<String> entityIds(SubjectView subject) {
            String prospective = subject.text(PROSPECTIVE_ENTITY_ID);
            return prospective != null ? List.of(prospective) : subject.texts("entityIds");
        }
    };

    static final String PROSPECTIVE_ENTITY_ID = "entityId";

    /**
     * Entity ids the subject belongs to. Empty when the subject carries none.
     */
    public abstract List<String> entityIds(SubjectView subject);

    @Nullable
    private static String firstPresent(@Nullable String preferred, @Nullable String fallback) {
        return preferred != null ? preferred : fallback;
    }

    private static List<String> single(@Nullable String id) {
        return id == null ? List.of() : List.of(id);
    }
}
