package com.example.ability.model;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Node of the organizational hierarchy (a hospital system, a pilot program, a sub-unit).
 *
 * <p>Entities form a tree through {@code entities}. Cycles are not detected anywhere; callers
 * must only hand trees to the engine.</p>
 *
 * @param id       Entity identifier
 * @param name     Display name
 * @param entities Direct children, in declaration order
 */
public record Entity(
        @NonNull String id,
        @Nullable String name,
        @NonNull List<Entity> entities
) {
    public Entity {
        entities = entities == null ? List.of() : List.copyOf(entities);
    }

    /**
     * Create an entity without children.
     */
    public static Entity leaf(String id, String name) {
        return new Entity(id, name, List.of());
    }

    /**
     * Create an entity with the given children.
     */
    public static Entity of(String id, String name, Entity... children) {
        return new Entity(id, name, List.of(children));
    }

    public boolean hasChildren() {
        return !entities.isEmpty();
    }
}
