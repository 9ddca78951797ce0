package com.example.ability.scope;

import com.example.ability.model.Entity;
import org.springframework.lang.NonNull;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collects entity ids reachable from a root within a number of levels.
 *
 * <p>Depth 0 is the root itself, depth 1 adds its direct children, {@link #UNBOUNDED} walks the
 * whole subtree. Precondition: the entity graph is a tree. A cycle never terminates.</p>
 */
public final class EntityTreeWalker {

    /**
     * Depth sentinel meaning "no limit".
     */
    public static final int UNBOUNDED = -1;

    private EntityTreeWalker() {}

    @NonNull
    public static Set<String> collectIds(@NonNull Entity root, int maxDepth) {
        if (maxDepth < 0 && maxDepth != UNBOUNDED) {
            throw new IllegalArgumentException("maxDepth must be >= 0 or UNBOUNDED, got " + maxDepth);
        }
        Set<String> ids = new LinkedHashSet<>();
        collect(root, ids, maxDepth, 0);
        return Collections.unmodifiableSet(ids);
    }

    @NonNull
    public static Set<String> collectAllIds(@NonNull Entity root) {
        return collectIds(root, UNBOUNDED);
    }

    private static void collect(Entity entity, Set<String> ids, int maxDepth, int depth) {
        ids.add(entity.id());
        if (!entity.hasChildren()) {
            return;
        }
        if (maxDepth != UNBOUNDED && depth >= maxDepth) {
            return;
        }
        for (Entity child : entity.entities()) {
            collect(child, ids, maxDepth, depth + 1);
        }
    }
}
