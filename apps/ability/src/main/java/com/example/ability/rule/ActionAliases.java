package com.example.ability.rule;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Built-in action aliases.
 * {@code manage} stands for every action; {@code crud} for create, read, update and delete.
 */
public final class ActionAliases {

    public static final String MANAGE = "manage";
    public static final String CRUD = "crud";

    private static final Map<String, List<String>> ALIASES = Map.of(
            CRUD, List.of("create", "read", "update", "delete")
    );

    private ActionAliases() {}

    /**
     * Expand declared actions into the set of actions they grant. Aliases stay in the set.
     */
    public static Set<String> expand(Collection<String> actions) {
        Set<String> expanded = new LinkedHashSet<>();
        for (String action : actions) {
            expanded.add(action);
            expanded.addAll(ALIASES.getOrDefault(action, List.of()));
        }
        return expanded;
    }

    public static boolean grants(Set<String> expandedActions, String action) {
        return expandedActions.contains(MANAGE) || expandedActions.contains(action);
    }
}
