package com.example.ability.scope;

import com.example.ability.exception.UnknownScopeException;
import org.springframework.lang.NonNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable catalog of named scope functions.
 */
public final class ScopeFunctionRegistry {

    public static final String IS_PRIMARY_CAREGIVER = "IS_PRIMARY_CAREGIVER";
    public static final String IS_CAREGIVER = "IS_CAREGIVER";
    public static final String BELONGS_TO_ENTITY = "BELONGS_TO_ENTITY";
    public static final String BELONGS_TO_SUB_ENTITIES = "BELONGS_TO_SUB_ENTITIES";
    public static final String BELONGS_TO_ENTITY_TREE = "BELONGS_TO_ENTITY_TREE";

    private final Map<String, ScopeFunction> functions;

    public ScopeFunctionRegistry(@NonNull Map<String, ScopeFunction> functions) {
        this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
    }

    /**
     * The standard caregiver and entity membership scopes.
     */
    public static ScopeFunctionRegistry standard(@NonNull SubjectKindResolver subjectKinds) {
        EntityMembership membership = new EntityMembership(subjectKinds);

        Map<String, ScopeFunction> functions = new LinkedHashMap<>();
        functions.put(IS_PRIMARY_CAREGIVER, CaregiverChecks::isPrimaryCaregiver);
        functions.put(IS_CAREGIVER, CaregiverChecks::isCaregiver);
        functions.put(BELONGS_TO_ENTITY, membership::belongsToEntity);
        functions.put(BELONGS_TO_SUB_ENTITIES, membership::belongsToSubEntities);
        functions.put(BELONGS_TO_ENTITY_TREE, membership::belongsToEntityTree);
        return new ScopeFunctionRegistry(functions);
    }

    public Optional<ScopeFunction> find(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    /**
     * @throws UnknownScopeException if no scope is registered under {@code name}
     */
    @NonNull
    public ScopeFunction get(String name) {
        return find(name).orElseThrow(() -> new UnknownScopeException(name));
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    public Set<String> names() {
        return functions.keySet();
    }
}
