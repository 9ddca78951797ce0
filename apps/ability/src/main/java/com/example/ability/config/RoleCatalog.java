package com.example.ability.config;

import com.example.ability.engine.ScopeBinder;
import com.example.ability.exception.UnknownRoleException;
import com.example.ability.model.PermissionDeclaration;
import com.example.ability.model.Role;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Configured roles, keyed by role key. Every scope name is validated when the catalog is built,
 * so a misconfigured role fails at startup. Conditions get their lists back from the binder's
 * index-keyed maps.
 */
@Slf4j
public class RoleCatalog {

    private final Map<String, Role> roles;

    public RoleCatalog(@NonNull Map<String, Role> configured, @NonNull ScopeBinder scopeBinder) {
        Map<String, Role> loaded = new LinkedHashMap<>();
        configured.forEach((key, role) -> {
            List<PermissionDeclaration> permissions = new ArrayList<>(role.permissions().size());
            for (PermissionDeclaration permission : role.permissions()) {
                scopeBinder.validate(permission.scope());
                permissions.add(permission.hasConditions()
                        ? permission.toBuilder().conditions(ConfiguredConditions.normalize(permission.conditions())).build()
                        : permission);
            }
            String name = role.name() != null ? role.name() : key;
            loaded.put(key, new Role(name, role.description(), permissions));
        });
        this.roles = Collections.unmodifiableMap(loaded);

        log.info("Loaded {} roles from configuration", roles.size());
        roles.forEach((key, role) -> log.debug("  - {} ({}): {} permissions",
                key, role.name(), role.permissions().size()));
    }

    public Optional<Role> find(String key) {
        return Optional.ofNullable(roles.get(key));
    }

    /**
     * @throws UnknownRoleException if no role is configured under {@code key}
     */
    @NonNull
    public Role get(String key) {
        return find(key).orElseThrow(() -> new UnknownRoleException(key));
    }

    /**
     * Roles for the given keys, in the order given.
     */
    @NonNull
    public List<Role> getAll(Collection<String> keys) {
        List<Role> resolved = new ArrayList<>(keys.size());
        for (String key : keys) {
            resolved.add(get(key));
        }
        return resolved;
    }

    public Set<String> keys() {
        return roles.keySet();
    }
}
