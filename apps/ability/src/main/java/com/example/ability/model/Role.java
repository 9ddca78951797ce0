package com.example.ability.model;

import org.springframework.lang.NonNull;

import java.util.List;

/**
 * Named bundle of permission declarations.
 *
 * <p>Roles are configuration data shared by reference across every user holding them.
 * Nothing in the engine mutates a role.</p>
 *
 * @param name        Role name (e.g. "nurse")
 * @param description Human-readable notes on what the role may do
 * @param permissions Permission declarations, in precedence order
 */
public record Role(
        @NonNull String name,
        @NonNull List<String> description,
        @NonNull List<PermissionDeclaration> permissions
) {
    public Role {
        description = description == null ? List.of() : List.copyOf(description);
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
    }

    public static Role of(String name, PermissionDeclaration... permissions) {
        return new Role(name, List.of(), List.of(permissions));
    }
}
