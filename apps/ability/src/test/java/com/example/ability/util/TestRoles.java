package com.example.ability.util;

import com.example.ability.model.PermissionDeclaration;
import com.example.ability.model.Role;

import java.util.List;

import static com.example.ability.scope.ScopeFunctionRegistry.BELONGS_TO_ENTITY;
import static com.example.ability.scope.ScopeFunctionRegistry.BELONGS_TO_SUB_ENTITIES;
import static com.example.ability.scope.ScopeFunctionRegistry.IS_CAREGIVER;
import static com.example.ability.scope.ScopeFunctionRegistry.IS_PRIMARY_CAREGIVER;

/**
 * Roles used across tests. Mirrors the roles in application-test.yml.
 */
public final class TestRoles {

    public static final Role NURSE = new Role("nurse",
            List.of(
                    "Can see any patient in user's entity.",
                    "Can create a patient in their own entity that they will manage.",
                    "Can only update patients if they are a caregiver."),
            List.of(
                    PermissionDeclaration.scoped("read", "Patient", BELONGS_TO_SUB_ENTITIES),
                    PermissionDeclaration.scoped("create", "Patient", IS_PRIMARY_CAREGIVER, BELONGS_TO_SUB_ENTITIES),
                    PermissionDeclaration.scoped("update", "Patient", IS_CAREGIVER)));

    public static final Role MANAGER = Role.of("manager",
            PermissionDeclaration.scoped("read", "Patient", BELONGS_TO_SUB_ENTITIES),
            PermissionDeclaration.scoped("addBulk", "Patient", BELONGS_TO_SUB_ENTITIES));

    public static final Role ENTITY_ADMIN = Role.of("entityAdmin",
            PermissionDeclaration.scoped("manage", "User", BELONGS_TO_SUB_ENTITIES),
            PermissionDeclaration.scoped("manage", "Entity", BELONGS_TO_SUB_ENTITIES));

    public static final Role ENTITY_USER_ADMIN = Role.of("entitySubAdmin",
            PermissionDeclaration.scoped("manage", "User", BELONGS_TO_ENTITY));

    public static final Role SUPER_ADMIN = Role.of("superAdmin",
            PermissionDeclaration.allow("manage", "all"));

    private TestRoles() {}
}
