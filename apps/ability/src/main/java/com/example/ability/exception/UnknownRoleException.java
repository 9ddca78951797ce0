package com.example.ability.exception;

import lombok.Getter;

@Getter
public class UnknownRoleException extends AbilityException {

    private final String roleKey;

    public UnknownRoleException(String roleKey) {
        super(String.format("No role configured for \"%s\"", roleKey));
        this.roleKey = roleKey;
    }
}
