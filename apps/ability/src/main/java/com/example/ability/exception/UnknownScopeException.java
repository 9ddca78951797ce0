package com.example.ability.exception;

import lombok.Getter;

// Role declares a scope name that is not in the catalog. Raised when the user is decorated.
@Getter
public class UnknownScopeException extends AbilityException {

    private final String scopeName;

    public UnknownScopeException(String scopeName) {
        super(String.format("No scope defined for \"%s\"", scopeName));
        this.scopeName = scopeName;
    }
}
