package com.example.ability.exception;

/**
 * Base class for the fatal conditions raised while building or querying an ability.
 * None of these are recoverable inside the engine; callers should treat them as configuration bugs.
 */
public class AbilityException extends RuntimeException {

    public AbilityException(String message) {
        super(message);
    }

    public AbilityException(String message, Throwable cause) {
        super(message, cause);
    }
}
