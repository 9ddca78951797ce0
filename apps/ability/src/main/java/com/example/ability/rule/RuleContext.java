package com.example.ability.rule;

/**
 * Passed to scope conditions while a rule is evaluated.
 *
 * @param action  The action being checked
 * @param subject The subject type name being checked
 */
public record RuleContext(String action, String subject) {
}
