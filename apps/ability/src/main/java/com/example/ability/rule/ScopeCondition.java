package com.example.ability.rule;

/**
 * Scope predicate already bound to the acting user.
 */
@FunctionalInterface
public interface ScopeCondition {

    boolean test(SubjectView subject, RuleContext rule);
}
