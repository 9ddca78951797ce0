package com.example.ability.rule;

/**
 * A bound scope condition with the catalog name it was resolved from.
 */
public record RuleScope(String name, ScopeCondition condition) {

    public boolean test(SubjectView subject, RuleContext rule) {
        return condition.test(subject, rule);
    }
}
