package com.example.ability.scope;

import com.example.ability.model.User;
import com.example.ability.rule.RuleContext;
import com.example.ability.rule.ScopeCondition;
import com.example.ability.rule.SubjectView;

/**
 * Relational predicate between the acting user and a subject.
 */
@FunctionalInterface
public interface ScopeFunction {

    boolean test(User user, SubjectView subject, RuleContext rule);

    /**
     * Close this predicate over the given user.
     */
    default ScopeCondition bindTo(User user) {
        return (subject, rule) -> test(user, subject, rule);
    }
}
