package com.example.ability.rule;

import org.springframework.lang.Nullable;

/**
 * Outcome of one ability check.
 *
 * @param allowed     Whether the action is permitted
 * @param action      The action checked
 * @param subjectType The subject type checked
 * @param rule        The rule that decided, null when no rule applied (default deny)
 */
public record AbilityDecision(
        boolean allowed,
        String action,
        String subjectType,
        @Nullable Rule rule
) {
    /**
     * Decision taken by a matching rule.
     */
    public static AbilityDecision decidedBy(Rule rule, String action, String subjectType) {
        return new AbilityDecision(!rule.isInverted(), action, subjectType, rule);
    }

    /**
     * No rule applied.
     */
    public static AbilityDecision defaultDeny(String action, String subjectType) {
        return new AbilityDecision(false, action, subjectType, null);
    }

    public boolean isDenied() {
        return !allowed;
    }

    public String reason() {
        if (rule == null) {
            return "No rule grants " + action + " on " + subjectType;
        }
        return (allowed ? "Allowed by " : "Denied by ") + rule.getSource();
    }
}
