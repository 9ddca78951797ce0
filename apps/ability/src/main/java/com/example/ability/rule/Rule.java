package com.example.ability.rule;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * One resolved permission: actions on subject types, optionally narrowed by conditions and
 * bound scopes. Immutable once built.
 */
@Getter
public final class Rule {

    public static final String ALL_SUBJECTS = "all";

    private final Set<String> actions;
    private final Set<String> subjects;
    @Nullable
    private final JsonNode conditions;
    private final List<RuleScope> scopes;
    private final boolean inverted;
    private final String source;

    public Rule(
            @NonNull Collection<String> actions,
            @NonNull Collection<String> subjects,
            @Nullable JsonNode conditions,
            @NonNull List<RuleScope> scopes,
            boolean inverted,
            @NonNull String source) {
        this.actions = Set.copyOf(ActionAliases.expand(actions));
        this.subjects = Set.copyOf(subjects);
        this.conditions = conditions == null || conditions.isNull() || (conditions.isObject() && conditions.isEmpty())
                ? null
                : conditions.deepCopy();
        this.scopes = List.copyOf(scopes);
        this.inverted = inverted;
        this.source = source;
    }

    /**
     * Whether this rule speaks about the given action on the given subject type at all.
     */
    public boolean isRelevantFor(String action, String subjectType) {
        return ActionAliases.grants(actions, action)
                && (subjects.contains(ALL_SUBJECTS) || subjects.contains(subjectType));
    }

    public boolean isConditional() {
        return conditions != null || !scopes.isEmpty();
    }

    /**
     * Whether this rule decides a bare type check. Conditions cannot be evaluated without an
     * instance, so a conditional allow counts as "for some subjects" and a conditional deny is skipped.
     */
    public boolean matchesType() {
        return !isConditional() || !inverted;
    }

    /**
     * Whether conditions and every scope hold for the given instance.
     */
    public boolean matches(SubjectView subject, RuleContext context) {
        if (!ConditionsMatcher.matches(conditions, subject)) {
            return false;
        }
        for (RuleScope scope : scopes) {
            if (!scope.test(subject, context)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return (inverted ? "cannot " : "can ") + actions + " " + subjects
                + (scopes.isEmpty() ? "" : " scope=" + scopes.stream().map(RuleScope::name).toList())
                + (conditions == null ? "" : " conditions=" + conditions)
                + " (" + source + ")";
    }
}
