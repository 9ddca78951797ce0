package com.example.ability.rule;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Decision object for one user, built from an ordered list of rules.
 *
 * <p>Rule combining: later rules take precedence. Rules relevant to the action and subject type
 * are tried from last to first; the first one that matches decides (inverted rules deny).
 * If none matches, the answer is deny.</p>
 *
 * <p>Instances are immutable and safe to query from any number of threads.</p>
 */
@Slf4j
public final class Ability {

    private final List<Rule> rules;
    private final ObjectMapper objectMapper;

    public Ability(@NonNull List<Rule> rules, @NonNull ObjectMapper objectMapper) {
        this.rules = List.copyOf(rules);
        this.objectMapper = objectMapper;
    }

    /**
     * Evaluate the rules and return the decision with the rule that made it.
     *
     * @param action  The action being performed
     * @param subject The subject type, optionally with an instance
     * @return AbilityDecision, allowed or denied
     */
    public AbilityDecision check(@NonNull String action, @NonNull SubjectRef subject) {
        String subjectType = subject.type();
        RuleContext context = new RuleContext(action, subjectType);
        SubjectView view = subject.isBare() ? null : SubjectView.of(subject.value(), objectMapper);

        for (Rule rule : rulesFor(action, subjectType)) {
            boolean matched = view == null ? rule.matchesType() : rule.matches(view, context);
            if (matched) {
                log.debug("{} {} decided by {}", action, subjectType, rule);
                return AbilityDecision.decidedBy(rule, action, subjectType);
            }
        }

        log.debug("{} {} denied, no matching rule", action, subjectType);
        return AbilityDecision.defaultDeny(action, subjectType);
    }

    public boolean can(@NonNull String action, @NonNull SubjectRef subject) {
        return check(action, subject).allowed();
    }

    /**
     * Bare type check, e.g. {@code can("read", "Patient")}.
     */
    public boolean can(@NonNull String action, @NonNull String subjectType) {
        return can(action, SubjectRef.type(subjectType));
    }

    /**
     * Instance check, e.g. {@code can("update", patient, "Patient")}.
     */
    public boolean can(@NonNull String action, @NonNull Object subject, @NonNull String subjectType) {
        return can(action, SubjectRef.of(subject, subjectType));
    }

    public boolean cannot(@NonNull String action, @NonNull SubjectRef subject) {
        return !can(action, subject);
    }

    public boolean cannot(@NonNull String action, @NonNull String subjectType) {
        return !can(action, subjectType);
    }

    public boolean cannot(@NonNull String action, @NonNull Object subject, @NonNull String subjectType) {
        return !can(action, subject, subjectType);
    }

    /**
     * Rules relevant to the action and subject type, highest precedence first.
     */
    public List<Rule> rulesFor(@NonNull String action, @NonNull String subjectType) {
        List<Rule> relevant = new ArrayList<>();
        for (int i = rules.size() - 1; i >= 0; i--) {
            Rule rule = rules.get(i);
            if (rule.isRelevantFor(action, subjectType)) {
                relevant.add(rule);
            }
        }
        return Collections.unmodifiableList(relevant);
    }

    /**
     * All rules in declaration order.
     */
    public List<Rule> getRules() {
        return rules;
    }
}
