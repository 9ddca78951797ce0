package com.example.ability.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.lang.NonNull;

/**
 * Decision and decoration counters. Tag values are fixed to keep cardinality bounded.
 */
public class AbilityMetrics {

    private static final String OUTCOME_SUCCESS = "success";
    private static final String OUTCOME_FAILURE = "failure";

    private final Counter decisionAllowed;
    private final Counter decisionDenied;
    private final Counter decisionError;
    private final Counter decorateSuccess;
    private final Counter decorateFailure;

    public AbilityMetrics(@NonNull MeterRegistry registry) {
        this.decisionAllowed = Counter.builder("ability.decision")
                .tag("outcome", "allow")
                .description("Checks answered with allow")
                .register(registry);

        this.decisionDenied = Counter.builder("ability.decision")
                .tag("outcome", "deny")
                .description("Checks answered with deny")
                .register(registry);

        this.decisionError = Counter.builder("ability.decision")
                .tag("outcome", "error")
                .description("Checks that failed with an error")
                .register(registry);

        this.decorateSuccess = Counter.builder("ability.decorate")
                .tag("outcome", OUTCOME_SUCCESS)
                .description("Abilities built")
                .register(registry);

        this.decorateFailure = Counter.builder("ability.decorate")
                .tag("outcome", OUTCOME_FAILURE)
                .description("Ability builds rejected by configuration errors")
                .register(registry);
    }

    public void recordDecision(boolean allowed) {
        if (allowed) {
            decisionAllowed.increment();
        } else {
            decisionDenied.increment();
        }
    }

    public void recordDecisionError() {
        decisionError.increment();
    }

    public void recordDecoration(boolean success) {
        if (success) {
            decorateSuccess.increment();
        } else {
            decorateFailure.increment();
        }
    }
}
