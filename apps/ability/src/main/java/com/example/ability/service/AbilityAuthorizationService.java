package com.example.ability.service;

import com.example.ability.audit.AbilityAuditService;
import com.example.ability.common.util.StringSanitizer;
import com.example.ability.engine.AbilityDecorator;
import com.example.ability.model.User;
import com.example.ability.rule.Ability;
import com.example.ability.rule.AbilityDecision;
import com.example.ability.rule.SubjectRef;
import com.example.ability.rule.SubjectView;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

/**
 * Reactive entry point for callers running on Reactor.
 * Decorates users and answers checks with audit logging and metrics.
 *
 * <p>Configuration errors (unknown scope, unsupported subject, undefined template variable)
 * and subjects that cannot be read are audited and then emitted as error signals, never turned
 * into a deny.</p>
 */
@Slf4j
public class AbilityAuthorizationService {

    private final AbilityDecorator decorator;
    private final ObjectMapper objectMapper;

    @Nullable
    private final AbilityAuditService auditService;

    @Nullable
    private final AbilityMetrics metrics;

    public AbilityAuthorizationService(
            AbilityDecorator decorator,
            ObjectMapper objectMapper,
            @Nullable AbilityAuditService auditService,
            @Nullable AbilityMetrics metrics) {
        this.decorator = decorator;
        this.objectMapper = objectMapper;
        this.auditService = auditService;
        this.metrics = metrics;
    }

    /**
     * Decorate a copy of the user.
     *
     * @param user The user to decorate, left untouched
     * @return Mono emitting the decorated copy
     */
    public Mono<User> decorate(@NonNull User user) {
        return Mono.fromCallable(() -> decorator.decorateUserImmutable(user))
                .doOnSuccess(decorated -> recordDecoration(true))
                .doOnError(e -> {
                    recordDecoration(false);
                    log.error("Failed to decorate user {}: {}",
                            StringSanitizer.forLog(user.getId()), StringSanitizer.forLog(e.getMessage(), 256));
                });
    }

    /**
     * Check an action on a subject.
     *
     * <p>Uses the ability already attached to the user, or builds a throwaway one.</p>
     *
     * @param user    Acting user
     * @param action  Action being performed
     * @param subject Subject type, optionally with an instance
     * @return Mono emitting the decision
     */
    public Mono<AbilityDecision> authorize(@NonNull User user, @NonNull String action, @NonNull SubjectRef subject) {
        return Mono.fromCallable(() -> evaluate(user, action, subject));
    }

    /**
     * Check if the action is allowed (convenience method).
     */
    public Mono<Boolean> isAllowed(@NonNull User user, @NonNull String action, @NonNull SubjectRef subject) {
        return authorize(user, action, subject).map(AbilityDecision::allowed);
    }

    private AbilityDecision evaluate(User user, String action, SubjectRef subject) {
        SubjectView view = null;
        try {
            view = subject.isBare() ? null : SubjectView.of(subject.value(), objectMapper);
            SubjectRef ref = view == null ? subject : SubjectRef.of(view, subject.type());

            Ability ability = user.hasAbility() ? user.getAbility() : decorator.decorate(user);
            AbilityDecision decision = ability.check(action, ref);

            if (auditService != null) {
                auditService.logDecision(user, view, decision);
            }
            if (metrics != null) {
                metrics.recordDecision(decision.allowed());
            }
            return decision;
        } catch (RuntimeException e) {
            log.warn("Check {} {} failed for user {}: {}", StringSanitizer.forLog(action),
                    StringSanitizer.forLog(subject.type()), StringSanitizer.forLog(user.getId()),
                    StringSanitizer.forLog(e.getMessage(), 256));
            if (auditService != null) {
                auditService.logError(user, action, subject.type(), view, errorReason(e));
            }
            if (metrics != null) {
                metrics.recordDecisionError();
            }
            throw e;
        }
    }

    private static String errorReason(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private void recordDecoration(boolean success) {
        if (metrics != null) {
            metrics.recordDecoration(success);
        }
    }
}
