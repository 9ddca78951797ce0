package com.example.ability.audit;

import com.example.ability.model.Role;
import com.example.ability.model.User;
import com.example.ability.rule.AbilityDecision;
import com.example.ability.rule.SubjectView;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Structured audit event for ability decisions.
 */
public record AbilityAuditEvent(
        // Event metadata
        String eventId,
        Instant timestamp,

        // Decision
        Outcome outcome,
        String rule,
        String reason,

        // User
        String userId,
        String entityId,
        List<String> roles,

        // Check
        String action,
        String subjectType,
        String subjectId
) {
    public enum Outcome {
        ALLOW, DENY, ERROR
    }

    /**
     * Creates an audit event from a decision.
     */
    public static AbilityAuditEvent from(User user, @Nullable SubjectView subject, AbilityDecision decision) {
        return new AbilityAuditEvent(
                UUID.randomUUID().toString(),
                Instant.now(),
                decision.allowed() ? Outcome.ALLOW : Outcome.DENY,
                decision.rule() != null ? decision.rule().getSource() : null,
                decision.reason(),
                user.getId(),
                user.getEntity() != null ? user.getEntity().id() : null,
                roleNames(user),
                decision.action(),
                decision.subjectType(),
                subject != null ? subject.text("id") : null
        );
    }

    /**
     * Creates an error audit event for a check that failed.
     */
    public static AbilityAuditEvent error(
            User user,
            String action,
            String subjectType,
            @Nullable SubjectView subject,
            String errorReason) {

        return new AbilityAuditEvent(
                UUID.randomUUID().toString(),
                Instant.now(),
                Outcome.ERROR,
                "ERROR",
                errorReason,
                user.getId(),
                user.getEntity() != null ? user.getEntity().id() : null,
                roleNames(user),
                action,
                subjectType,
                subject != null ? subject.text("id") : null
        );
    }

    /**
     * Converts event to structured map for JSON logging.
     */
    public Map<String, Object> toStructuredLog() {
        return Map.ofEntries(
                Map.entry("event_type", "ability_decision"),
                Map.entry("event_id", eventId),
                Map.entry("timestamp", timestamp.toString()),
                Map.entry("outcome", outcome.name()),
                Map.entry("rule", rule != null ? rule : ""),
                Map.entry("reason", reason != null ? reason : ""),
                Map.entry("user_id", userId != null ? userId : ""),
                Map.entry("entity_id", entityId != null ? entityId : ""),
                Map.entry("roles", roles != null ? roles : List.of()),
                Map.entry("action", action != null ? action : ""),
                Map.entry("subject_type", subjectType != null ? subjectType : ""),
                Map.entry("subject_id", subjectId != null ? subjectId : "")
        );
    }

    private static List<String> roleNames(User user) {
        return user.getRoles().stream().map(Role::name).toList();
    }
}
