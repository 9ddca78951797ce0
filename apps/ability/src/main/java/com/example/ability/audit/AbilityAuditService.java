package com.example.ability.audit;

import com.example.ability.common.util.StringSanitizer;
import com.example.ability.model.User;
import com.example.ability.rule.AbilityDecision;
import com.example.ability.rule.SubjectView;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

/**
 * Publishes ability decisions as structured JSON on the {@code ABILITY_AUDIT} logger.
 */
@RequiredArgsConstructor
public class AbilityAuditService {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("ABILITY_AUDIT");

    private final ObjectMapper objectMapper;

    public void logDecision(
            @NonNull User user,
            @Nullable SubjectView subject,
            @NonNull AbilityDecision decision) {

        logEvent(AbilityAuditEvent.from(user, subject, decision));
    }

    public void logError(
            @NonNull User user,
            @NonNull String action,
            @NonNull String subjectType,
            @Nullable SubjectView subject,
            @NonNull String errorReason) {

        logEvent(AbilityAuditEvent.error(user, action, subjectType, subject, errorReason));
    }

    private void logEvent(@NonNull AbilityAuditEvent event) {
        try {
            String json = objectMapper.writeValueAsString(event.toStructuredLog());
            logByOutcome(event.outcome(), json);
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize audit event: {}", StringSanitizer.forLog(e.getMessage()));
            logFallback(event);
        }
    }

    private void logByOutcome(@NonNull AbilityAuditEvent.Outcome outcome, String json) {
        switch (outcome) {
            case ALLOW -> AUDIT_LOG.info(json);
            case DENY -> AUDIT_LOG.warn(json);
            case ERROR -> AUDIT_LOG.error(json);
        }
    }

    private void logFallback(@NonNull AbilityAuditEvent event) {
        AUDIT_LOG.warn("Ability {} - user={}, action={}, subject={}/{}, rule={}, reason={}",
                event.outcome(),
                StringSanitizer.forLog(event.userId()),
                StringSanitizer.forLog(event.action()),
                StringSanitizer.forLog(event.subjectType()),
                StringSanitizer.forLog(event.subjectId()),
                StringSanitizer.forLog(event.rule()),
                StringSanitizer.forLog(event.reason(), 256));
    }
}
