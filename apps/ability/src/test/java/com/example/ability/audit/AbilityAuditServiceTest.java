package com.example.ability.audit;

import com.example.ability.model.User;
import com.example.ability.rule.AbilityDecision;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static com.example.ability.util.AbilityTestSupport.OBJECT_MAPPER;
import static com.example.ability.util.AbilityTestSupport.view;
import static com.example.ability.util.UserTestBuilder.aUser;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AbilityAuditService")
class AbilityAuditServiceTest {

    @Mock
    private ObjectMapper failingMapper;

    private final User user = aUser().withId("u-1").build();

    @Test
    @DisplayName("should log decisions and errors")
    void logs() {
        AbilityAuditService service = new AbilityAuditService(OBJECT_MAPPER);

        assertThatCode(() -> {
            service.logDecision(user, view(Map.of("id", "p1")), AbilityDecision.defaultDeny("read", "Patient"));
            service.logError(user, "read", "Invoice", null, "unsupported subject \"Invoice\"");
        }).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("should fall back to plain logging when serialization fails")
    void fallback() throws Exception {
        when(failingMapper.writeValueAsString(any())).thenThrow(new JsonProcessingException("boom") {});
        AbilityAuditService service = new AbilityAuditService(failingMapper);

        assertThatCode(() -> service.logDecision(user, null, AbilityDecision.defaultDeny("read", "Patient")))
                .doesNotThrowAnyException();
        verify(failingMapper).writeValueAsString(any());
    }
}
