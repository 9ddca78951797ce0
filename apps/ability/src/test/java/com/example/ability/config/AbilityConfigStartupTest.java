package com.example.ability.config;

import com.example.ability.audit.AbilityAuditService;
import com.example.ability.engine.AbilityDecorator;
import com.example.ability.exception.UnknownScopeException;
import com.example.ability.model.Role;
import com.example.ability.rule.Ability;
import com.example.ability.scope.SubjectKindResolver;
import com.example.ability.service.AbilityAuthorizationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.util.List;
import java.util.Map;

import static com.example.ability.util.UserTestBuilder.aUser;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AbilityConfig startup")
class AbilityConfigStartupTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(JacksonAutoConfiguration.class))
            .withUserConfiguration(AbilityConfig.class);

    @Test
    @DisplayName("should fail to start when a role names an unknown scope")
    void unknownScopeFailsStartup() {
        contextRunner
                .withPropertyValues(
                        "ability.roles.broken.permissions[0].actions[0]=read",
                        "ability.roles.broken.permissions[0].subject[0]=Patient",
                        "ability.roles.broken.permissions[0].scope[0]=NOPE")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure()).rootCause()
                            .isInstanceOf(UnknownScopeException.class)
                            .hasMessageContaining("NOPE");
                });
    }

    @Test
    @DisplayName("should restore lists in conditions bound from properties")
    void propertyConditionLists() {
        contextRunner
                .withPropertyValues(
                        "ability.roles.r.permissions[0].actions[0]=update",
                        "ability.roles.r.permissions[0].subject[0]=Patient",
                        "ability.roles.r.permissions[0].conditions.status[0]=active",
                        "ability.roles.r.permissions[0].conditions.status[1]=pending",
                        "ability.roles.r.permissions[1].actions[0]=read",
                        "ability.roles.r.permissions[1].subject[0]=Patient",
                        "ability.roles.r.permissions[1].conditions.status.[$in][0]=active")
                .run(context -> {
                    Role role = context.getBean(RoleCatalog.class).get("r");
                    assertThat(role.permissions().get(0).conditions())
                            .containsEntry("status", List.of("active", "pending"));
                    assertThat(role.permissions().get(1).conditions())
                            .containsEntry("status", Map.of("$in", List.of("active")));

                    Ability ability = context.getBean(AbilityDecorator.class)
                            .decorate(aUser().withRoles(role).build());
                    assertThat(ability.can("read", Map.of("status", "active"), "Patient")).isTrue();
                    assertThat(ability.can("read", Map.of("status", "pending"), "Patient")).isFalse();
                });
    }

    @Test
    @DisplayName("should keep user templates in configured conditions for per-user resolution")
    void propertyConditionTemplates() {
        contextRunner
                .withPropertyValues(
                        "ability.roles.owner.permissions[0].actions[0]=update",
                        "ability.roles.owner.permissions[0].subject[0]=Patient",
                        "ability.roles.owner.permissions[0].conditions.caregiverId=${user.id}")
                .run(context -> {
                    Role role = context.getBean(RoleCatalog.class).get("owner");
                    assertThat(role.permissions().get(0).conditions()).containsEntry("caregiverId", "${user.id}");

                    Ability ability = context.getBean(AbilityDecorator.class)
                            .decorate(aUser().withId("nurse-7").withRoles(role).build());
                    assertThat(ability.can("update", Map.of("caregiverId", "nurse-7"), "Patient")).isTrue();
                    assertThat(ability.can("update", Map.of("caregiverId", "nurse-8"), "Patient")).isFalse();
                });
    }

    @Test
    @DisplayName("should start with defaults when nothing is configured")
    void defaults() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context.getBean(RoleCatalog.class).keys()).isEmpty();
            assertThat(context.getBean(SubjectKindResolver.class).getEntityListSubjects())
                    .containsExactly("Patient");
            assertThat(context).hasSingleBean(AbilityAuditService.class);
        });
    }

    @Test
    @DisplayName("should skip the audit service when disabled")
    void auditDisabled() {
        contextRunner
                .withPropertyValues("ability.audit.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(AbilityAuditService.class);
                    assertThat(context).hasSingleBean(AbilityAuthorizationService.class);
                });
    }
}
