package com.example.ability.config;

import com.example.ability.audit.AbilityAuditService;
import com.example.ability.engine.AbilityDecorator;
import com.example.ability.engine.ConditionsTemplateResolver;
import com.example.ability.engine.PermissionAggregator;
import com.example.ability.engine.ScopeBinder;
import com.example.ability.scope.ScopeFunctionRegistry;
import com.example.ability.scope.SubjectKindResolver;
import com.example.ability.service.AbilityAuthorizationService;
import com.example.ability.service.AbilityMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the scope catalog, the rule builders and the decorator from {@link AbilityProperties}.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(AbilityProperties.class)
public class AbilityConfig {

    @Bean
    public SubjectKindResolver subjectKindResolver(AbilityProperties properties) {
        return new SubjectKindResolver(properties.entityListSubjects());
    }

    @Bean
    public ScopeFunctionRegistry scopeFunctionRegistry(SubjectKindResolver subjectKindResolver) {
        ScopeFunctionRegistry registry = ScopeFunctionRegistry.standard(subjectKindResolver);
        log.info("Registered scopes {} (entity list subjects: {})",
                registry.names(), subjectKindResolver.getEntityListSubjects());
        return registry;
    }

    @Bean
    public ConditionsTemplateResolver conditionsTemplateResolver(ObjectMapper objectMapper) {
        return new ConditionsTemplateResolver(objectMapper);
    }

    @Bean
    public ScopeBinder scopeBinder(ScopeFunctionRegistry scopeFunctionRegistry) {
        return new ScopeBinder(scopeFunctionRegistry);
    }

    @Bean
    public PermissionAggregator permissionAggregator(
            ScopeBinder scopeBinder,
            ConditionsTemplateResolver conditionsTemplateResolver) {
        return new PermissionAggregator(scopeBinder, conditionsTemplateResolver);
    }

    @Bean
    public AbilityDecorator abilityDecorator(PermissionAggregator permissionAggregator, ObjectMapper objectMapper) {
        return new AbilityDecorator(permissionAggregator, objectMapper);
    }

    @Bean
    public RoleCatalog roleCatalog(AbilityProperties properties, ScopeBinder scopeBinder) {
        return new RoleCatalog(properties.roles(), scopeBinder);
    }

    @Bean
    @ConditionalOnProperty(name = "ability.audit.enabled", havingValue = "true", matchIfMissing = true)
    public AbilityAuditService abilityAuditService(ObjectMapper objectMapper) {
        return new AbilityAuditService(objectMapper);
    }

    @Bean
    public AbilityAuthorizationService abilityAuthorizationService(
            AbilityDecorator abilityDecorator,
            ObjectMapper objectMapper,
            ObjectProvider<AbilityAuditService> auditService,
            ObjectProvider<MeterRegistry> meterRegistry) {
        MeterRegistry registry = meterRegistry.getIfAvailable();
        return new AbilityAuthorizationService(
                abilityDecorator,
                objectMapper,
                auditService.getIfAvailable(),
                registry != null ? new AbilityMetrics(registry) : null);
    }
}
