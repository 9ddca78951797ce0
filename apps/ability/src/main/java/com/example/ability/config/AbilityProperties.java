package com.example.ability.config;

import com.example.ability.model.Role;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the ability engine.
 * Roles are loaded from the {@code ability.roles} map, keyed by role key.
 */
@ConfigurationProperties(prefix = "ability")
public record AbilityProperties(
        Map<String, Role> roles,
        List<String> entityListSubjects,
        AuditProperties audit
) {
    public AbilityProperties {
        if (roles == null) {
            roles = Map.of();
        }
        if (entityListSubjects == null || entityListSubjects.isEmpty()) {
            entityListSubjects = List.of("Patient");
        }
        if (audit == null) {
            audit = new AuditProperties(true);
        }
    }

    public record AuditProperties(
            @DefaultValue("true") boolean enabled
    ) {}
}
