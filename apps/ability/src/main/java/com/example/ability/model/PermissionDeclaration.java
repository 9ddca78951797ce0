package com.example.ability.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declares an allow rule (or a deny rule when {@code inverted}) for actions on a subject type.
 *
 * <p>{@code scope} narrows the rule with named relational predicates; every listed scope must hold.
 * {@code conditions} narrows it with field matches against the subject and may reference the
 * acting user through {@code ${user.path}} placeholders.</p>
 *
 * <p>{@code actions}, {@code subject} and {@code scope} accept a single string as well as a list
 * when read from JSON or configuration.</p>
 *
 * @param actions    Actions granted; {@code manage} and {@code crud} are aliases
 * @param subject    Subject type names; {@code all} matches every type
 * @param scope      Scope names from the scope catalog (may be empty)
 * @param conditions Conditions template (may be null)
 * @param inverted   True for a "cannot" rule
 */
@Builder(toBuilder = true)
public record PermissionDeclaration(
        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY) @NonNull List<String> actions,
        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY) @NonNull List<String> subject,
        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY) @NonNull List<String> scope,
        @Nullable Map<String, Object> conditions,
        boolean inverted
) {
    public PermissionDeclaration {
        actions = actions == null ? List.of() : List.copyOf(actions);
        subject = subject == null ? List.of() : List.copyOf(subject);
        scope = scope == null ? List.of() : List.copyOf(scope);
        if (conditions != null) {
            conditions = Collections.unmodifiableMap(new LinkedHashMap<>(conditions));
        }
    }

    /**
     * Unconditional permission, e.g. {@code allow("manage", "all")}.
     */
    public static PermissionDeclaration allow(String action, String subject) {
        return new PermissionDeclaration(List.of(action), List.of(subject), List.of(), null, false);
    }

    /**
     * Permission narrowed by one or more scopes, all of which must hold.
     */
    public static PermissionDeclaration scoped(String action, String subject, String... scopes) {
        return new PermissionDeclaration(List.of(action), List.of(subject), List.of(scopes), null, false);
    }

    public boolean hasScope() {
        return !scope.isEmpty();
    }

    public boolean hasConditions() {
        return conditions != null && !conditions.isEmpty();
    }
}
