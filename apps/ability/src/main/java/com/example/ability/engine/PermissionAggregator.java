package com.example.ability.engine;

import com.example.ability.model.PermissionDeclaration;
import com.example.ability.model.Role;
import com.example.ability.model.User;
import com.example.ability.rule.Rule;
import com.example.ability.rule.RuleScope;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens a user's roles into the ordered rule list of their ability.
 *
 * <p>Order is role order, then declaration order within each role. Nothing is reordered or
 * deduplicated since later rules take precedence.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class PermissionAggregator {

    private final ScopeBinder scopeBinder;
    private final ConditionsTemplateResolver templateResolver;

    @NonNull
    public List<Rule> expand(@NonNull User user) {
        List<Rule> rules = new ArrayList<>();
        for (Role role : user.getRoles()) {
            List<PermissionDeclaration> permissions = role.permissions();
            for (int i = 0; i < permissions.size(); i++) {
                rules.add(resolve(permissions.get(i), user, role.name() + "#" + i));
            }
        }
        log.debug("Expanded {} roles into {} rules for user {}", user.getRoles().size(), rules.size(), user.getId());
        return rules;
    }

    private Rule resolve(PermissionDeclaration declaration, User user, String source) {
        JsonNode conditions = declaration.hasConditions()
                ? templateResolver.resolve(declaration.conditions(), user)
                : null;
        List<RuleScope> scopes = declaration.hasScope()
                ? scopeBinder.bind(declaration.scope(), user)
                : List.of();

        return new Rule(
                declaration.actions(),
                declaration.subject(),
                conditions,
                scopes,
                declaration.inverted(),
                source);
    }
}
