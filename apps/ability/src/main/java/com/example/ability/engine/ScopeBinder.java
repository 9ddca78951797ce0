package com.example.ability.engine;

import com.example.ability.model.User;
import com.example.ability.rule.RuleScope;
import com.example.ability.scope.ScopeFunction;
import com.example.ability.scope.ScopeFunctionRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.NonNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns declared scope names into conditions bound to one user.
 *
 * <p>All names are validated before anything is bound, so an unknown scope fails the
 * decoration instead of the first check. Bound scopes are conjunctive: a rule applies only
 * when every one of them holds.</p>
 */
@RequiredArgsConstructor
public class ScopeBinder {

    private final ScopeFunctionRegistry registry;

    /**
     * @throws com.example.ability.exception.UnknownScopeException for any name not in the catalog
     */
    @NonNull
    public List<RuleScope> bind(@NonNull List<String> scopeNames, @NonNull User user) {
        validate(scopeNames);

        List<RuleScope> scopes = new ArrayList<>(scopeNames.size());
        for (String name : scopeNames) {
            ScopeFunction function = registry.get(name);
            scopes.add(new RuleScope(name, function.bindTo(user)));
        }
        return scopes;
    }

    public void validate(@NonNull List<String> scopeNames) {
        for (String name : scopeNames) {
            registry.get(name);
        }
    }
}
