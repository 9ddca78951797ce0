package com.example.ability.engine;

import com.example.ability.model.User;
import com.example.ability.rule.Ability;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;

/**
 * Builds abilities and attaches them to users.
 *
 * <ul>
 *   <li>{@link #decorateUser(User)} - request-scoped use, sets the ability on the given user</li>
 *   <li>{@link #decorateUserImmutable(User)} - returns a decorated copy, the input is untouched</li>
 * </ul>
 *
 * <p>An ability is rebuilt from the user's current roles on every call; nothing is cached.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class AbilityDecorator {

    private final PermissionAggregator aggregator;
    private final ObjectMapper objectMapper;

    /**
     * Build the ability for a user.
     *
     * @throws com.example.ability.exception.UnknownScopeException      if a role names an unknown scope
     * @throws com.example.ability.exception.UndefinedVariableException if a conditions template does not resolve
     */
    @NonNull
    public Ability decorate(@NonNull User user) {
        Ability ability = new Ability(aggregator.expand(user), objectMapper);
        log.debug("Built ability for user {} with {} rules", user.getId(), ability.getRules().size());
        return ability;
    }

    /**
     * Replace the user's ability in place. Not safe to call concurrently on the same user.
     */
    public void decorateUser(@NonNull User user) {
        user.setAbility(decorate(user));
    }

    /**
     * Copy the user and attach a fresh ability to the copy.
     */
    @NonNull
    public User decorateUserImmutable(@NonNull User user) {
        User copy = new User(user);
        copy.setAbility(decorate(user));
        return copy;
    }
}
