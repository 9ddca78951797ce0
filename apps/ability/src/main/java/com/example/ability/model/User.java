package com.example.ability.model;

import com.example.ability.rule.Ability;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Acting user: one entity, an ordered list of roles and, once decorated, an {@link Ability}.
 *
 * <p>The entity tree and roles are shared configuration data and are held by reference.
 * The ability belongs to this instance only and is replaced on every decoration.</p>
 */
@Getter
@ToString(exclude = "ability")
public class User {

    @NonNull
    private final String id;

    @Nullable
    private final Entity entity;

    @NonNull
    private final List<Role> roles;

    @JsonIgnore
    @Setter
    @Nullable
    private Ability ability;

    @JsonCreator
    public User(
            @JsonProperty("id") @NonNull String id,
            @JsonProperty("entity") @Nullable Entity entity,
            @JsonProperty("roles") @Nullable List<Role> roles) {
        this.id = id;
        this.entity = entity;
        this.roles = roles == null ? List.of() : List.copyOf(roles);
    }

    /**
     * Copy constructor. The copy shares entity and role references with {@code source}
     * and starts without an ability.
     */
    public User(@NonNull User source) {
        this(source.id, source.entity, source.roles);
    }

    public boolean hasAbility() {
        return ability != null;
    }
}
