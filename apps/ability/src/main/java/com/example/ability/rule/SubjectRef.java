package com.example.ability.rule;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.Objects;

/**
 * What a check is about: either a bare subject type ("may I read patients at all?")
 * or a concrete object tagged with its type name.
 *
 * @param type  Subject type name, e.g. "Patient"
 * @param value The subject instance, null for a bare type check
 */
public record SubjectRef(
        @NonNull String type,
        @Nullable Object value
) {
    public SubjectRef {
        Objects.requireNonNull(type, "subject type must not be null");
    }

    public static SubjectRef type(String type) {
        return new SubjectRef(type, null);
    }

    public static SubjectRef of(Object value, String type) {
        return new SubjectRef(type, Objects.requireNonNull(value, "subject must not be null"));
    }

    public boolean isBare() {
        return value == null;
    }
}
