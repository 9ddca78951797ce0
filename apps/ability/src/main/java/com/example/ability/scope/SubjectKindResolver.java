package com.example.ability.scope;

import com.example.ability.exception.UnsupportedSubjectException;
import org.springframework.lang.Nullable;

import java.util.Collection;
import java.util.Set;

/**
 * Maps subject type names to {@link SubjectKind}. "User" and "Entity" are fixed; the
 * list-bearing types (patients by default) are configurable.
 */
public class SubjectKindResolver {

    public static final String USER_SUBJECT = "User";
    public static final String ENTITY_SUBJECT = "Entity";
    public static final String PATIENT_SUBJECT = "Patient";

    private final Set<String> entityListSubjects;

    public SubjectKindResolver(Collection<String> entityListSubjects) {
        this.entityListSubjects = Set.copyOf(entityListSubjects);
    }

    public static SubjectKindResolver withDefaults() {
        return new SubjectKindResolver(Set.of(PATIENT_SUBJECT));
    }

    /**
     * @throws UnsupportedSubjectException for any type name without a subject kind
     */
    public SubjectKind resolve(@Nullable String subjectType) {
        if (subjectType == null) {
            throw new UnsupportedSubjectException(null);
        }
        return switch (subjectType) {
            case USER_SUBJECT -> SubjectKind.USER;
            case ENTITY_SUBJECT -> SubjectKind.ENTITY;
            default -> {
                if (entityListSubjects.contains(subjectType)) {
                    yield SubjectKind.ENTITY_LIST;
                }
                throw new UnsupportedSubjectException(subjectType);
            }
        };
    }

    public Set<String> getEntityListSubjects() {
        return entityListSubjects;
    }
}
