package com.example.ability.exception;

import lombok.Getter;

// Subject type name passed to a check has no entity id extraction. Never a silent deny.
@Getter
public class UnsupportedSubjectException extends AbilityException {

    private final String subjectType;

    public UnsupportedSubjectException(String subjectType) {
        super(String.format("unsupported subject \"%s\"", subjectType));
        this.subjectType = subjectType;
    }
}
