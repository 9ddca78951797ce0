package com.example.ability.exception;

import lombok.Getter;

@Getter
public class UndefinedVariableException extends AbilityException {

    private final String variable;

    public UndefinedVariableException(String variable) {
        super(String.format("Variable %s is not defined", variable));
        this.variable = variable;
    }
}
