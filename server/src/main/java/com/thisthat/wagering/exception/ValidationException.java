package com.thisthat.wagering.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class ValidationException extends WageringException {

    public static final String CODE = "VALIDATION_FAILED";

    private final List<String> errors;

    public ValidationException(String error) {
        this(List.of(error));
    }

    public ValidationException(List<String> errors) {
        super(CODE, String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }
}
