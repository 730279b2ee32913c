package com.thisthat.wagering.exception;

public class NotFoundException extends WageringException {

    public static final String CODE = "NOT_FOUND";

    public NotFoundException(String entity, String id) {
        super(CODE, entity + " not found: " + id);
    }
}
