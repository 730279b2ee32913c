package com.thisthat.wagering.exception;

public class PositionNotOpenException extends WageringException {

    public static final String CODE = "POSITION_NOT_OPEN";

    public PositionNotOpenException(String betId) {
        super(CODE, "Bet " + betId + " is no longer pending");
    }
}
