package com.thisthat.wagering.exception;

/**
 * The bet left PENDING before this settlement could move it; another run got there first.
 */
public class SettlementConflictException extends WageringException {

    public static final String CODE = "SETTLEMENT_CONFLICT";

    public SettlementConflictException(String betId) {
        super(CODE, "Bet " + betId + " was already settled");
    }
}
