package com.thisthat.wagering.exception;

import lombok.Getter;

import java.math.BigDecimal;

@Getter
public class InsufficientFundsException extends WageringException {

    public static final String CODE = "INSUFFICIENT_FUNDS";

    private final String userId;
    private final BigDecimal requested;

    public InsufficientFundsException(String userId, BigDecimal requested) {
        super(CODE, "Insufficient credits: userId=" + userId + ", requested=" + requested.toPlainString());
        this.userId = userId;
        this.requested = requested;
    }
}
