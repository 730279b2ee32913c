package com.thisthat.wagering.entity;

public enum MarketStatus {
    OPEN,
    CLOSED,
    RESOLVED,
    INVALID;

    /**
     * Markets in these states carry a final outcome and can be settled.
     */
    public boolean isSettleable() {
        return this == RESOLVED || this == INVALID;
    }
}
