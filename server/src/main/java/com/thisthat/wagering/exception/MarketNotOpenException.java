package com.thisthat.wagering.exception;

import lombok.Getter;

/**
 * The market is unknown, not OPEN, expired, or has no usable odds.
 */
@Getter
public class MarketNotOpenException extends WageringException {

    public static final String CODE = "MARKET_NOT_OPEN";

    private final String marketId;

    public MarketNotOpenException(String marketId, String reason) {
        super(CODE, "Market " + marketId + " is not open: " + reason);
        this.marketId = marketId;
    }
}
