package com.thisthat.wagering.exception;

import lombok.Getter;

/**
 * Market state could not be read in time. Requests fail closed on this error.
 */
@Getter
public class MarketUnavailableException extends WageringException {

    public static final String CODE = "MARKET_UNAVAILABLE";

    private final String marketId;

    public MarketUnavailableException(String marketId, Throwable cause) {
        super(CODE, "Market lookup failed for " + marketId, cause);
        this.marketId = marketId;
    }
}
