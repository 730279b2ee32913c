package com.thisthat.wagering.entity;

/**
 * Final outcome of a market. INVALID refunds every stake.
 */
public enum MarketResolution {
    THIS,
    THAT,
    INVALID;

    public boolean isWinningSide(BetSide side) {
        return (this == THIS && side == BetSide.THIS) || (this == THAT && side == BetSide.THAT);
    }
}
