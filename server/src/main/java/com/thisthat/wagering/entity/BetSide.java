package com.thisthat.wagering.entity;

/**
 * The two sides of a binary market.
 */
public enum BetSide {
    THIS,
    THAT;

    public static BetSide fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Side cannot be null");
        }
        return BetSide.valueOf(value.trim().toUpperCase());
    }
}
