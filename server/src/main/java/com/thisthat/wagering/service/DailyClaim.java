package com.thisthat.wagering.service;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Outcome of a daily credit claim. {@code newlyClaimed} is false when today's claim had already
 * been made; the amount and streak are then those of the earlier claim.
 */
@Value
public class DailyClaim {
    String userId;
    BigDecimal creditsAwarded;
    int consecutiveDays;
    BigDecimal balanceAfter;
    Instant nextAvailableAt;
    boolean newlyClaimed;
}
