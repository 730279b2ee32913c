package com.thisthat.wagering.service;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Snapshot of a user's credits. available = balance - held.
 */
@Value
public class BalanceView {
    String userId;
    BigDecimal balance;
    BigDecimal available;
    BigDecimal held;
}
