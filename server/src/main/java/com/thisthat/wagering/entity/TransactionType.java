package com.thisthat.wagering.entity;

/**
 * Ledger entry kinds. BET and HOLD_CAPTURE are debits, the rest are credits.
 */
public enum TransactionType {
    BET,
    PAYOUT,
    REFUND,
    POSITION_SOLD,
    GRANT,
    DAILY_REWARD,
    HOLD_CAPTURE
}
