package com.thisthat.wagering.entity;

/**
 * Why a bet ended up CANCELLED.
 */
public enum CloseReason {
    SOLD,
    REFUNDED
}
