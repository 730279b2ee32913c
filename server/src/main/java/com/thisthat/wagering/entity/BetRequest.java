package com.thisthat.wagering.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * Inbound bet placement request. idempotencyKey is optional.
 */
@Getter
@Builder
@AllArgsConstructor
public class BetRequest {
    private final String userId;
    private final String marketId;
    private final BetSide side;
    private final BigDecimal amount;
    private final String idempotencyKey;
}
