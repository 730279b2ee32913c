package com.thisthat.wagering.service;

import com.thisthat.wagering.entity.MarketResolution;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of one settlement run over a market.
 */
@Value
@Builder
public class SettlementResult {
    String marketId;
    MarketResolution resolution;
    /** Bets moved to a terminal state by this run. */
    int settled;
    int won;
    int lost;
    int refunded;
    /** Bets another run settled first. */
    int alreadySettled;
    int failed;
    /** Credits paid out by this run (payouts plus refunds). */
    BigDecimal totalPayout;

    public static SettlementResult noop(String marketId, MarketResolution resolution) {
        return SettlementResult.builder()
                .marketId(marketId)
                .resolution(resolution)
                .totalPayout(BigDecimal.ZERO.setScale(2))
                .build();
    }
}
