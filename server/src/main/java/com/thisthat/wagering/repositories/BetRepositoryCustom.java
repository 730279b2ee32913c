package com.thisthat.wagering.repositories;

import com.thisthat.wagering.entity.Bet;
import com.thisthat.wagering.entity.BetStatus;

import java.util.List;

public interface BetRepositoryCustom {

    /**
     * Distinct market ids that still have bets in the given status.
     */
    List<String> findMarketIdsWithStatus(BetStatus status);

    /**
     * A user's bets, newest first. status and marketId are optional filters.
     */
    List<Bet> findPage(String userId, BetStatus status, String marketId, int limit, long offset);
}
