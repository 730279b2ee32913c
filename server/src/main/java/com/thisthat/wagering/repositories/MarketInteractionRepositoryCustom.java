package com.thisthat.wagering.repositories;

import com.thisthat.wagering.entity.InteractionAction;
import com.thisthat.wagering.entity.MarketInteraction;

import java.time.Instant;

public interface MarketInteractionRepositoryCustom {

    /**
     * Insert or refresh the (userId, marketId) interaction in one atomic upsert.
     */
    MarketInteraction upsert(String userId, String marketId, InteractionAction action, Instant now, Instant expiresAt);
}
