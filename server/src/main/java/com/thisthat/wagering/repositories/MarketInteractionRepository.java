package com.thisthat.wagering.repositories;

import com.thisthat.wagering.entity.InteractionAction;
import com.thisthat.wagering.entity.MarketInteraction;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface MarketInteractionRepository extends MongoRepository<MarketInteraction, String>,
        MarketInteractionRepositoryCustom {

    List<MarketInteraction> findByUserIdAndActionAndExpiresAtAfter(String userId, InteractionAction action,
                                                                    Instant now);

    long deleteByUserIdAndMarketIdAndAction(String userId, String marketId, InteractionAction action);

    long deleteByActionAndExpiresAtLessThanEqual(InteractionAction action, Instant now);
}
