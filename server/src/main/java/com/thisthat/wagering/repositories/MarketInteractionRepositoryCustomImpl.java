package com.thisthat.wagering.repositories;

import com.thisthat.wagering.entity.InteractionAction;
import com.thisthat.wagering.entity.MarketInteraction;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.UUID;

@RequiredArgsConstructor
public class MarketInteractionRepositoryCustomImpl implements MarketInteractionRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public MarketInteraction upsert(String userId, String marketId, InteractionAction action, Instant now,
                                    Instant expiresAt) {
        Query query = new Query(Criteria.where("userId").is(userId).and("marketId").is(marketId));
        Update update = new Update()
                .setOnInsert("_id", UUID.randomUUID().toString())
                .set("action", action)
                .set("timestamp", now)
                .set("expiresAt", expiresAt);
        return mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().upsert(true).returnNew(true), MarketInteraction.class);
    }
}
