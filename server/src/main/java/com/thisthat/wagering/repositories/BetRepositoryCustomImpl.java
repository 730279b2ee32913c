package com.thisthat.wagering.repositories;

import com.thisthat.wagering.entity.Bet;
import com.thisthat.wagering.entity.BetStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;

@RequiredArgsConstructor
public class BetRepositoryCustomImpl implements BetRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public List<String> findMarketIdsWithStatus(BetStatus status) {
        Query query = new Query(Criteria.where("status").is(status));
        return mongoTemplate.findDistinct(query, "marketId", Bet.class, String.class);
    }

    @Override
    public List<Bet> findPage(String userId, BetStatus status, String marketId, int limit, long offset) {
        Criteria criteria = Criteria.where("userId").is(userId);
        if (status != null) {
            criteria = criteria.and("status").is(status);
        }
        if (marketId != null) {
            criteria = criteria.and("marketId").is(marketId);
        }
        Query query = new Query(criteria)
                .with(Sort.by(Sort.Direction.DESC, "createdAt"))
                .skip(offset)
                .limit(limit);
        return mongoTemplate.find(query, Bet.class);
    }
}
