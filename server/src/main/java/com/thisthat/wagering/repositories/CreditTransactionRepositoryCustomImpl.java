package com.thisthat.wagering.repositories;

import com.thisthat.wagering.entity.CreditTransaction;
import com.thisthat.wagering.entity.TransactionType;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;

@RequiredArgsConstructor
public class CreditTransactionRepositoryCustomImpl implements CreditTransactionRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public List<CreditTransaction> findPage(String userId, TransactionType type, int limit, long offset) {
        Query query = filter(userId, type)
                .with(Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("sequence")))
                .skip(offset)
                .limit(limit);
        return mongoTemplate.find(query, CreditTransaction.class);
    }

    @Override
    public long countFor(String userId, TransactionType type) {
        return mongoTemplate.count(filter(userId, type), CreditTransaction.class);
    }

    private static Query filter(String userId, TransactionType type) {
        Criteria criteria = Criteria.where("userId").is(userId);
        if (type != null) {
            criteria = criteria.and("transactionType").is(type);
        }
        return new Query(criteria);
    }
}
