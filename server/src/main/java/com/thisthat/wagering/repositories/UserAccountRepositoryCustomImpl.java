package com.thisthat.wagering.repositories;

import com.mongodb.client.result.UpdateResult;
import com.thisthat.wagering.entity.UserAccount;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

@RequiredArgsConstructor
public class UserAccountRepositoryCustomImpl implements UserAccountRepositoryCustom {

    private static final FindAndModifyOptions RETURN_NEW = FindAndModifyOptions.options().returnNew(true);

    private final MongoTemplate mongoTemplate;

    @Override
    public boolean createIfAbsent(String userId, Instant now) {
        Update update = new Update()
                .setOnInsert("creditBalance", BigDecimal.ZERO)
                .setOnInsert("availableCredits", BigDecimal.ZERO)
                .setOnInsert("heldCredits", BigDecimal.ZERO)
                .setOnInsert("overallPnL", BigDecimal.ZERO)
                .setOnInsert("totalVolume", BigDecimal.ZERO)
                .setOnInsert("biggestWin", BigDecimal.ZERO)
                .setOnInsert("consecutiveDays", 0)
                .setOnInsert("ledgerSequence", 0L)
                .setOnInsert("createdAt", now)
                .setOnInsert("updatedAt", now);
        UpdateResult result = mongoTemplate.upsert(byId(userId), update, UserAccount.class);
        return result.getUpsertedId() != null;
    }

    @Override
    public Optional<UserAccount> applyCredit(String userId, BigDecimal amount, Instant now) {
        Update update = new Update()
                .inc("creditBalance", amount)
                .inc("availableCredits", amount)
                .inc("ledgerSequence", 1)
                .set("updatedAt", now);
        return modify(byId(userId), update);
    }

    @Override
    public Optional<UserAccount> applyDebit(String userId, BigDecimal amount, Instant now) {
        Query query = new Query(Criteria.where("_id").is(userId).and("availableCredits").gte(amount));
        Update update = new Update()
                .inc("creditBalance", amount.negate())
                .inc("availableCredits", amount.negate())
                .inc("ledgerSequence", 1)
                .set("updatedAt", now);
        return modify(query, update);
    }

    @Override
    public Optional<UserAccount> reserve(String userId, BigDecimal amount, Instant now) {
        Query query = new Query(Criteria.where("_id").is(userId).and("availableCredits").gte(amount));
        Update update = new Update()
                .inc("availableCredits", amount.negate())
                .inc("heldCredits", amount)
                .set("updatedAt", now);
        return modify(query, update);
    }

    @Override
    public Optional<UserAccount> unreserve(String userId, BigDecimal amount, Instant now) {
        Query query = new Query(Criteria.where("_id").is(userId).and("heldCredits").gte(amount));
        Update update = new Update()
                .inc("availableCredits", amount)
                .inc("heldCredits", amount.negate())
                .set("updatedAt", now);
        return modify(query, update);
    }

    @Override
    public Optional<UserAccount> captureReserved(String userId, BigDecimal amount, Instant now) {
        Query query = new Query(Criteria.where("_id").is(userId).and("heldCredits").gte(amount));
        Update update = new Update()
                .inc("creditBalance", amount.negate())
                .inc("heldCredits", amount.negate())
                .inc("ledgerSequence", 1)
                .set("updatedAt", now);
        return modify(query, update);
    }

    @Override
    public void recordActivity(String userId, BigDecimal pnlDelta, BigDecimal volumeDelta) {
        Update update = new Update()
                .inc("overallPnL", pnlDelta)
                .inc("totalVolume", volumeDelta);
        mongoTemplate.updateFirst(byId(userId), update, UserAccount.class);
    }

    @Override
    public void recordBiggestWin(String userId, BigDecimal profit) {
        mongoTemplate.updateFirst(byId(userId), new Update().max("biggestWin", profit), UserAccount.class);
    }

    @Override
    public void recordDailyClaim(String userId, int consecutiveDays, Instant claimedAt) {
        Update update = new Update()
                .set("consecutiveDays", consecutiveDays)
                .set("lastDailyRewardAt", claimedAt)
                .set("updatedAt", claimedAt);
        mongoTemplate.updateFirst(byId(userId), update, UserAccount.class);
    }

    @Override
    public long updateRank(String userId, String rankField, int rank) {
        UpdateResult result = mongoTemplate.updateFirst(byId(userId), Update.update(rankField, rank), UserAccount.class);
        return result.getMatchedCount();
    }

    private Optional<UserAccount> modify(Query query, Update update) {
        return Optional.ofNullable(mongoTemplate.findAndModify(query, update, RETURN_NEW, UserAccount.class));
    }

    private static Query byId(String userId) {
        return new Query(Criteria.where("_id").is(userId));
    }
}
