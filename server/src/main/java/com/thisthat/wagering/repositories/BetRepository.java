package com.thisthat.wagering.repositories;

import com.thisthat.wagering.entity.Bet;
import com.thisthat.wagering.entity.BetStatus;
import com.thisthat.wagering.entity.CloseReason;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.Update;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for bets with atomic state transitions.
 *
 * CRITICAL: a bet leaves PENDING only through {@link #closeIfPending}; concurrent settlement
 * runs and sales race on that single conditional update.
 */
@Repository
public interface BetRepository extends MongoRepository<Bet, String>, BetRepositoryCustom {

    /**
     * Idempotency lookup for a client-supplied key.
     */
    Optional<Bet> findByUserIdAndIdempotencyKey(String userId, String idempotencyKey);

    List<Bet> findByMarketIdAndStatus(String marketId, BetStatus status);

    /**
     * Atomically move a PENDING bet to a terminal state.
     *
     * @param betId the bet ID
     * @param newStatus WON, LOST or CANCELLED
     * @param actualPayout credits returned to the user (0 for a loss)
     * @param closeReason SOLD or REFUNDED for CANCELLED, null otherwise
     * @param resolvedAt the transition timestamp
     * @return number of documents modified (1 if successful, 0 if the bet was no longer PENDING)
     */
    @Query("{ 'id': ?0, 'status': 'PENDING' }")
    @Update("{ $set: { 'status': ?1, 'actualPayout': ?2, 'closeReason': ?3, 'resolvedAt': ?4 } }")
    long closeIfPending(String betId, BetStatus newStatus, BigDecimal actualPayout, CloseReason closeReason,
                        Instant resolvedAt);
}
