package com.thisthat.wagering.entity;

import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.FieldType;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A user's stake on one side of a market.
 *
 * Lifecycle: PENDING → WON | LOST | CANCELLED. State transitions are done with conditional
 * updates in {@code BetRepository}, so two settlement runs can never both move the same bet.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@Document(collection = "bets")
@CompoundIndex(name = "user_idempotency_idx", def = "{'userId':1,'idempotencyKey':1}", unique = true,
        partialFilter = "{ 'idempotencyKey': { $exists: true } }")
@CompoundIndex(name = "user_created_idx", def = "{'userId':1,'createdAt':-1}")
@CompoundIndex(name = "market_status_idx", def = "{'marketId':1,'status':1}")
public class Bet {

    @MongoId(FieldType.STRING)
    private String id;

    private String userId;
    private String marketId;
    private BetSide side;

    /** Stake in credits. */
    private BigDecimal amount;

    /** Implied probability of {@link #side} when the bet was placed. */
    private BigDecimal oddsAtBet;

    private BigDecimal potentialPayout;

    /** Set once the bet reaches a terminal state. */
    private BigDecimal actualPayout;

    private String idempotencyKey;

    @Builder.Default
    private BetStatus status = BetStatus.PENDING;

    private CloseReason closeReason;

    private Instant createdAt;
    private Instant resolvedAt;

    public boolean isOwnedBy(String userId) {
        return this.userId != null && this.userId.equals(userId);
    }
}
