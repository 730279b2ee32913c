package com.thisthat.wagering.entity;

import org.springframework.data.mongodb.core.index.Indexed;
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
 * Market record as written by the ingestion process. Read-only here.
 */
@Document(collection = "markets")
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class MarketState {

    @MongoId(FieldType.STRING)
    private String id;

    /** Id assigned by the upstream market source. */
    @Indexed(unique = true, sparse = true)
    private String externalId;

    private String title;
    private MarketStatus status;
    private MarketResolution resolution;
    private Instant expiresAt;

    /** Implied probabilities in (0, 1]. */
    private BigDecimal thisOdds;
    private BigDecimal thatOdds;

    private Instant resolvedAt;

    /**
     * Open for new bets and sales: OPEN and not past its expiry.
     */
    public boolean isOpenAt(Instant now) {
        return status == MarketStatus.OPEN && (expiresAt == null || expiresAt.isAfter(now));
    }

    public BigDecimal oddsFor(BetSide side) {
        return side == BetSide.THIS ? thisOdds : thatOdds;
    }
}
