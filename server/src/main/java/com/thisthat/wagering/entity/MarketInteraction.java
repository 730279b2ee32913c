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

import java.time.Instant;

/**
 * A user's temporary interaction with a market (currently only SKIP), valid until expiresAt.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@Document(collection = "user_market_interactions")
@CompoundIndex(name = "user_market_idx", def = "{'userId':1,'marketId':1}", unique = true)
@CompoundIndex(name = "action_expires_idx", def = "{'action':1,'expiresAt':1}")
public class MarketInteraction {

    @MongoId(FieldType.STRING)
    private String id;

    private String userId;
    private String marketId;
    private InteractionAction action;
    private Instant timestamp;
    private Instant expiresAt;
}
