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
 * Funds reserved out of a user's available credits. Leaves ACTIVE exactly once.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@Document(collection = "credit_holds")
@CompoundIndex(name = "user_status_idx", def = "{'userId':1,'status':1}")
public class CreditHold {

    @MongoId(FieldType.STRING)
    private String id;

    private String userId;
    private BigDecimal amount;
    private String reason;
    private String referenceId;

    @Builder.Default
    private HoldStatus status = HoldStatus.ACTIVE;

    private Instant createdAt;
    private Instant closedAt;
}
