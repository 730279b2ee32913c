package com.thisthat.wagering.entity;

import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.FieldType;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Immutable ledger entry. The ledger is append-only: rows are inserted once and never updated.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@Document(collection = "credit_transactions")
@CompoundIndex(name = "user_sequence_idx", def = "{'userId':1,'sequence':1}", unique = true)
@CompoundIndex(name = "user_created_idx", def = "{'userId':1,'createdAt':-1}")
public class CreditTransaction {

    @MongoId(FieldType.STRING)
    private String id;

    private String userId;

    /** Signed: positive for credits, negative for debits. */
    private BigDecimal amount;

    private TransactionType transactionType;

    /** Bet id, hold id or grant reference this entry belongs to. */
    private String referenceId;

    /**
     * Running balance after this entry. balanceAfter = previous balanceAfter + amount.
     */
    private BigDecimal balanceAfter;

    /** Per-user ledger position, starting at 1. */
    private long sequence;

    /**
     * Nonce for idempotency. Format: {type}:{referenceId}.
     * Unique index ensures each ledger effect is inserted only once.
     */
    @Indexed(unique = true, sparse = true)
    private String nonce;

    private Instant createdAt;
}
