package com.thisthat.wagering.entity;

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
 * A user's credit account.
 *
 * creditBalance is the cached sum of the user's ledger; availableCredits is what can still be
 * spent (creditBalance minus heldCredits). All three move together in one atomic update, see
 * {@code UserAccountRepositoryImpl}. Never write these fields through {@code save()}.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@Document(collection = "users")
public class UserAccount {

    /** The external user id. */
    @MongoId(FieldType.STRING)
    private String id;

    @Builder.Default
    private BigDecimal creditBalance = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal availableCredits = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal heldCredits = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal overallPnL = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal totalVolume = BigDecimal.ZERO;

    /** Largest single-bet profit (payout minus stake) on a winning settlement. */
    @Builder.Default
    private BigDecimal biggestWin = BigDecimal.ZERO;

    /** Current daily-claim streak; 0 before the first claim. */
    private int consecutiveDays;

    private Instant lastDailyRewardAt;

    private Integer rankByPnL;
    private Integer rankByVolume;

    /**
     * Position of the latest ledger entry. Incremented in the same update as the balance,
     * so each transaction row gets a gap-free per-user sequence.
     */
    @Builder.Default
    private long ledgerSequence = 0L;

    private Instant createdAt;
    private Instant updatedAt;
}
