package com.thisthat.wagering.repositories;

import com.thisthat.wagering.entity.UserAccount;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

/**
 * Atomic balance mutations. Each method is a single conditional update on the user document and
 * returns the document as it is after the update, or empty when the condition did not hold.
 *
 * CRITICAL: methods that move creditBalance also increment ledgerSequence; the caller must append
 * exactly one ledger row with that sequence in the same transaction.
 */
public interface UserAccountRepositoryCustom {

    /**
     * Insert an empty account unless it exists.
     *
     * @return true if this call created the account
     */
    boolean createIfAbsent(String userId, Instant now);

    Optional<UserAccount> applyCredit(String userId, BigDecimal amount, Instant now);

    /**
     * Debit only if availableCredits covers the amount.
     */
    Optional<UserAccount> applyDebit(String userId, BigDecimal amount, Instant now);

    /**
     * Move funds from available to held, only if availableCredits covers the amount.
     */
    Optional<UserAccount> reserve(String userId, BigDecimal amount, Instant now);

    /**
     * Return held funds to available.
     */
    Optional<UserAccount> unreserve(String userId, BigDecimal amount, Instant now);

    /**
     * Spend held funds: heldCredits and creditBalance both drop by the amount.
     */
    Optional<UserAccount> captureReserved(String userId, BigDecimal amount, Instant now);

    /**
     * Add to overallPnL and totalVolume. Either delta may be zero.
     */
    void recordActivity(String userId, BigDecimal pnlDelta, BigDecimal volumeDelta);

    /**
     * Raise biggestWin to the given profit if it is larger ($max). Does not touch the balance.
     */
    void recordBiggestWin(String userId, BigDecimal profit);

    /**
     * Record a daily claim: sets consecutiveDays and lastDailyRewardAt. The credit itself goes
     * through {@link #applyCredit}.
     */
    void recordDailyClaim(String userId, int consecutiveDays, Instant claimedAt);

    /**
     * Set one rank field. Returns the number of matched accounts (0 for an unknown user).
     */
    long updateRank(String userId, String rankField, int rank);
}
