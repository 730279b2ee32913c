package com.thisthat.wagering.service;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of replaying one user's ledger.
 */
@Value
public class LedgerAudit {
    String userId;
    BigDecimal storedBalance;
    BigDecimal replayedBalance;
    long entries;
    /** Ids of entries whose balanceAfter or sequence does not follow from the entries before them. */
    List<String> brokenEntries;
    /** availableCredits + heldCredits == creditBalance. */
    boolean holdsConsistent;

    public boolean isConsistent() {
        return storedBalance.compareTo(replayedBalance) == 0 && brokenEntries.isEmpty() && holdsConsistent;
    }
}
