package com.thisthat.wagering.repositories;

import com.thisthat.wagering.entity.CreditTransaction;
import com.thisthat.wagering.entity.TransactionType;

import java.util.List;

public interface CreditTransactionRepositoryCustom {

    /**
     * Newest first. type may be null for all types.
     */
    List<CreditTransaction> findPage(String userId, TransactionType type, int limit, long offset);

    long countFor(String userId, TransactionType type);
}
