package com.thisthat.wagering.repositories;

import com.thisthat.wagering.entity.CreditTransaction;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * Append-only ledger. Rows are inserted, never updated.
 */
@Repository
public interface CreditTransactionRepository extends MongoRepository<CreditTransaction, String>,
        CreditTransactionRepositoryCustom {

    /**
     * Find entry by unique nonce (idempotency check).
     */
    Optional<CreditTransaction> findByNonce(String nonce);

    /**
     * Full ledger of a user in sequence order, for replay audits. Close the stream.
     */
    Stream<CreditTransaction> streamByUserIdOrderBySequenceAsc(String userId);
}
