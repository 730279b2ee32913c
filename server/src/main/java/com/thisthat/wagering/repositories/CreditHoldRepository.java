package com.thisthat.wagering.repositories;

import com.thisthat.wagering.entity.CreditHold;
import com.thisthat.wagering.entity.HoldStatus;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface CreditHoldRepository extends MongoRepository<CreditHold, String> {

    List<CreditHold> findByUserIdAndStatus(String userId, HoldStatus status);

    /**
     * Atomically close an ACTIVE hold.
     *
     * @return 1 if this call closed the hold, 0 if it was already closed
     */
    @Query("{ 'id': ?0, 'status': 'ACTIVE' }")
    @Update("{ $set: { 'status': ?1, 'closedAt': ?2 } }")
    long closeIfActive(String holdId, HoldStatus newStatus, Instant closedAt);
}
