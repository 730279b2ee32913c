package com.thisthat.wagering.repositories;

import com.thisthat.wagering.entity.MarketState;
import com.thisthat.wagering.entity.MarketStatus;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface MarketStateRepository extends MongoRepository<MarketState, String> {

    Optional<MarketState> findByExternalId(String externalId);

    List<MarketState> findByIdInAndStatusIn(Collection<String> ids, Collection<MarketStatus> statuses);
}
