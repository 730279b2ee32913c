package com.thisthat.wagering.repositories;

import com.thisthat.wagering.entity.UserAccount;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

/**
 * Credit accounts. Balance fields are only changed through the atomic operations of
 * {@link UserAccountRepositoryCustom}.
 */
@Repository
public interface UserAccountRepository extends MongoRepository<UserAccount, String>, UserAccountRepositoryCustom {
}
