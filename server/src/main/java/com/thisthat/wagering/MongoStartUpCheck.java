package com.thisthat.wagering;

import org.bson.Document;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Fails startup when MongoDB is unreachable and warns when it is not a replica set, since
 * ledger writes rely on multi-document transactions.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "wagering.store.startup-check", havingValue = "true", matchIfMissing = true)
public class MongoStartUpCheck {

    private final MongoTemplate mongoTemplate;

    @PostConstruct
    public void checkMongoConnection() {
        Document hello;
        try {
            hello = mongoTemplate.executeCommand(new Document("hello", 1));
        } catch (RuntimeException e) {
            throw new IllegalStateException("MongoDB connection failed", e);
        }

        String replicaSet = hello.getString("setName");
        if (replicaSet == null) {
            log.warn("MongoDB is not running as a replica set; ledger transactions will fail");
        } else {
            log.info("MongoDB connection successful: database={}, replicaSet={}",
                    mongoTemplate.getDb().getName(), replicaSet);
        }
    }
}
