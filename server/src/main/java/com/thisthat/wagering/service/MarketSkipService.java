package com.thisthat.wagering.service;

import com.thisthat.wagering.config.WageringProperties;
import com.thisthat.wagering.entity.InteractionAction;
import com.thisthat.wagering.entity.MarketInteraction;
import com.thisthat.wagering.exception.ValidationException;
import com.thisthat.wagering.repositories.MarketInteractionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Tracks markets a user skipped. A skip hides the market for the configured TTL (3 days by
 * default); skipping again resets the TTL.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarketSkipService {

    private final MarketInteractionRepository marketInteractionRepository;
    private final WageringProperties properties;
    private final Clock clock;

    public SkipResult skip(String userId, String marketId) {
        requireIds(userId, marketId);
        Instant now = clock.instant();
        Instant expiresAt = now.plus(properties.getSkip().getTtl());

        MarketInteraction interaction = marketInteractionRepository.upsert(userId, marketId,
                InteractionAction.SKIP, now, expiresAt);
        log.debug("Market skipped: userId={}, marketId={}, expiresAt={}", userId, marketId, expiresAt);
        return new SkipResult(interaction != null, expiresAt);
    }

    /**
     * Market ids the user skipped whose TTL has not elapsed.
     */
    public Set<String> listSkipped(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("userId is required");
        }
        Set<String> marketIds = new LinkedHashSet<>();
        for (MarketInteraction interaction : marketInteractionRepository.findByUserIdAndActionAndExpiresAtAfter(
                userId, InteractionAction.SKIP, clock.instant())) {
            marketIds.add(interaction.getMarketId());
        }
        return marketIds;
    }

    /**
     * @return true if a skip existed
     */
    public boolean removeSkip(String userId, String marketId) {
        requireIds(userId, marketId);
        long deleted = marketInteractionRepository.deleteByUserIdAndMarketIdAndAction(userId, marketId,
                InteractionAction.SKIP);
        if (deleted > 0) {
            log.debug("Skip removed: userId={}, marketId={}", userId, marketId);
        }
        return deleted > 0;
    }

    /**
     * Delete skips whose TTL has elapsed.
     *
     * @return number of deleted skips
     */
    public long cleanupExpired() {
        long deleted = marketInteractionRepository.deleteByActionAndExpiresAtLessThanEqual(
                InteractionAction.SKIP, clock.instant());
        log.info("Expired skips cleaned up: deleted={}", deleted);
        return deleted;
    }

    private static void requireIds(String userId, String marketId) {
        if (userId == null || userId.isBlank() || marketId == null || marketId.isBlank()) {
            throw new ValidationException("userId and marketId are required");
        }
    }
}
