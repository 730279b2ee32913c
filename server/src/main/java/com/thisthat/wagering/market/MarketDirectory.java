package com.thisthat.wagering.market;

import com.thisthat.wagering.config.AsyncConfig;
import com.thisthat.wagering.entity.MarketState;
import com.thisthat.wagering.exception.MarketUnavailableException;
import com.thisthat.wagering.repositories.MarketStateRepository;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;

/**
 * Resolves a market identifier to its canonical record within a bounded time.
 *
 * Identifiers are tried as the upstream external id first, then as the internal id. A lookup
 * that times out or fails raises {@link MarketUnavailableException}; callers must not proceed
 * on missing market state.
 */
@Slf4j
@Component
public class MarketDirectory {

    private final MarketStateRepository marketStateRepository;
    private final TimeLimiter timeLimiter;
    private final Executor lookupExecutor;

    public MarketDirectory(MarketStateRepository marketStateRepository,
                           TimeLimiter marketLookupTimeLimiter,
                           @Qualifier(AsyncConfig.MARKET_LOOKUP_EXECUTOR) Executor lookupExecutor) {
        this.marketStateRepository = marketStateRepository;
        this.timeLimiter = marketLookupTimeLimiter;
        this.lookupExecutor = lookupExecutor;
    }

    /**
     * @return the market, or empty if no market has this identifier
     * @throws MarketUnavailableException if the store did not answer in time
     */
    public Optional<MarketState> resolve(String identifier) {
        try {
            return timeLimiter.executeFutureSupplier(
                    () -> CompletableFuture.supplyAsync(() -> lookup(identifier), lookupExecutor));
        } catch (TimeoutException e) {
            log.warn("Market lookup timed out: marketId={}, timeout={}",
                    identifier, timeLimiter.getTimeLimiterConfig().getTimeoutDuration());
            throw new MarketUnavailableException(identifier, e);
        } catch (Exception e) {
            log.error("Market lookup failed: marketId={}, error={}", identifier, e.getMessage());
            throw new MarketUnavailableException(identifier, e);
        }
    }

    private Optional<MarketState> lookup(String identifier) {
        Optional<MarketState> byExternalId = marketStateRepository.findByExternalId(identifier);
        if (byExternalId.isPresent()) {
            return byExternalId;
        }
        return marketStateRepository.findById(identifier);
    }
}
