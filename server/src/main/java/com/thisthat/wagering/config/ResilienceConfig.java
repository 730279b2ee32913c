package com.thisthat.wagering.config;

import com.thisthat.wagering.service.StoreRetries;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * resilience4j instances: a time limit on market lookups and a retry for units of work that
 * hit transient store errors (write conflicts between concurrent transactions on one user).
 */
@Configuration
public class ResilienceConfig {

    public static final String MARKET_LOOKUP = "market-lookup";
    public static final String STORE = "store";

    @Bean
    public TimeLimiter marketLookupTimeLimiter(WageringProperties properties) {
        return TimeLimiter.of(MARKET_LOOKUP, TimeLimiterConfig.custom()
                .timeoutDuration(properties.getMarket().getLookupTimeout())
                .cancelRunningFuture(true)
                .build());
    }

    @Bean
    public Retry storeRetry(WageringProperties properties) {
        WageringProperties.Store store = properties.getStore();
        return Retry.of(STORE, RetryConfig.custom()
                .maxAttempts(store.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(store.getInitialBackoff(), 2.0))
                .retryOnException(StoreRetries::isTransient)
                .build());
    }
}
