package com.thisthat.wagering.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: settlement-executor for resolution events, market-lookup-executor for
 * time-limited market reads.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String SETTLEMENT_EXECUTOR = "settlement-executor";
    public static final String MARKET_LOOKUP_EXECUTOR = "market-lookup-executor";

    @Bean(name = SETTLEMENT_EXECUTOR)
    public Executor settlementExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setMaxPoolSize(4);
        e.setQueueCapacity(100);
        e.setThreadNamePrefix("settlement-");
        e.initialize();
        return e;
    }

    @Bean(name = MARKET_LOOKUP_EXECUTOR)
    public Executor marketLookupExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(8);
        e.setMaxPoolSize(32);
        e.setQueueCapacity(500);
        e.setThreadNamePrefix("market-lookup-");
        e.initialize();
        return e;
    }
}
