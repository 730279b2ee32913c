package com.thisthat.wagering.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import static org.assertj.core.api.Assertions.assertThat;

class AsyncConfigTest {

    @Test
    @DisplayName("the settlement pool queues a bounded backlog so it can grow to its max size")
    void settlementExecutorIsBounded() {
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) new AsyncConfig().settlementExecutor();
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(2);
            assertThat(executor.getMaxPoolSize()).isEqualTo(4);
            assertThat(executor.getThreadPoolExecutor().getQueue().remainingCapacity()).isEqualTo(100);
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void marketLookupExecutorIsBounded() {
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) new AsyncConfig().marketLookupExecutor();
        try {
            assertThat(executor.getThreadPoolExecutor().getQueue().remainingCapacity()).isEqualTo(500);
        } finally {
            executor.shutdown();
        }
    }
}
