package com.thisthat.wagering.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Scheduler pool for the background jobs: leaderboard sync, skip cleanup, settlement sweep, ledger audit.
 * One thread per job so a slow cycle never delays another job.
 */
@Configuration
public class SchedulerConfig {

    public static final String JOB_SCHEDULER = "job-scheduler";

    @Bean(name = JOB_SCHEDULER)
    public ThreadPoolTaskScheduler jobScheduler() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(4);
        s.setThreadNamePrefix("job-");
        s.setWaitForTasksToCompleteOnShutdown(true);
        s.setAwaitTerminationSeconds(30);
        s.initialize();
        return s;
    }
}
