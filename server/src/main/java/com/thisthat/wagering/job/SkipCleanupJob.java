package com.thisthat.wagering.job;

import com.thisthat.wagering.config.SchedulerConfig;
import com.thisthat.wagering.config.WageringProperties;
import com.thisthat.wagering.service.MarketSkipService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

@Component
public class SkipCleanupJob extends SingleFlightJob {

    private final MarketSkipService marketSkipService;

    public SkipCleanupJob(MarketSkipService marketSkipService,
                          @Qualifier(SchedulerConfig.JOB_SCHEDULER) TaskScheduler scheduler,
                          WageringProperties properties) {
        super("skip-cleanup", scheduler, properties.getJobs().getSkipCleanup());
        this.marketSkipService = marketSkipService;
    }

    @Override
    protected void runCycle() {
        marketSkipService.cleanupExpired();
    }
}
