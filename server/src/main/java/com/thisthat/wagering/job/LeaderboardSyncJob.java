package com.thisthat.wagering.job;

import com.thisthat.wagering.config.SchedulerConfig;
import com.thisthat.wagering.config.WageringProperties;
import com.thisthat.wagering.service.LeaderboardSyncService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Copies live leaderboard ranks onto accounts, every 5 minutes by default.
 */
@Component
public class LeaderboardSyncJob extends SingleFlightJob {

    private final LeaderboardSyncService leaderboardSyncService;

    public LeaderboardSyncJob(LeaderboardSyncService leaderboardSyncService,
                              @Qualifier(SchedulerConfig.JOB_SCHEDULER) TaskScheduler scheduler,
                              WageringProperties properties) {
        super("leaderboard-sync", scheduler, properties.getJobs().getLeaderboardSync());
        this.leaderboardSyncService = leaderboardSyncService;
    }

    @Override
    protected void runCycle() {
        leaderboardSyncService.syncLeaderboardToDB();
    }
}
