package com.thisthat.wagering.service;

import com.thisthat.wagering.config.WageringProperties;
import com.thisthat.wagering.leaderboard.RankedStore;
import com.thisthat.wagering.repositories.UserAccountRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Copies live leaderboard positions from the ranked-set store onto user accounts
 * (rankByPnL, rankByVolume). Rank is the 1-based position in descending score order.
 * Users missing from a set keep their previous rank.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LeaderboardSyncService {

    static final String RANK_BY_PNL = "rankByPnL";
    static final String RANK_BY_VOLUME = "rankByVolume";

    private final RankedStore rankedStore;
    private final UserAccountRepository userAccountRepository;
    private final WageringProperties properties;

    public LeaderboardSyncResult syncLeaderboardToDB() {
        WageringProperties.Leaderboard keys = properties.getLeaderboard();
        List<String> byPnl = rankedStore.membersByScoreDescending(keys.getPnlKey());
        List<String> byVolume = rankedStore.membersByScoreDescending(keys.getVolumeKey());

        if (byPnl.isEmpty() && byVolume.isEmpty()) {
            log.info("Leaderboards empty, nothing to sync");
            return LeaderboardSyncResult.empty();
        }

        int[] pnlStats = applyRanks(byPnl, RANK_BY_PNL);
        int[] volumeStats = applyRanks(byVolume, RANK_BY_VOLUME);

        LeaderboardSyncResult result = new LeaderboardSyncResult(byPnl.size(), byVolume.size(),
                pnlStats[0] + volumeStats[0], pnlStats[1] + volumeStats[1]);
        log.info("Leaderboard synced: pnlRanked={}, volumeRanked={}, unknownUsers={}, failedUpdates={}",
                result.getPnlRanked(), result.getVolumeRanked(), result.getUnknownUsers(), result.getFailedUpdates());
        return result;
    }

    /**
     * @return {unknown users, failed updates}
     */
    private int[] applyRanks(List<String> userIds, String rankField) {
        int unknown = 0;
        int failed = 0;
        for (int i = 0; i < userIds.size(); i++) {
            String userId = userIds.get(i);
            try {
                if (userAccountRepository.updateRank(userId, rankField, i + 1) == 0) {
                    unknown++;
                }
            } catch (DataAccessException e) {
                failed++;
                log.warn("Failed to update rank: userId={}, field={}, rank={}, error={}",
                        userId, rankField, i + 1, e.getMessage());
            }
        }
        if (unknown > 0) {
            log.debug("Ranked members without an account ignored: field={}, count={}", rankField, unknown);
        }
        return new int[] {unknown, failed};
    }
}
