package com.thisthat.wagering.service;

import lombok.Value;

@Value
public class LeaderboardSyncResult {
    int pnlRanked;
    int volumeRanked;
    /** Ranked members with no account. */
    int unknownUsers;
    int failedUpdates;

    public static LeaderboardSyncResult empty() {
        return new LeaderboardSyncResult(0, 0, 0, 0);
    }
}
