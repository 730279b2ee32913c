package com.thisthat.wagering.leaderboard;

import java.util.List;

/**
 * Read access to the live leaderboards kept by the ranked-set store.
 */
public interface RankedStore {

    /**
     * All members of a ranked set, highest score first. Empty when the set does not exist.
     */
    List<String> membersByScoreDescending(String key);
}
