package com.thisthat.wagering.leaderboard;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Live leaderboards as Redis sorted sets (member = userId, score = metric).
 */
@Component
@RequiredArgsConstructor
public class RedisRankedStore implements RankedStore {

    private final StringRedisTemplate redisTemplate;

    @Override
    public List<String> membersByScoreDescending(String key) {
        Set<String> members = redisTemplate.opsForZSet().reverseRange(key, 0, -1);
        return members == null ? List.of() : new ArrayList<>(members);
    }
}
