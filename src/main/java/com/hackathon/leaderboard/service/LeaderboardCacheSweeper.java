package com.hackathon.leaderboard.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class LeaderboardCacheSweeper {
    
    private static final Logger logger = LoggerFactory.getLogger(LeaderboardCacheSweeper.class);
    
    private final LeaderboardCalculator leaderboardCalculator;
    
    @Autowired
    public LeaderboardCacheSweeper(LeaderboardCalculator leaderboardCalculator) {
        this.leaderboardCalculator = leaderboardCalculator;
    }
    
    /**
     * Evict expired leaderboards of competitions nobody has read recently.
     */
    @Scheduled(fixedRateString = "${leaderboard.cache.sweep-interval-ms:60000}")
    public void sweepExpired() {
        try {
            int evicted = leaderboardCalculator.evictExpired();
            if (evicted > 0) {
                logger.debug("Evicted {} expired leaderboard cache entries", evicted);
            }
        } catch (Exception e) {
            logger.error("Error sweeping leaderboard cache", e);
        }
    }
}
