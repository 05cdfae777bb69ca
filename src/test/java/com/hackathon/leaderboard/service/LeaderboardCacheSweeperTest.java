package com.hackathon.leaderboard.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LeaderboardCacheSweeperTest {
    
    @Mock
    private LeaderboardCalculator leaderboardCalculator;
    
    @InjectMocks
    private LeaderboardCacheSweeper sweeper;
    
    @Test
    void testSweepExpired_DelegatesToCalculator() {
        when(leaderboardCalculator.evictExpired()).thenReturn(3);
        
        sweeper.sweepExpired();
        
        verify(leaderboardCalculator).evictExpired();
    }
    
    @Test
    void testSweepExpired_FailureDoesNotEscapeScheduler() {
        when(leaderboardCalculator.evictExpired()).thenThrow(new IllegalStateException("boom"));
        
        assertDoesNotThrow(() -> sweeper.sweepExpired());
    }
}
