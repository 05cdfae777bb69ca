package com.hackathon.leaderboard.controller;

import com.hackathon.leaderboard.dto.ConnectionStatsResponse;
import com.hackathon.leaderboard.dto.LeaderboardResponse;
import com.hackathon.leaderboard.events.EventSubscriber;
import com.hackathon.leaderboard.exception.RecordStoreException;
import com.hackathon.leaderboard.model.LeaderboardEntry;
import com.hackathon.leaderboard.model.SubscriberState;
import com.hackathon.leaderboard.service.LeaderboardCalculator;
import com.hackathon.leaderboard.websocket.ConnectionHub;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LeaderboardControllerTest {
    
    @Mock
    private LeaderboardCalculator leaderboardCalculator;
    
    @Mock
    private ConnectionHub connectionHub;
    
    @Mock
    private EventSubscriber eventSubscriber;
    
    @InjectMocks
    private LeaderboardController leaderboardController;
    
    @Test
    void testGetLeaderboard_Success() {
        // Arrange
        List<LeaderboardEntry> entries = List.of(
            LeaderboardEntry.builder().rank(1).submissionId("S1").averageScore(9.0).scoreCount(2).build(),
            LeaderboardEntry.builder().rank(2).submissionId("S2").averageScore(0.0).scoreCount(0).build());
        when(leaderboardCalculator.calculateLeaderboard("H1")).thenReturn(entries);
        
        // Act
        ResponseEntity<LeaderboardResponse> response = leaderboardController.getLeaderboard("H1");
        
        // Assert
        assertEquals(HttpStatus.OK, response.getStatusCode());
        LeaderboardResponse body = response.getBody();
        assertNotNull(body);
        assertEquals("H1", body.getCompetitionId());
        assertEquals(2, body.getTotalEntries());
        assertEquals(entries, body.getEntries());
        assertNotNull(body.getRetrievedAt());
    }
    
    @Test
    void testGetLeaderboard_RecordStoreFailurePropagates() {
        when(leaderboardCalculator.calculateLeaderboard("H1"))
            .thenThrow(new RecordStoreException("API request failed with status 500: boom"));
        
        assertThrows(RecordStoreException.class, () -> leaderboardController.getLeaderboard("H1"));
    }
    
    @Test
    void testGetConnections_ReportsHubAndSubscriberState() {
        // Arrange
        when(connectionHub.getClientCount("H1")).thenReturn(3);
        when(connectionHub.getTotalClientCount()).thenReturn(5);
        when(eventSubscriber.getState()).thenReturn(SubscriberState.STREAMING);
        
        // Act
        ResponseEntity<ConnectionStatsResponse> response = leaderboardController.getConnections("H1");
        
        // Assert
        ConnectionStatsResponse body = response.getBody();
        assertNotNull(body);
        assertEquals("H1", body.getCompetitionId());
        assertEquals(3, body.getClientCount());
        assertEquals(5, body.getTotalClientCount());
        assertEquals(SubscriberState.STREAMING, body.getSubscriberState());
        verifyNoInteractions(leaderboardCalculator);
    }
    
    @Test
    void testHealth() {
        ResponseEntity<Map<String, String>> response = new HealthController().health();
        
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(Map.of("status", "healthy", "service", "leaderboard-websocket"), response.getBody());
    }
}
