package com.hackathon.leaderboard.controller;

import com.hackathon.leaderboard.dto.ConnectionStatsResponse;
import com.hackathon.leaderboard.dto.LeaderboardResponse;
import com.hackathon.leaderboard.events.EventSubscriber;
import com.hackathon.leaderboard.model.LeaderboardEntry;
import com.hackathon.leaderboard.service.LeaderboardCalculator;
import com.hackathon.leaderboard.websocket.ConnectionHub;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

@RestController
@Validated
@RequestMapping("/api/v1/competitions")
public class LeaderboardController {
    
    private static final Logger logger = LoggerFactory.getLogger(LeaderboardController.class);
    
    private final LeaderboardCalculator leaderboardCalculator;
    private final ConnectionHub connectionHub;
    private final EventSubscriber eventSubscriber;
    
    @Autowired
    public LeaderboardController(
            LeaderboardCalculator leaderboardCalculator,
            ConnectionHub connectionHub,
            EventSubscriber eventSubscriber) {
        this.leaderboardCalculator = leaderboardCalculator;
        this.connectionHub = connectionHub;
        this.eventSubscriber = eventSubscriber;
    }
    
    /**
     * Current leaderboard, served from the short-lived cache when fresh.
     * GET /api/v1/competitions/{competitionId}/leaderboard
     */
    @GetMapping("/{competitionId}/leaderboard")
    public ResponseEntity<LeaderboardResponse> getLeaderboard(
            @PathVariable @NotBlank @Size(max = 128) String competitionId) {
        
        logger.info("Received GET request for leaderboard - competitionId: {}", competitionId);
        
        List<LeaderboardEntry> entries = leaderboardCalculator.calculateLeaderboard(competitionId);
        LeaderboardResponse response = LeaderboardResponse.builder()
            .competitionId(competitionId)
            .entries(entries)
            .totalEntries(entries.size())
            .retrievedAt(Instant.now())
            .build();
        
        logger.info("Returned leaderboard - competitionId: {}, entries: {}", competitionId, entries.size());
        return ResponseEntity.ok(response);
    }
    
    /**
     * Live subscriber counts.
     * GET /api/v1/competitions/{competitionId}/connections
     */
    @GetMapping("/{competitionId}/connections")
    public ResponseEntity<ConnectionStatsResponse> getConnections(
            @PathVariable @NotBlank @Size(max = 128) String competitionId) {
        ConnectionStatsResponse response = ConnectionStatsResponse.builder()
            .competitionId(competitionId)
            .clientCount(connectionHub.getClientCount(competitionId))
            .totalClientCount(connectionHub.getTotalClientCount())
            .subscriberState(eventSubscriber.getState())
            .build();
        return ResponseEntity.ok(response);
    }
}
