package com.hackathon.leaderboard.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hackathon.leaderboard.dto.LeaderboardUpdateMessage;
import com.hackathon.leaderboard.exception.LeaderboardException;
import com.hackathon.leaderboard.model.LeaderboardEntry;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Serializes rankings into the {@code leaderboard_update} frame sent to live subscribers.
 */
@Component
public class LeaderboardUpdateEncoder {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public LeaderboardUpdateEncoder(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public String encode(List<LeaderboardEntry> rankings) {
        LeaderboardUpdateMessage message = LeaderboardUpdateMessage.builder()
            .data(rankings)
            .timestamp(clock.instant())
            .build();
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new LeaderboardException("Failed to encode leaderboard update", "ENCODING_ERROR", e);
        }
    }
}
