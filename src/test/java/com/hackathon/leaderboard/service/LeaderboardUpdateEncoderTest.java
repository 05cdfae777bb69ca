package com.hackathon.leaderboard.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.hackathon.leaderboard.model.LeaderboardEntry;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LeaderboardUpdateEncoderTest {
    
    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    
    @Test
    void testEncode_ProducesLeaderboardUpdateFrame() throws Exception {
        // Arrange
        Instant now = Instant.parse("2026-03-01T12:00:00Z");
        LeaderboardUpdateEncoder encoder = new LeaderboardUpdateEncoder(objectMapper, Clock.fixed(now, ZoneOffset.UTC));
        LeaderboardEntry entry = LeaderboardEntry.builder()
            .rank(1)
            .submissionId("S2")
            .teamId("T2")
            .teamName("Team Two")
            .trackId("TR1")
            .trackName("AI")
            .title("Project Two")
            .averageScore(9.0)
            .scoreCount(2)
            .updatedAt(now)
            .build();
        
        // Act
        JsonNode json = objectMapper.readTree(encoder.encode(List.of(entry)));
        
        // Assert
        assertEquals("leaderboard_update", json.get("type").asText());
        assertEquals("2026-03-01T12:00:00.000Z", json.get("timestamp").asText());
        JsonNode first = json.get("data").get(0);
        assertEquals(1, first.get("rank").asInt());
        assertEquals("S2", first.get("submission_id").asText());
        assertEquals("Team Two", first.get("team_name").asText());
        assertEquals("AI", first.get("track_name").asText());
        assertEquals(9.0, first.get("average_score").asDouble(), 1e-9);
        assertEquals(2, first.get("score_count").asInt());
        assertEquals("2026-03-01T12:00:00.000Z", first.get("updated_at").asText());
        assertFalse(first.has("scored"));
    }
    
    @Test
    void testEncode_EmptyLeaderboard() throws Exception {
        LeaderboardUpdateEncoder encoder = new LeaderboardUpdateEncoder(objectMapper, Clock.systemUTC());
        
        JsonNode json = objectMapper.readTree(encoder.encode(List.of()));
        
        assertTrue(json.get("data").isArray());
        assertEquals(0, json.get("data").size());
    }
}
