package com.hackathon.leaderboard.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.hackathon.leaderboard.model.LeaderboardEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardResponse {
    private String competitionId;
    private List<LeaderboardEntry> entries;
    private Integer totalEntries;
    
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant retrievedAt;
}
