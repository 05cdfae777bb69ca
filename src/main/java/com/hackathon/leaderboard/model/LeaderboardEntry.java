package com.hackathon.leaderboard.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One ranked row. Instances are shared by every reader of a cached leaderboard.
 */
@Value
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class LeaderboardEntry {
    int rank;
    String submissionId;
    String teamId;
    String teamName;
    String trackId;
    String trackName;
    String title;
    double averageScore;
    int scoreCount;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    Instant updatedAt;

    @JsonIgnore
    public boolean isScored() {
        return scoreCount > 0;
    }
}
