package com.hackathon.leaderboard.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.hackathon.leaderboard.model.LeaderboardEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Payload pushed to every live subscriber of a competition.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardUpdateMessage {
    public static final String TYPE = "leaderboard_update";

    @Builder.Default
    private String type = TYPE;

    private List<LeaderboardEntry> data;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant timestamp;
}
