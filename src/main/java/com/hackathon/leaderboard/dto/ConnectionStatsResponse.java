package com.hackathon.leaderboard.dto;

import com.hackathon.leaderboard.model.SubscriberState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionStatsResponse {
    private String competitionId;
    private Integer clientCount;
    private Integer totalClientCount;
    private SubscriberState subscriberState;
}
