package com.hackathon.leaderboard.events;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * One dispatched Server-Sent Events frame. {@code id} is null when the frame carried none.
 */
@Data
@AllArgsConstructor
public class SseFrame {
    private String id;
    private String event;
    private String data;
}
