package com.hackathon.leaderboard.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Event decoded from one frame of the external event stream.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DomainEvent {
    private String id;

    @JsonProperty("event_type")
    private String type;

    private String source;

    @JsonProperty("event_data")
    private Map<String, Object> data;

    @JsonProperty("created_at")
    private Instant createdAt;
}
