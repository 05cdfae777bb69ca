package com.hackathon.leaderboard.events;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Opens the long-lived subscription to the external event source.
 */
public interface EventStreamSource {

    /**
     * @param eventTypes  allow-list sent with the subscription
     * @param lastEventId id of the last event processed, or null on first connect
     * @return the raw event-stream body; closing it terminates the subscription
     * @throws IOException on connection failure or a non-success response
     */
    InputStream open(List<String> eventTypes, String lastEventId) throws IOException, InterruptedException;
}
