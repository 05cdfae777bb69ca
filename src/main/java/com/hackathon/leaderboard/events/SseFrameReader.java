package com.hackathon.leaderboard.events;

import java.io.BufferedReader;
import java.io.IOException;

/**
 * Splits a {@code text/event-stream} body into frames. {@code data:} lines accumulate until a
 * blank line dispatches them; comment lines and frames without data are skipped.
 */
public class SseFrameReader {

    private final BufferedReader reader;

    public SseFrameReader(BufferedReader reader) {
        this.reader = reader;
    }

    /**
     * @return the next frame carrying data, or null at end of stream
     */
    public SseFrame next() throws IOException {
        String id = null;
        String event = null;
        StringBuilder data = null;

        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isEmpty()) {
                if (data != null) {
                    return new SseFrame(id, event, data.toString());
                }
                id = null;
                event = null;
                continue;
            }
            if (line.startsWith(":")) {
                continue;
            }

            int colon = line.indexOf(':');
            String field = colon < 0 ? line : line.substring(0, colon);
            String value = colon < 0 ? "" : line.substring(colon + 1);
            if (value.startsWith(" ")) {
                value = value.substring(1);
            }

            switch (field) {
                case "data":
                    if (data == null) {
                        data = new StringBuilder(value);
                    } else {
                        data.append('\n').append(value);
                    }
                    break;
                case "id":
                    id = value;
                    break;
                case "event":
                    event = value;
                    break;
                default:
                    break;
            }
        }

        // Unterminated last frame
        return data != null ? new SseFrame(id, event, data.toString()) : null;
    }
}
