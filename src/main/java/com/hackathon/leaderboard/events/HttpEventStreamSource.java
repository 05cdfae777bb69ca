package com.hackathon.leaderboard.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

/**
 * Subscribes to the record store's event stream over HTTP. The request carries no read
 * timeout; the subscriber closes the returned stream to cancel it.
 */
@Component
public class HttpEventStreamSource implements EventStreamSource {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI subscribeUri;
    private final String apiKey;

    public HttpEventStreamSource(
            ObjectMapper objectMapper,
            @Value("${leaderboard.record-store.base-url}") String baseUrl,
            @Value("${leaderboard.record-store.api-key:}") String apiKey,
            @Value("${leaderboard.record-store.project-id:}") String projectId) {
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.subscribeUri = URI.create(base + "/v1/public/projects/" + projectId + "/database/events/subscribe");
        this.httpClient = HttpClient.newBuilder().connectTimeout(CONNECT_TIMEOUT).build();
    }

    @Override
    public InputStream open(List<String> eventTypes, String lastEventId) throws IOException, InterruptedException {
        ObjectNode payload = objectMapper.createObjectNode();
        ArrayNode types = payload.putArray("event_types");
        eventTypes.forEach(types::add);

        HttpRequest.Builder builder = HttpRequest.newBuilder(subscribeUri)
            .header("Authorization", "Bearer " + apiKey)
            .header("Content-Type", "application/json")
            .header("Accept", "text/event-stream")
            .POST(HttpRequest.BodyPublishers.ofString(payload.toString()));
        if (lastEventId != null && !lastEventId.isEmpty()) {
            builder.header("Last-Event-ID", lastEventId);
        }

        HttpResponse<InputStream> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
        if (response.statusCode() != 200) {
            String body;
            try (InputStream in = response.body()) {
                body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            throw new IOException("subscription failed with status " + response.statusCode() + ": " + body);
        }
        return response.body();
    }
}
