package com.hackathon.leaderboard.repository.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hackathon.leaderboard.exception.RecordStoreException;
import com.hackathon.leaderboard.model.ScoreRecord;
import com.hackathon.leaderboard.model.Submission;
import com.hackathon.leaderboard.repository.RecordStoreRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Queries the record store's table API. Every call is bounded by the configured timeout
 * so a stalled store cannot wedge the event subscriber.
 */
@Repository
public class HttpRecordStoreRepository implements RecordStoreRepository {

    private static final Logger logger = LoggerFactory.getLogger(HttpRecordStoreRepository.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;
    private final String projectId;
    private final Duration timeout;
    private final String submissionsTable;
    private final String scoresTable;

    public HttpRecordStoreRepository(
            ObjectMapper objectMapper,
            @Value("${leaderboard.record-store.base-url}") String baseUrl,
            @Value("${leaderboard.record-store.api-key:}") String apiKey,
            @Value("${leaderboard.record-store.project-id:}") String projectId,
            @Value("${leaderboard.record-store.timeout-ms:10000}") long timeoutMillis,
            @Value("${leaderboard.record-store.submissions-table:submissions}") String submissionsTable,
            @Value("${leaderboard.record-store.scores-table:scores}") String scoresTable) {
        if (apiKey == null || apiKey.isBlank() || projectId == null || projectId.isBlank()) {
            throw new IllegalStateException("leaderboard.record-store.api-key and leaderboard.record-store.project-id must be set");
        }
        this.objectMapper = objectMapper;
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.apiKey = apiKey;
        this.projectId = projectId;
        this.timeout = Duration.ofMillis(timeoutMillis);
        this.submissionsTable = submissionsTable;
        this.scoresTable = scoresTable;
        this.httpClient = HttpClient.newBuilder().connectTimeout(this.timeout).build();
    }

    @Override
    public List<Submission> findSubmissionsByCompetition(String competitionId) {
        ObjectNode filter = objectMapper.createObjectNode();
        filter.put("hackathon_id", competitionId);
        return queryRows(submissionsTable, filter, Submission.class);
    }

    @Override
    public List<ScoreRecord> findScoresBySubmissionIds(Collection<String> submissionIds) {
        if (submissionIds == null || submissionIds.isEmpty()) {
            return new ArrayList<>();
        }
        ObjectNode filter = objectMapper.createObjectNode();
        ArrayNode ids = filter.putObject("submission_id").putArray("$in");
        submissionIds.forEach(ids::add);
        return queryRows(scoresTable, filter, ScoreRecord.class);
    }

    private <T> List<T> queryRows(String table, ObjectNode filter, Class<T> rowType) {
        ObjectNode body = objectMapper.createObjectNode();
        body.set("filter", filter);

        HttpRequest request = HttpRequest.newBuilder(tableQueryUri(table))
                .timeout(timeout)
                .header("Authorization", "Bearer " + apiKey)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new RecordStoreException("Record store query on " + table + " timed out after " + timeout.toMillis() + "ms", e);
        } catch (IOException e) {
            throw new RecordStoreException("Record store query on " + table + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RecordStoreException("Interrupted while querying " + table, e);
        }

        if (response.statusCode() != 200) {
            throw new RecordStoreException(
                "API request failed with status " + response.statusCode() + ": " + response.body());
        }

        List<T> rows = readRows(response.body(), rowType);
        logger.debug("Fetched {} rows from table {}", rows.size(), table);
        return rows;
    }

    private <T> List<T> readRows(String body, Class<T> rowType) {
        try {
            JsonNode rows = objectMapper.readTree(body).path("rows");
            if (rows.isMissingNode() || rows.isNull()) {
                return new ArrayList<>();
            }
            JavaType listType = objectMapper.getTypeFactory().constructCollectionType(List.class, rowType);
            return objectMapper.convertValue(rows, listType);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new RecordStoreException("Failed to decode record store response: " + e.getMessage(), e);
        }
    }

    private URI tableQueryUri(String table) {
        return URI.create(baseUrl + "/v1/public/projects/" + projectId + "/database/tables/" + table + "/query");
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
