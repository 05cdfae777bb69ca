package com.hackathon.leaderboard.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hackathon.leaderboard.exception.LeaderboardException;
import com.hackathon.leaderboard.exception.MalformedEventException;
import com.hackathon.leaderboard.model.DomainEvent;
import com.hackathon.leaderboard.model.LeaderboardEntry;
import com.hackathon.leaderboard.model.SubscriberState;
import com.hackathon.leaderboard.service.LeaderboardCalculator;
import com.hackathon.leaderboard.service.LeaderboardUpdateEncoder;
import com.hackathon.leaderboard.websocket.ConnectionHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps a subscription to the external event stream open for the life of the process and
 * turns score and submission events into leaderboard broadcasts.
 *
 * <p>Any stream failure, including a clean close by the server, leads to a reconnect after
 * a fixed delay. Only {@link #cancel()} ends the loop.
 */
@Component
public class EventSubscriber {

    private static final Logger logger = LoggerFactory.getLogger(EventSubscriber.class);

    public static final String SCORE_SUBMITTED = "score.submitted";
    public static final String SCORE_UPDATED = "score.updated";
    public static final String SUBMISSION_CREATED = "submission.created";
    public static final String SUBMISSION_UPDATED = "submission.updated";

    private final EventStreamSource eventStreamSource;
    private final LeaderboardCalculator calculator;
    private final ConnectionHub hub;
    private final LeaderboardUpdateEncoder encoder;
    private final ObjectMapper objectMapper;
    private final List<String> eventTypes;
    private final String competitionIdField;
    private final Duration retryDelay;
    private final Map<String, Boolean> recentEventIds;

    private final ExecutorService runner =
        Executors.newSingleThreadExecutor(new CustomizableThreadFactory("event-subscriber-"));
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch cancelSignal = new CountDownLatch(1);
    private final AtomicReference<InputStream> activeStream = new AtomicReference<>();

    private volatile SubscriberState state = SubscriberState.STOPPED;
    private volatile String lastEventId;

    public EventSubscriber(
            EventStreamSource eventStreamSource,
            LeaderboardCalculator calculator,
            ConnectionHub hub,
            LeaderboardUpdateEncoder encoder,
            ObjectMapper objectMapper,
            @Value("${leaderboard.events.types:score.submitted,submission.created,score.updated,submission.updated}")
            String[] eventTypes,
            @Value("${leaderboard.events.competition-id-field:hackathon_id}") String competitionIdField,
            @Value("${leaderboard.events.retry-delay-ms:5000}") long retryDelayMillis,
            @Value("${leaderboard.events.dedup-window:1024}") int dedupWindow) {
        this.eventStreamSource = eventStreamSource;
        this.calculator = calculator;
        this.hub = hub;
        this.encoder = encoder;
        this.objectMapper = objectMapper;
        this.eventTypes = Collections.unmodifiableList(Arrays.asList(eventTypes));
        this.competitionIdField = competitionIdField;
        this.retryDelay = Duration.ofMillis(retryDelayMillis);
        this.recentEventIds = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > dedupWindow;
            }
        };
    }

    /**
     * Runs {@link #subscribe()} on a background thread.
     */
    public void start() {
        if (cancelled.get() || !started.compareAndSet(false, true)) {
            return;
        }
        state = SubscriberState.CONNECTING;
        runner.execute(this::subscribe);
    }

    /**
     * Connect, stream, reconnect until cancelled. Blocks the calling thread.
     */
    public void subscribe() {
        while (!cancelled.get()) {
            try {
                streamOnce();
                if (!cancelled.get()) {
                    logger.info("Event stream closed by server");
                }
            } catch (IOException e) {
                if (!cancelled.get()) {
                    logger.warn("Subscription error: {}, retrying in {} ms", e.getMessage(), retryDelay.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                if (!cancelled.get()) {
                    logger.error("Unexpected subscription failure, retrying in {} ms", retryDelay.toMillis(), e);
                }
            } finally {
                closeStream(activeStream.getAndSet(null));
            }

            if (cancelled.get()) {
                break;
            }
            state = SubscriberState.DISCONNECTED;
            if (awaitCancellation(retryDelay)) {
                break;
            }
        }
        state = SubscriberState.STOPPED;
        logger.info("Event subscription cancelled");
    }

    /**
     * Stops the loop before its next reconnect and aborts the stream being read.
     */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        cancelSignal.countDown();
        closeStream(activeStream.getAndSet(null));
        runner.shutdownNow();
        try {
            if (!runner.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Event subscriber did not stop within 5 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        state = SubscriberState.STOPPED;
    }

    public SubscriberState getState() {
        return state;
    }

    public List<String> getEventTypes() {
        return eventTypes;
    }

    String getLastEventId() {
        return lastEventId;
    }

    private void streamOnce() throws IOException, InterruptedException {
        state = SubscriberState.CONNECTING;
        logger.info("Connecting to event stream");
        InputStream stream = eventStreamSource.open(eventTypes, lastEventId);
        activeStream.set(stream);
        if (cancelled.get()) {
            return;
        }

        state = SubscriberState.STREAMING;
        logger.info("Connected to event stream, listening for: {}", eventTypes);

        BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8));
        SseFrameReader frames = new SseFrameReader(reader);
        SseFrame frame;
        while (!cancelled.get() && (frame = frames.next()) != null) {
            handleFrame(frame);
        }
    }

    void handleFrame(SseFrame frame) {
        DomainEvent event;
        String competitionId;
        try {
            event = decode(frame.getData());
            String eventId = event.getId() != null ? event.getId() : frame.getId();
            if (eventId != null) {
                if (recentEventIds.putIfAbsent(eventId, Boolean.TRUE) != null) {
                    logger.debug("Skipping already processed event {}", eventId);
                    return;
                }
                if (isValidResumeId(eventId)) {
                    lastEventId = eventId;
                } else {
                    logger.warn("Event id {} cannot be sent as Last-Event-ID, not recording it", eventId);
                }
            }
            logger.info("Received event: type={}, id={}", event.getType(), eventId);
            competitionId = extractCompetitionId(event);
        } catch (MalformedEventException e) {
            logger.warn("Dropping event frame: {}", e.getMessage());
            return;
        }

        try {
            switch (event.getType()) {
                case SCORE_SUBMITTED:
                case SCORE_UPDATED:
                    handleScoreChanged(competitionId);
                    break;
                case SUBMISSION_CREATED:
                case SUBMISSION_UPDATED:
                    handleSubmissionChanged(competitionId);
                    break;
                default:
                    logger.warn("Unknown event type: {}", event.getType());
                    break;
            }
        } catch (RuntimeException e) {
            logger.error("Unexpected error handling event {} for competition {}", event.getId(), competitionId, e);
        }
    }

    private DomainEvent decode(String data) {
        DomainEvent event;
        try {
            event = objectMapper.readValue(data, DomainEvent.class);
        } catch (JsonProcessingException e) {
            throw new MalformedEventException("Error parsing event: " + e.getOriginalMessage(), e);
        }
        if (event == null || event.getType() == null || event.getType().isBlank()) {
            throw new MalformedEventException("Event has no event_type: " + data);
        }
        return event;
    }

    private String extractCompetitionId(DomainEvent event) {
        Object value = event.getData() == null ? null : event.getData().get(competitionIdField);
        if (!(value instanceof String) || ((String) value).isBlank()) {
            throw new MalformedEventException("Event " + event.getId() + " missing " + competitionIdField
                + ": " + event.getData());
        }
        return (String) value;
    }

    private void handleScoreChanged(String competitionId) {
        logger.info("Processing score change for competition {}", competitionId);
        refreshAndBroadcast(competitionId);
    }

    private void handleSubmissionChanged(String competitionId) {
        logger.info("Processing submission change for competition {}", competitionId);
        refreshAndBroadcast(competitionId);
    }

    private void refreshAndBroadcast(String competitionId) {
        calculator.invalidateCache(competitionId);

        List<LeaderboardEntry> rankings;
        String payload;
        try {
            rankings = calculator.calculateLeaderboard(competitionId);
            payload = encoder.encode(rankings);
        } catch (LeaderboardException e) {
            logger.error("Error calculating leaderboard for competition {}: {}", competitionId, e.getMessage());
            return;
        }

        logger.info("Broadcasting leaderboard update to {} clients for competition {}",
            hub.getClientCount(competitionId), competitionId);
        hub.broadcast(competitionId, payload);
    }

    // Header values cannot carry CR, LF or other control characters
    static boolean isValidResumeId(String eventId) {
        if (eventId.isEmpty()) {
            return false;
        }
        for (int i = 0; i < eventId.length(); i++) {
            char c = eventId.charAt(i);
            if (c < 0x20 || c == 0x7f) {
                return false;
            }
        }
        return true;
    }

    private boolean awaitCancellation(Duration delay) {
        try {
            return cancelSignal.await(delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    private void closeStream(InputStream stream) {
        if (stream == null) {
            return;
        }
        try {
            stream.close();
        } catch (IOException e) {
            logger.debug("Error closing event stream: {}", e.getMessage());
        }
    }
}
