package com.hackathon.leaderboard.websocket;

import com.hackathon.leaderboard.exception.LeaderboardException;
import com.hackathon.leaderboard.model.LeaderboardEntry;
import com.hackathon.leaderboard.service.LeaderboardCalculator;
import com.hackathon.leaderboard.service.LeaderboardUpdateEncoder;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Binds each upgraded socket under {@code /ws/competitions/{id}} to a {@link LiveConnection}
 * registered with the hub. A dedicated writer task per socket drains the connection's buffer;
 * it is the only thread that writes to the session.
 */
@Component
public class LeaderboardWebSocketHandler extends TextWebSocketHandler {

    private static final Logger logger = LoggerFactory.getLogger(LeaderboardWebSocketHandler.class);

    static final String CONNECTION_ATTRIBUTE = "leaderboard.connection";
    private static final long WRITER_POLL_MILLIS = 500;

    private final ConnectionHub hub;
    private final LeaderboardCalculator calculator;
    private final LeaderboardUpdateEncoder encoder;
    private final int sendBufferSize;
    private final ExecutorService writers = Executors.newCachedThreadPool(new CustomizableThreadFactory("ws-writer-"));

    public LeaderboardWebSocketHandler(
            ConnectionHub hub,
            LeaderboardCalculator calculator,
            LeaderboardUpdateEncoder encoder,
            @Value("${leaderboard.hub.send-buffer-size:256}") int sendBufferSize) {
        this.hub = hub;
        this.calculator = calculator;
        this.encoder = encoder;
        this.sendBufferSize = sendBufferSize;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        String competitionId = competitionIdFrom(session.getUri());
        if (competitionId == null) {
            logger.warn("Rejecting WebSocket session {} without competition id: {}", session.getId(), session.getUri());
            session.close(CloseStatus.BAD_DATA.withReason("competition id required"));
            return;
        }

        LiveConnection connection = new LiveConnection(session.getId(), competitionId, sendBufferSize);
        session.getAttributes().put(CONNECTION_ATTRIBUTE, connection);

        // Snapshot is buffered before registration so it always precedes broadcasts
        queueSnapshot(connection);
        hub.register(connection);
        writers.execute(() -> writeLoop(session, connection));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        logger.debug("Ignoring inbound message on session {}", session.getId());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        logger.warn("Transport error on session {}: {}", session.getId(), exception.getMessage());
        unregister(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        logger.debug("Session {} closed with {}", session.getId(), status);
        unregister(session);
    }

    @PreDestroy
    public void stopWriters() {
        writers.shutdownNow();
    }

    void writeLoop(WebSocketSession session, LiveConnection connection) {
        try {
            String message;
            while ((message = connection.nextMessage(WRITER_POLL_MILLIS)) != null) {
                session.sendMessage(new TextMessage(message));
            }
            // Closed by the hub: slow consumer or shutdown
            if (session.isOpen()) {
                session.close(CloseStatus.GOING_AWAY);
            }
        } catch (IOException | IllegalStateException e) {
            logger.warn("Failed to write to session {}: {}", session.getId(), e.getMessage());
            hub.unregister(connection);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            hub.unregister(connection);
        }
    }

    private void queueSnapshot(LiveConnection connection) {
        try {
            List<LeaderboardEntry> rankings = calculator.calculateLeaderboard(connection.getCompetitionId());
            connection.offer(encoder.encode(rankings));
        } catch (LeaderboardException e) {
            logger.warn("Could not send initial leaderboard for competition {}: {}",
                connection.getCompetitionId(), e.getMessage());
        }
    }

    private void unregister(WebSocketSession session) {
        Object connection = session.getAttributes().get(CONNECTION_ATTRIBUTE);
        if (connection instanceof LiveConnection) {
            hub.unregister((LiveConnection) connection);
        }
    }

    static String competitionIdFrom(URI uri) {
        if (uri == null || uri.getPath() == null) {
            return null;
        }
        String path = uri.getPath();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        int slash = path.lastIndexOf('/');
        String segment = path.substring(slash + 1);
        if (segment.isBlank() || slash <= 0 || !isCompetitionRoute(path.substring(0, slash))) {
            return null;
        }
        return segment;
    }

    private static boolean isCompetitionRoute(String prefix) {
        return prefix.endsWith("/ws/competitions") || prefix.endsWith("/ws/hackathons");
    }
}
