package com.hackathon.leaderboard;

import com.hackathon.leaderboard.events.EventSubscriber;
import com.hackathon.leaderboard.websocket.ConnectionHub;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Starts the hub loop and the event subscriber once the context is up.
 *
 * <p>Shutdown order: the subscriber is cancelled in the first lifecycle phase to stop,
 * the web server then stops accepting upgrades, and the hub closes every remaining
 * connection when the bean is destroyed.
 */
@Component
public class LiveLeaderboardServer implements SmartLifecycle {

    private static final Logger logger = LoggerFactory.getLogger(LiveLeaderboardServer.class);

    private final ConnectionHub hub;
    private final EventSubscriber subscriber;
    private volatile boolean running;

    public LiveLeaderboardServer(ConnectionHub hub, EventSubscriber subscriber) {
        this.hub = hub;
        this.subscriber = subscriber;
    }

    @Override
    public void start() {
        hub.start();
        subscriber.start();
        running = true;
        logger.info("Live leaderboard started, subscribed to {}", subscriber.getEventTypes());
    }

    @Override
    public void stop() {
        logger.info("Shutting down event subscription");
        subscriber.cancel();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @PreDestroy
    public void shutdownHub() {
        hub.shutdown();
        logger.info("Server stopped");
    }
}
