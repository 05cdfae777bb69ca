package com.hackathon.leaderboard.websocket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Registry of live subscribers grouped by competition.
 *
 * <p>All mutation happens on one control-loop thread fed by a bounded command queue.
 * Diagnostic reads take the read side of a lock the loop holds while mutating.
 * Broadcast never blocks on a subscriber: a connection whose buffer is full is dropped.
 */
@Component
public class ConnectionHub {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionHub.class);
    private static final long ENQUEUE_TIMEOUT_MILLIS = 1000;

    private final Map<String, Set<LiveConnection>> clients = new HashMap<>();
    private final ReentrantReadWriteLock clientsLock = new ReentrantReadWriteLock();
    private final BlockingQueue<HubCommand> commands;
    private final ExecutorService controlLoop =
        Executors.newSingleThreadExecutor(new CustomizableThreadFactory("connection-hub-"));
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public ConnectionHub(@Value("${leaderboard.hub.command-queue-size:256}") int commandQueueSize) {
        this.commands = new ArrayBlockingQueue<>(commandQueueSize);
    }

    /**
     * Starts the control loop. Commands submitted earlier are processed once it runs.
     */
    public void start() {
        if (shutdown.get() || !started.compareAndSet(false, true)) {
            return;
        }
        controlLoop.execute(this::run);
        logger.info("Connection hub started");
    }

    public void register(LiveConnection connection) {
        if (!submit(new HubCommand(CommandType.REGISTER, connection, null, null))) {
            connection.close();
        }
    }

    public void unregister(LiveConnection connection) {
        if (!submit(new HubCommand(CommandType.UNREGISTER, connection, null, null))) {
            // Stale entry is pruned by the next broadcast, which cannot offer to a closed connection
            connection.close();
        }
    }

    public void broadcast(String competitionId, String payload) {
        if (shutdown.get()) {
            logger.debug("Hub is shut down, ignoring broadcast for competition {}", competitionId);
            return;
        }
        if (!commands.offer(new HubCommand(CommandType.BROADCAST, null, competitionId, payload))) {
            logger.warn("Broadcast queue full, dropping message for competition {}", competitionId);
        }
    }

    public int getClientCount(String competitionId) {
        clientsLock.readLock().lock();
        try {
            Set<LiveConnection> connections = clients.get(competitionId);
            return connections == null ? 0 : connections.size();
        } finally {
            clientsLock.readLock().unlock();
        }
    }

    public int getTotalClientCount() {
        clientsLock.readLock().lock();
        try {
            int total = 0;
            for (Set<LiveConnection> connections : clients.values()) {
                total += connections.size();
            }
            return total;
        } finally {
            clientsLock.readLock().unlock();
        }
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    /**
     * Stops the control loop and closes every registered connection. Idempotent.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        logger.info("Hub shutting down");
        controlLoop.shutdownNow();
        if (!started.get()) {
            closeAll();
            return;
        }
        try {
            if (!controlLoop.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Hub control loop did not stop within 5 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private boolean submit(HubCommand command) {
        if (shutdown.get()) {
            logger.debug("Hub is shut down, ignoring {} for {}", command.type, command.connection);
            return false;
        }
        try {
            if (commands.offer(command, ENQUEUE_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
                return true;
            }
            logger.warn("Hub command queue full, could not {} {}", command.type, command.connection);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return false;
    }

    private void run() {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                HubCommand command = commands.take();
                switch (command.type) {
                    case REGISTER:
                        handleRegister(command.connection);
                        break;
                    case UNREGISTER:
                        handleUnregister(command.connection);
                        break;
                    case BROADCAST:
                        handleBroadcast(command.competitionId, command.payload);
                        break;
                    default:
                        break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            logger.error("Hub control loop failed", e);
        } finally {
            closeAll();
            logger.info("Hub stopped");
        }
    }

    private void handleRegister(LiveConnection connection) {
        int total;
        clientsLock.writeLock().lock();
        try {
            Set<LiveConnection> connections =
                clients.computeIfAbsent(connection.getCompetitionId(), id -> new LinkedHashSet<>());
            connections.add(connection);
            total = connections.size();
        } finally {
            clientsLock.writeLock().unlock();
        }
        logger.info("Client registered for competition {} (total: {})", connection.getCompetitionId(), total);
    }

    private void handleUnregister(LiveConnection connection) {
        String competitionId = connection.getCompetitionId();
        clientsLock.writeLock().lock();
        try {
            Set<LiveConnection> connections = clients.get(competitionId);
            if (connections != null && connections.remove(connection)) {
                connection.close();
                logger.info("Client unregistered for competition {} (remaining: {})",
                    competitionId, connections.size());
                if (connections.isEmpty()) {
                    clients.remove(competitionId);
                }
            }
        } finally {
            clientsLock.writeLock().unlock();
        }
    }

    private void handleBroadcast(String competitionId, String payload) {
        clientsLock.writeLock().lock();
        try {
            Set<LiveConnection> connections = clients.get(competitionId);
            if (connections == null) {
                return;
            }
            List<LiveConnection> dropped = new ArrayList<>();
            for (LiveConnection connection : connections) {
                if (!connection.offer(payload)) {
                    dropped.add(connection);
                }
            }
            for (LiveConnection connection : dropped) {
                connections.remove(connection);
                connection.close();
                logger.warn("Client send buffer full, disconnecting {}", connection);
            }
            if (connections.isEmpty()) {
                clients.remove(competitionId);
            }
        } finally {
            clientsLock.writeLock().unlock();
        }
    }

    private void closeAll() {
        clientsLock.writeLock().lock();
        try {
            for (Set<LiveConnection> connections : clients.values()) {
                connections.forEach(LiveConnection::close);
            }
            clients.clear();
        } finally {
            clientsLock.writeLock().unlock();
        }
    }

    private enum CommandType {
        REGISTER,
        UNREGISTER,
        BROADCAST
    }

    private static final class HubCommand {
        private final CommandType type;
        private final LiveConnection connection;
        private final String competitionId;
        private final String payload;

        private HubCommand(CommandType type, LiveConnection connection, String competitionId, String payload) {
            this.type = type;
            this.connection = connection;
            this.competitionId = competitionId;
            this.payload = payload;
        }
    }
}
