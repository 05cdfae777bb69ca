package com.hackathon.leaderboard.websocket;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One live subscriber: the competition it watches plus a bounded outbound buffer.
 * The hub offers into the buffer, a single writer drains it.
 */
public class LiveConnection {

    private final String id;
    private final String competitionId;
    private final BlockingQueue<String> sendBuffer;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public LiveConnection(String id, String competitionId, int sendBufferSize) {
        this.id = id;
        this.competitionId = competitionId;
        this.sendBuffer = new ArrayBlockingQueue<>(sendBufferSize);
    }

    public String getId() {
        return id;
    }

    public String getCompetitionId() {
        return competitionId;
    }

    /**
     * Non-blocking enqueue.
     *
     * @return false when the buffer is full or the connection is closed
     */
    public boolean offer(String payload) {
        if (closed.get()) {
            return false;
        }
        return sendBuffer.offer(payload);
    }

    /**
     * Marks the buffer closed. Messages already buffered are still handed to the writer.
     *
     * @return true on the first call only
     */
    public boolean close() {
        return closed.compareAndSet(false, true);
    }

    public boolean isClosed() {
        return closed.get();
    }

    public int pendingMessages() {
        return sendBuffer.size();
    }

    /**
     * Blocks until a message is available. Returns null once the connection is closed and drained.
     */
    public String nextMessage(long pollMillis) throws InterruptedException {
        while (true) {
            String message = sendBuffer.poll(pollMillis, TimeUnit.MILLISECONDS);
            if (message != null) {
                return message;
            }
            if (closed.get() && sendBuffer.isEmpty()) {
                return null;
            }
        }
    }

    @Override
    public String toString() {
        return "LiveConnection{id=" + id + ", competitionId=" + competitionId + "}";
    }
}
