package com.hackathon.leaderboard;

import com.hackathon.leaderboard.events.EventSubscriber;
import com.hackathon.leaderboard.websocket.ConnectionHub;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LiveLeaderboardServerTest {

    @Mock
    private ConnectionHub hub;

    @Mock
    private EventSubscriber subscriber;

    @InjectMocks
    private LiveLeaderboardServer server;

    @Test
    void testStart_StartsHubBeforeSubscriber() {
        when(subscriber.getEventTypes()).thenReturn(List.of("score.submitted"));

        server.start();

        InOrder order = inOrder(hub, subscriber);
        order.verify(hub).start();
        order.verify(subscriber).start();
        assertTrue(server.isRunning());
    }

    @Test
    void testStop_CancelsSubscriberWithoutClosingHub() {
        when(subscriber.getEventTypes()).thenReturn(List.of("score.submitted"));
        server.start();

        server.stop();

        verify(subscriber).cancel();
        verify(hub, never()).shutdown();
        assertFalse(server.isRunning());
    }

    @Test
    void testShutdownHub_ClosesConnections() {
        server.shutdownHub();

        verify(hub).shutdown();
    }

    @Test
    void testStopsInFirstPhase() {
        assertEquals(Integer.MAX_VALUE, server.getPhase());
        assertTrue(server.isAutoStartup());
    }
}
