package com.hackathon.leaderboard.websocket;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LiveConnectionTest {

    @Test
    void testOffer_RejectsWhenBufferFull() {
        LiveConnection connection = new LiveConnection("c1", "H1", 2);

        assertTrue(connection.offer("one"));
        assertTrue(connection.offer("two"));
        assertFalse(connection.offer("three"));
        assertEquals(2, connection.pendingMessages());
    }

    @Test
    void testClose_DrainsBufferedMessagesThenEnds() throws InterruptedException {
        // Arrange
        LiveConnection connection = new LiveConnection("c1", "H1", 4);
        connection.offer("one");
        connection.offer("two");

        // Act
        assertTrue(connection.close());

        // Assert
        assertEquals("one", connection.nextMessage(10));
        assertEquals("two", connection.nextMessage(10));
        assertNull(connection.nextMessage(10));
    }

    @Test
    void testClose_IsIdempotentAndRejectsFurtherOffers() {
        LiveConnection connection = new LiveConnection("c1", "H1", 4);

        assertTrue(connection.close());
        assertFalse(connection.close());
        assertTrue(connection.isClosed());
        assertFalse(connection.offer("late"));
    }
}
