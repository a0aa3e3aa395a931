package com.example.sheetsync.sync;

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionChannelTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @Test
    void testOffer_QueuedMessagesAreDeliveredInOrder() {
        // Given
        ConnectionChannel channel = new ConnectionChannel("conn_1", 8, () -> fail("no overflow expected"));

        // When
        assertTrue(channel.offer(heartbeat(1)));
        assertTrue(channel.offer(heartbeat(2)));
        channel.close();

        // Then
        StepVerifier.create(channel.asFlux())
                .assertNext(m -> assertEquals(1, ((Map<?, ?>) m.getPayload()).get("n")))
                .assertNext(m -> assertEquals(2, ((Map<?, ?>) m.getPayload()).get("n")))
                .verifyComplete();
    }

    @Test
    void testOffer_FullChannelDisconnects() {
        // Given
        AtomicInteger overflows = new AtomicInteger();
        ConnectionChannel channel = new ConnectionChannel("conn_1", 8, overflows::incrementAndGet);
        for (int i = 0; i < 8; i++) {
            assertTrue(channel.offer(heartbeat(i)));
        }

        // When
        boolean accepted = channel.offer(heartbeat(8));

        // Then
        assertFalse(accepted);
        assertTrue(channel.isClosed());
        assertEquals(1, overflows.get());
        assertFalse(channel.offer(heartbeat(9)));
        assertEquals(1, overflows.get());
        StepVerifier.create(channel.asFlux())
                .expectNextCount(8)
                .verifyComplete();
    }

    @Test
    void testOffer_ClosedChannelRefusesWithoutOverflow() {
        // Given
        AtomicInteger overflows = new AtomicInteger();
        ConnectionChannel channel = new ConnectionChannel("conn_1", 8, overflows::incrementAndGet);
        channel.close();

        // When
        boolean accepted = channel.offer(heartbeat(1));

        // Then
        assertFalse(accepted);
        assertEquals(0, overflows.get());
    }

    private static ChannelMessage heartbeat(int n) {
        return ChannelMessage.heartbeat(Map.of("n", n), NOW);
    }
}
