package com.example.sheetsync.sync;

import com.example.sheetsync.MutableClock;
import com.example.sheetsync.config.SyncSettings;
import com.example.sheetsync.model.SessionIdentity;
import com.example.sheetsync.model.Subscription;
import com.example.sheetsync.model.SyncEvent;
import com.example.sheetsync.model.SyncOperation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionRegistryTest {

    private MutableClock clock;
    private ConnectionRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
        registry = new ConnectionRegistry(SyncSettings.builder()
                .heartbeatTimeout(Duration.ofSeconds(60))
                .removalTimeout(Duration.ofMinutes(5))
                .channelCapacity(8)
                .build(), clock);
    }

    @Test
    void testMatching_FiltersByTableAndOperation() {
        // Given
        Connection materials = registry.add(identity("u1", "s1"), List.of(Subscription.builder()
                .tables(Set.of("materiales")).build()));
        Connection deletes = registry.add(identity("u2", "s2"), List.of(Subscription.builder()
                .operations(Set.of(SyncOperation.DELETE)).build()));
        Connection everything = registry.add(identity("u3", "s3"), List.of());

        // When
        List<Connection> matched = registry.matching(event("Materiales", SyncOperation.UPDATE));

        // Then
        assertTrue(matched.contains(materials));
        assertFalse(matched.contains(deletes));
        assertTrue(matched.contains(everything));
    }

    @Test
    void testMatching_ProjectFilterUsesPreviousDataOnDelete() {
        // Given
        Connection project = registry.add(identity("u1", "s1"), List.of(Subscription.builder()
                .projectId("P1").build()));
        SyncEvent delete = SyncEvent.builder()
                .id("event_1").table("Actividades").operation(SyncOperation.DELETE).recordId("A1")
                .previousData(Map.of("proyecto_id", "P1"))
                .timestamp(clock.instant())
                .build();

        // When
        List<Connection> matched = registry.matching(delete);

        // Then
        assertEquals(List.of(project), matched);
    }

    @Test
    void testHeartbeat_KeepsConnectionLive() {
        // Given
        Connection connection = registry.add(identity("u1", "s1"), List.of());
        clock.advance(Duration.ofSeconds(50));
        assertTrue(registry.heartbeat(connection.getId()));

        // When
        clock.advance(Duration.ofSeconds(50));

        // Then
        assertEquals(1, registry.matching(event("Proyectos", SyncOperation.UPDATE)).size());
        assertFalse(registry.heartbeat("conn_missing"));
    }

    @Test
    void testReapStale_MarksThenRemovesSilentConnections() {
        // Given
        Connection connection = registry.add(identity("u1", "s1"), List.of());

        // When
        clock.advance(Duration.ofSeconds(90));
        int removedEarly = registry.reapStale();

        // Then
        assertEquals(0, removedEarly);
        assertFalse(connection.isConnected());
        assertTrue(registry.matching(event("Proyectos", SyncOperation.UPDATE)).isEmpty());
        assertTrue(registry.find(connection.getId()).isPresent());

        // When
        clock.advance(Duration.ofMinutes(5));
        int removed = registry.reapStale();

        // Then
        assertEquals(1, removed);
        assertTrue(registry.find(connection.getId()).isEmpty());
        assertTrue(connection.getChannel().isClosed());
    }

    @Test
    void testHeartbeat_RevivesMarkedConnection() {
        // Given
        Connection connection = registry.add(identity("u1", "s1"), List.of());
        clock.advance(Duration.ofSeconds(90));
        registry.reapStale();

        // When
        registry.heartbeat(connection.getId());

        // Then
        assertTrue(connection.isConnected());
        assertEquals(1, registry.matching(event("Proyectos", SyncOperation.UPDATE)).size());
    }

    @Test
    void testChannelOverflow_RemovesConnection() {
        // Given
        Connection connection = registry.add(identity("u1", "s1"), List.of());

        // When
        for (int i = 0; i < 9; i++) {
            connection.getChannel().offer(ChannelMessage.syncEvent(event("Proyectos", SyncOperation.UPDATE)));
        }

        // Then
        assertTrue(registry.find(connection.getId()).isEmpty());
        assertFalse(connection.isConnected());
    }

    @Test
    void testConnectionsForUsers_OnlyLiveConnectionsOfTargets() {
        // Given
        Connection first = registry.add(identity("u1", "s1"), List.of());
        Connection second = registry.add(identity("u1", "s2"), List.of());
        registry.add(identity("u2", "s3"), List.of());
        registry.remove(second.getId());

        // When
        List<Connection> found = registry.connectionsForUsers(List.of("u1", "u9"));

        // Then
        assertEquals(List.of(first), found);
        assertTrue(registry.connectionsForUsers(List.of()).isEmpty());
    }

    @Test
    void testStats_CountsByUser() {
        // Given
        registry.add(identity("u1", "s1"), List.of());
        registry.add(identity("u1", "s2"), List.of());
        registry.add(identity("u2", "s3"), List.of());

        // When
        Map<String, Object> stats = registry.stats();

        // Then
        assertEquals(3, stats.get("totalConnections"));
        assertEquals(3, stats.get("activeConnections"));
        assertEquals(Map.of("u1", 2L, "u2", 1L), stats.get("connectionsByUser"));
    }

    @Test
    void testUpdateSubscriptions_ReplacesFilters() {
        // Given
        Connection connection = registry.add(identity("u1", "s1"), List.of(Subscription.builder()
                .tables(Set.of("Proyectos")).build()));

        // When
        boolean updated = registry.updateSubscriptions(connection.getId(), List.of(Subscription.builder()
                .tables(Set.of("Materiales")).build()));

        // Then
        assertTrue(updated);
        assertTrue(registry.matching(event("Proyectos", SyncOperation.UPDATE)).isEmpty());
        assertEquals(1, registry.matching(event("Materiales", SyncOperation.UPDATE)).size());
        assertFalse(registry.updateSubscriptions("conn_missing", List.of()));
    }

    private SyncEvent event(String table, SyncOperation operation) {
        return SyncEvent.builder()
                .id("event_" + table)
                .table(table)
                .operation(operation)
                .recordId("R1")
                .data(Map.of("id", "R1"))
                .timestamp(clock.instant())
                .build();
    }

    private static SessionIdentity identity(String userId, String sessionId) {
        return new SessionIdentity(userId, userId + "-name", sessionId);
    }
}
