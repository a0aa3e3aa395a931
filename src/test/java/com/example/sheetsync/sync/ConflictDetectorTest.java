package com.example.sheetsync.sync;

import com.example.sheetsync.MutableClock;
import com.example.sheetsync.model.Conflict;
import com.example.sheetsync.model.ConflictStatus;
import com.example.sheetsync.model.ResolutionStrategy;
import com.example.sheetsync.model.SyncEvent;
import com.example.sheetsync.model.SyncOperation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConflictDetectorTest {

    private MutableClock clock;
    private ConflictDetector detector;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
        detector = new ConflictDetector(Duration.ofSeconds(5), 10, clock);
    }

    @Test
    void testObserve_TwoSessionsInsideWindowConflict() {
        // Given
        assertTrue(detector.observe(update("e1", "s1", Map.of("estado", "Activo"))).isEmpty());
        clock.advance(Duration.ofSeconds(2));

        // When
        Optional<ConflictUpdate> update = detector.observe(update("e2", "s2", Map.of("estado", "Cerrado")));

        // Then
        assertTrue(update.isPresent());
        assertEquals(ConflictUpdate.Type.CREATED, update.get().getType());
        Conflict conflict = update.get().getConflict();
        assertEquals("Proyectos", conflict.getTable());
        assertEquals("P1", conflict.getRecordId());
        assertEquals(2, conflict.getEvents().size());
        assertEquals(Set.of("estado"), conflict.getConflictingFields());
        assertEquals(1, detector.openConflicts("proyectos", "P1").size());
    }

    @Test
    void testObserve_OverlappingEditAttachesToOpenConflict() {
        // Given
        detector.observe(update("e1", "s1", Map.of("estado", "Activo")));
        Conflict conflict = detector.observe(update("e2", "s2", Map.of("estado", "Cerrado"))).get().getConflict();
        clock.advance(Duration.ofSeconds(2));

        // When
        Optional<ConflictUpdate> update = detector.observe(update("e3", "s3", Map.of("estado", "Pausado")));

        // Then
        assertEquals(ConflictUpdate.Type.ATTACHED, update.get().getType());
        assertSame(conflict, update.get().getConflict());
        assertEquals(3, conflict.getEvents().size());
        assertEquals(1, detector.openConflicts(null, null).size());
    }

    @Test
    void testObserve_LaterEditOutsideWindowLeavesConflictAlone() {
        // Given
        detector.observe(update("e1", "s1", Map.of("estado", "Activo")));
        clock.advance(Duration.ofSeconds(2));
        Conflict conflict = detector.observe(update("e2", "s2", Map.of("estado", "Cerrado"))).get().getConflict();
        clock.advance(Duration.ofHours(3));

        // When
        Optional<ConflictUpdate> update = detector.observe(update("e3", "s1", Map.of("estado", "Pausado")));

        // Then
        assertTrue(update.isEmpty());
        assertEquals(2, conflict.getEvents().size());
        assertTrue(conflict.isOpen());
        assertEquals(1, detector.openConflicts("Proyectos", "P1").size());
    }

    @Test
    void testObserve_SameSessionAsLatestDoesNotAttach() {
        // Given
        detector.observe(update("e1", "s1", Map.of("estado", "Activo")));
        Conflict conflict = detector.observe(update("e2", "s2", Map.of("estado", "Cerrado"))).get().getConflict();
        clock.advance(Duration.ofSeconds(1));

        // When
        Optional<ConflictUpdate> update = detector.observe(update("e3", "s2", Map.of("estado", "Pausado")));

        // Then
        assertTrue(update.isEmpty());
        assertEquals(2, conflict.getEvents().size());
    }

    @Test
    void testResolve_OlderConflictDoesNotHideNewerOne() {
        // Given
        detector.observe(update("e1", "s1", Map.of("estado", "Activo")));
        Conflict older = detector.observe(update("e2", "s2", Map.of("estado", "Cerrado"))).get().getConflict();
        clock.advance(Duration.ofHours(1));
        detector.observe(update("e3", "s1", Map.of("estado", "Pausado")));
        clock.advance(Duration.ofSeconds(1));
        Conflict newer = detector.observe(update("e4", "s3", Map.of("estado", "Activo"))).get().getConflict();

        // When
        detector.resolve(older.getId(), ResolutionStrategy.ACCEPT_CURRENT, null, "u9");
        clock.advance(Duration.ofSeconds(1));
        Optional<ConflictUpdate> update = detector.observe(update("e5", "s1", Map.of("estado", "Cerrado")));

        // Then
        assertNotSame(older, newer);
        assertEquals(ConflictUpdate.Type.ATTACHED, update.get().getType());
        assertSame(newer, update.get().getConflict());
        assertEquals(1, detector.openConflicts(null, null).size());
    }

    @Test
    void testObserve_SameSessionNeverConflicts() {
        // Given
        detector.observe(update("e1", "s1", Map.of("estado", "Activo")));

        // When
        Optional<ConflictUpdate> update = detector.observe(update("e2", "s1", Map.of("estado", "Cerrado")));

        // Then
        assertTrue(update.isEmpty());
        assertTrue(detector.openConflicts(null, null).isEmpty());
    }

    @Test
    void testObserve_OutsideWindowDoesNotConflict() {
        // Given
        detector.observe(update("e1", "s1", Map.of("estado", "Activo")));
        clock.advance(Duration.ofSeconds(6));

        // When
        Optional<ConflictUpdate> update = detector.observe(update("e2", "s2", Map.of("estado", "Cerrado")));

        // Then
        assertTrue(update.isEmpty());
    }

    @Test
    void testObserve_CreatesAreIgnored() {
        // Given
        SyncEvent first = update("e1", "s1", Map.of()).toBuilder().operation(SyncOperation.CREATE).build();
        SyncEvent second = update("e2", "s2", Map.of()).toBuilder().operation(SyncOperation.CREATE).build();

        // When
        detector.observe(first);
        Optional<ConflictUpdate> update = detector.observe(second);

        // Then
        assertTrue(update.isEmpty());
    }

    @Test
    void testResolve_AcceptIncomingUsesLatestAndIsIdempotent() {
        // Given
        detector.observe(update("e1", "s1", Map.of("estado", "Activo")));
        Conflict conflict = detector.observe(update("e2", "s2", Map.of("estado", "Cerrado"))).get().getConflict();

        // When
        ConflictUpdate first = detector.resolve(conflict.getId(), ResolutionStrategy.ACCEPT_INCOMING, null, "u9").get();
        ConflictUpdate second = detector.resolve(conflict.getId(), ResolutionStrategy.ACCEPT_CURRENT, null, "u8").get();

        // Then
        assertEquals(ConflictUpdate.Type.RESOLVED, first.getType());
        assertEquals(ConflictUpdate.Type.ALREADY_RESOLVED, second.getType());
        assertEquals(ConflictStatus.RESOLVED, conflict.getStatus());
        assertEquals(ResolutionStrategy.ACCEPT_INCOMING, conflict.getResolution());
        assertEquals("Cerrado", conflict.getResolvedData().get("estado"));
        assertEquals("u9", conflict.getResolvedBy());
        assertTrue(detector.openConflicts(null, null).isEmpty());
        assertTrue(detector.find(conflict.getId()).isPresent());
    }

    @Test
    void testResolve_AfterResolutionRecordStartsClean() {
        // Given
        detector.observe(update("e1", "s1", Map.of("estado", "Activo")));
        Conflict conflict = detector.observe(update("e2", "s2", Map.of("estado", "Cerrado"))).get().getConflict();
        detector.resolve(conflict.getId(), ResolutionStrategy.ACCEPT_CURRENT, null, "u9");

        // When
        Optional<ConflictUpdate> update = detector.observe(update("e3", "s3", Map.of("estado", "Pausado")));

        // Then
        assertTrue(update.isEmpty());
        assertEquals("Activo", conflict.getResolvedData().get("estado"));
    }

    @Test
    void testResolve_MergeWithoutDataIsRejected() {
        // Given
        detector.observe(update("e1", "s1", Map.of("estado", "Activo")));
        Conflict conflict = detector.observe(update("e2", "s2", Map.of("estado", "Cerrado"))).get().getConflict();

        // When / Then
        assertThrows(IllegalArgumentException.class,
                () -> detector.resolve(conflict.getId(), ResolutionStrategy.MERGE, null, "u9"));
        assertTrue(conflict.isOpen());
        assertTrue(detector.resolve("conflict_missing", ResolutionStrategy.MERGE, Map.of(), "u9").isEmpty());
    }

    @Test
    void testPurgeIdle_ForgetsOldPendingEdits() {
        // Given
        detector.observe(update("e1", "s1", Map.of("estado", "Activo")));
        clock.advance(Duration.ofSeconds(10));

        // When
        int purged = detector.purgeIdle();

        // Then
        assertEquals(1, purged);
    }

    private SyncEvent update(String id, String sessionId, Map<String, Object> data) {
        return SyncEvent.builder()
                .id(id)
                .table("Proyectos")
                .operation(SyncOperation.UPDATE)
                .recordId("P1")
                .data(data)
                .timestamp(clock.instant())
                .userId("user-" + sessionId)
                .sessionId(sessionId)
                .build();
    }
}
