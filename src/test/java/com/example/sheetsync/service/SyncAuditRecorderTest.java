package com.example.sheetsync.service;

import com.example.sheetsync.model.SyncAuditEntry;
import com.example.sheetsync.model.SyncEvent;
import com.example.sheetsync.model.SyncOperation;
import com.example.sheetsync.repo.SyncAuditRepo;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SyncAuditRecorderTest {

    @Mock
    private SyncAuditRepo auditRepo;

    private SyncAuditRecorder recorder;

    @BeforeEach
    void setUp() {
        recorder = new SyncAuditRecorder(auditRepo);
    }

    @AfterEach
    void tearDown() {
        recorder.shutdown();
    }

    @Test
    void testRecord_DisabledWritesNothing() {
        // When
        recorder.record(event());

        // Then
        verifyNoInteractions(auditRepo);
    }

    @Test
    void testRecord_EnabledSavesEntryAsynchronously() {
        // Given
        ReflectionTestUtils.setField(recorder, "enabled", true);

        // When
        recorder.record(event());

        // Then
        ArgumentCaptor<SyncAuditEntry> captor = ArgumentCaptor.forClass(SyncAuditEntry.class);
        verify(auditRepo, timeout(2000)).save(captor.capture());
        SyncAuditEntry entry = captor.getValue();
        assertEquals("event_1", entry.getEventId());
        assertEquals("update", entry.getOperation());
        assertEquals(List.of("stock_actual"), entry.getChangedFields());
    }

    @Test
    void testRecord_RepositoryFailureIsContained() {
        // Given
        ReflectionTestUtils.setField(recorder, "enabled", true);
        when(auditRepo.save(any(SyncAuditEntry.class))).thenThrow(new RuntimeException("Database error"));

        // When
        recorder.record(event());
        recorder.record(event());

        // Then
        verify(auditRepo, timeout(2000).times(2)).save(any(SyncAuditEntry.class));
    }

    @Test
    void testChangedFields_IncludesRemovedFields() {
        // When
        List<String> changed = SyncAuditRecorder.changedFields(
                Map.of("a", 1, "b", 2),
                Map.of("a", 1, "c", 3));

        // Then
        assertTrue(changed.containsAll(List.of("b", "c")));
        assertEquals(2, changed.size());
        assertEquals(List.of(), SyncAuditRecorder.changedFields(null, Map.of("a", 1)));
    }

    private static SyncEvent event() {
        return SyncEvent.builder()
                .id("event_1")
                .table("Materiales")
                .operation(SyncOperation.UPDATE)
                .recordId("M1")
                .data(Map.of("id", "M1", "stock_actual", 8))
                .previousData(Map.of("id", "M1", "stock_actual", 15))
                .timestamp(Instant.parse("2025-03-01T10:00:00Z"))
                .userId("u1")
                .sessionId("s1")
                .build();
    }
}
