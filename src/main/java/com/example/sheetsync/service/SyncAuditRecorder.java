package com.example.sheetsync.service;

import com.example.sheetsync.model.SyncAuditEntry;
import com.example.sheetsync.model.SyncEvent;
import com.example.sheetsync.repo.SyncAuditRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Writes committed events to the {@code sync_audit} collection off the broadcast path.
 */
@Service
public class SyncAuditRecorder {

    private static final Logger logger = LoggerFactory.getLogger(SyncAuditRecorder.class);

    private final SyncAuditRepo auditRepo;
    private final ExecutorService writer;

    @Value("${app.audit.enabled:false}")
    private boolean enabled;

    public SyncAuditRecorder(SyncAuditRepo auditRepo) {
        this.auditRepo = auditRepo;
        this.writer = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "sync-audit-writer");
            t.setDaemon(true);
            return t;
        });
    }

    public void record(SyncEvent event) {
        if (!enabled) return;
        SyncAuditEntry entry = toEntry(event);
        try {
            writer.execute(() -> {
                try {
                    auditRepo.save(entry);
                } catch (Exception e) {
                    logger.warn("Failed to write audit entry for event {}: {}", entry.getEventId(), e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            logger.warn("Audit writer is shut down, event {} not recorded", entry.getEventId());
        }
    }

    public List<SyncAuditEntry> history(String table, String recordId) {
        return auditRepo.findTop50ByTableAndRecordIdOrderByTsDesc(table, recordId);
    }

    public boolean isEnabled() {
        return enabled;
    }

    @PreDestroy
    public void shutdown() {
        writer.shutdown();
    }

    static SyncAuditEntry toEntry(SyncEvent event) {
        return SyncAuditEntry.builder()
                .eventId(event.getId())
                .table(event.getTable())
                .operation(event.getOperation().wireName())
                .recordId(event.getRecordId())
                .userId(event.getUserId())
                .userName(event.getUserName())
                .sessionId(event.getSessionId())
                .ts(event.getTimestamp())
                .version(event.getVersion())
                .changedFields(changedFields(event.getData(), event.getPreviousData()))
                .build();
    }

    /**
     * Fields whose value differs between the two versions, in record order.
     */
    static List<String> changedFields(Map<String, Object> data, Map<String, Object> previous) {
        Set<String> changed = new LinkedHashSet<>();
        if (data != null) {
            data.forEach((field, value) -> {
                if (previous == null || !Objects.equals(previous.get(field), value)) changed.add(field);
            });
        }
        if (previous != null && data != null) {
            previous.keySet().stream().filter(f -> !data.containsKey(f)).forEach(changed::add);
        }
        return new ArrayList<>(changed);
    }
}
