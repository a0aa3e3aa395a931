package com.example.sheetsync.mcp;

import com.example.sheetsync.model.Conflict;
import com.example.sheetsync.model.ResolutionStrategy;
import com.example.sheetsync.model.SyncAuditEntry;
import com.example.sheetsync.service.SyncAuditRecorder;
import com.example.sheetsync.sync.SyncBroadcaster;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class SyncTools {

    private final SyncBroadcaster broadcaster;
    private final SyncAuditRecorder auditRecorder;

    public SyncTools(SyncBroadcaster broadcaster, SyncAuditRecorder auditRecorder) {
        this.broadcaster = broadcaster;
        this.auditRecorder = auditRecorder;
    }

    @Tool(description = "Get live connection, event buffer, conflict and notification statistics")
    public Map<String, Object> sync_stats() {
        return broadcaster.stats();
    }

    @Tool(description = "List open edit conflicts, optionally filtered by table and record id")
    public List<Conflict> conflicts_list(String table, String recordId) {
        return broadcaster.openConflicts(table, recordId);
    }

    @Tool(description = "Resolve a conflict with accept_current, accept_incoming or merge (merge needs mergedData)")
    public Map<String, Object> conflict_resolve(String conflictId, String strategy, Map<String, Object> mergedData,
                                                String resolvedBy) {
        Map<String, Object> result = new HashMap<>();
        try {
            Optional<Conflict> resolved = broadcaster.resolveConflict(conflictId, ResolutionStrategy.parse(strategy),
                    mergedData, resolvedBy);
            result.put("ok", resolved.isPresent());
            resolved.ifPresentOrElse(c -> result.put("conflict", c),
                    () -> result.put("message", "Unknown conflict " + conflictId));
        } catch (IllegalArgumentException e) {
            result.put("ok", false);
            result.put("message", e.getMessage());
        }
        return result;
    }

    @Tool(description = "Get the latest audited writes of a record (requires app.audit.enabled)")
    public Map<String, Object> sync_audit_trail(String table, String recordId) {
        Map<String, Object> result = new HashMap<>();
        if (!auditRecorder.isEnabled()) {
            result.put("ok", false);
            result.put("message", "Audit trail is disabled");
            return result;
        }
        List<SyncAuditEntry> entries = auditRecorder.history(table, recordId);
        result.put("ok", true);
        result.put("entries", entries);
        return result;
    }
}
