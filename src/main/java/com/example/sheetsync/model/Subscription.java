package com.example.sheetsync.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Objects;
import java.util.Set;

/**
 * Interest filter of a connection. Absent filters match everything.
 */
@Value
@Builder
@Jacksonized
public class Subscription {
    Set<String> tables;
    Set<SyncOperation> operations;
    String userId;
    String projectId;

    public static Subscription all() {
        return Subscription.builder().build();
    }

    public boolean matches(SyncEvent event) {
        if (tables != null && !tables.isEmpty()
                && tables.stream().noneMatch(t -> t.equalsIgnoreCase(event.getTable()))) {
            return false;
        }
        if (operations != null && !operations.isEmpty() && !operations.contains(event.getOperation())) {
            return false;
        }
        if (userId != null && !userId.equals(event.getUserId())) {
            return false;
        }
        if (projectId != null) {
            Object project = event.field("proyecto_id");
            if (project == null) project = event.previousField("proyecto_id");
            return projectId.equals(Objects.toString(project, null));
        }
        return true;
    }

    public boolean coversTable(String table) {
        return tables == null || tables.isEmpty() || tables.stream().anyMatch(t -> t.equalsIgnoreCase(table));
    }
}
