package com.example.sheetsync.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class SyncEvent {
    String id;
    String table;
    SyncOperation operation;
    String recordId;
    Map<String, Object> data;
    Map<String, Object> previousData;
    Instant timestamp;
    String userId;
    String userName;
    String sessionId;
    Integer version;

    public Object field(String name) {
        return data == null ? null : data.get(name);
    }

    public Object previousField(String name) {
        return previousData == null ? null : previousData.get(name);
    }

    public boolean isFor(SheetTable sheet) {
        return sheet.matches(table);
    }
}
