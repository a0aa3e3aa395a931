package com.example.sheetsync.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A write committed outside this service, published so that connected clients hear about it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BroadcastRequest {
    private String table;
    private SyncOperation operation;
    private String recordId;
    private Map<String, Object> data;
    private Map<String, Object> previousData;
    private Integer version;
    private String sessionId;
}
