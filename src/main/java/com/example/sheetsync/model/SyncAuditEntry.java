package com.example.sheetsync.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("sync_audit")
public class SyncAuditEntry {
    @Id
    private String eventId;
    private String table;
    private String operation;
    private String recordId;
    private String userId;
    private String userName;
    private String sessionId;
    private Instant ts;
    private Integer version;
    private List<String> changedFields;
}
