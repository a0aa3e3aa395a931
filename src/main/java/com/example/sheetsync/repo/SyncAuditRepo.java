package com.example.sheetsync.repo;

import com.example.sheetsync.model.SyncAuditEntry;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface SyncAuditRepo extends MongoRepository<SyncAuditEntry, String> {
    List<SyncAuditEntry> findTop50ByTableAndRecordIdOrderByTsDesc(String table, String recordId);
}
