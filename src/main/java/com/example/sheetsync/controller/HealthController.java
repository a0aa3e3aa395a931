package com.example.sheetsync.controller;

import com.example.sheetsync.cache.CacheStore;
import com.example.sheetsync.repo.SyncAuditRepo;
import com.example.sheetsync.service.SyncAuditRecorder;
import com.example.sheetsync.sync.SyncBroadcaster;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final CacheStore cacheStore;
    private final SyncBroadcaster broadcaster;
    private final SyncAuditRecorder auditRecorder;
    private final SyncAuditRepo auditRepo;

    public HealthController(CacheStore cacheStore, SyncBroadcaster broadcaster, SyncAuditRecorder auditRecorder,
                            SyncAuditRepo auditRepo) {
        this.cacheStore = cacheStore;
        this.broadcaster = broadcaster;
        this.auditRecorder = auditRecorder;
        this.auditRepo = auditRepo;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "sheet-sync-gateway");
        health.put("version", "0.1.0");

        try {
            health.put("cache", cacheStore.stats());
        } catch (Exception e) {
            health.put("cache", "DOWN");
            health.put("cacheError", e.getMessage());
        }

        health.put("sync", broadcaster.stats());

        if (auditRecorder.isEnabled()) {
            try {
                auditRepo.count();
                health.put("mongodb", "UP");
            } catch (Exception e) {
                health.put("mongodb", "DOWN");
                health.put("mongodbError", e.getMessage());
            }
        }

        return ResponseEntity.ok(health);
    }
}
