package com.example.sheetsync.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class ConnectionReaper {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionReaper.class);

    private final ConnectionRegistry registry;
    private final ConflictDetector conflictDetector;

    public ConnectionReaper(ConnectionRegistry registry, ConflictDetector conflictDetector) {
        this.registry = registry;
        this.conflictDetector = conflictDetector;
    }

    @Scheduled(fixedDelayString = "${app.sync.reaper-interval-ms:30000}", initialDelayString = "${app.sync.reaper-interval-ms:30000}")
    public void run() {
        int removed = registry.reapStale();
        int purged = conflictDetector.purgeIdle();
        if (removed > 0 || purged > 0) {
            logger.info("Reaper removed {} stale connections and {} idle pending edits", removed, purged);
        }
    }
}
