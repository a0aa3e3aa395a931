package com.example.sheetsync.sync;

import com.example.sheetsync.model.Conflict;
import com.example.sheetsync.model.ResolutionStrategy;
import com.example.sheetsync.model.SyncEvent;
import com.example.sheetsync.model.SyncOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Per-record state machine: clean, pending (one recent edit), conflicted (edits by
 * different sessions inside the window). A conflicted record stays so until resolved.
 * A further edit attaches to the open conflict only when it overlaps the conflict's
 * latest edit: inside the window and by another session. Any other edit is tracked as
 * pending and may open a new conflict on the same record.
 */
public class ConflictDetector {

    private static final Logger logger = LoggerFactory.getLogger(ConflictDetector.class);

    private final Map<String, SyncEvent> pending = new HashMap<>();
    private final Map<String, Conflict> openByRecord = new HashMap<>();
    private final Map<String, Conflict> openById = new HashMap<>();
    private final Map<String, Conflict> resolved;
    private final Duration window;
    private final Clock clock;

    public ConflictDetector(Duration window, int resolvedHistory, Clock clock) {
        this.window = window;
        this.clock = clock;
        this.resolved = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Conflict> eldest) {
                return size() > resolvedHistory;
            }
        };
    }

    public synchronized Optional<ConflictUpdate> observe(SyncEvent event) {
        if (event.getOperation() == SyncOperation.CREATE || event.getRecordId() == null) {
            return Optional.empty();
        }
        String key = key(event.getTable(), event.getRecordId());

        Conflict open = openByRecord.get(key);
        if (open != null && withinWindow(open.latest(), event) && differentAuthors(open.latest(), event)) {
            open.attach(event);
            logger.info("Event {} attached to open conflict {} on {}", event.getId(), open.getId(), key);
            return Optional.of(new ConflictUpdate(ConflictUpdate.Type.ATTACHED, open));
        }

        SyncEvent previous = pending.get(key);
        if (previous != null && withinWindow(previous, event) && differentAuthors(previous, event)) {
            Conflict conflict = new Conflict("conflict_" + UUID.randomUUID(), previous, event, clock.instant());
            pending.remove(key);
            openByRecord.put(key, conflict);
            openById.put(conflict.getId(), conflict);
            logger.warn("Conflict {} detected on {}: sessions {} and {}", conflict.getId(), key,
                    previous.getSessionId(), event.getSessionId());
            return Optional.of(new ConflictUpdate(ConflictUpdate.Type.CREATED, conflict));
        }

        pending.put(key, event);
        return Optional.empty();
    }

    /**
     * Resolving an already resolved conflict returns it unchanged.
     *
     * @throws IllegalArgumentException for {@link ResolutionStrategy#MERGE} without merged data
     */
    public synchronized Optional<ConflictUpdate> resolve(String conflictId, ResolutionStrategy strategy,
                                                         Map<String, Object> mergedData, String resolvedBy) {
        Conflict done = resolved.get(conflictId);
        if (done != null) {
            return Optional.of(new ConflictUpdate(ConflictUpdate.Type.ALREADY_RESOLVED, done));
        }
        Conflict conflict = openById.get(conflictId);
        if (conflict == null) {
            return Optional.empty();
        }
        Map<String, Object> data;
        switch (strategy) {
            case ACCEPT_CURRENT:
                data = conflict.earliest().getData();
                break;
            case ACCEPT_INCOMING:
                data = conflict.latest().getData();
                break;
            case MERGE:
                if (mergedData == null) {
                    throw new IllegalArgumentException("Merge resolution requires the merged record");
                }
                data = mergedData;
                break;
            default:
                throw new IllegalArgumentException("Unsupported resolution strategy: " + strategy);
        }
        conflict.resolve(strategy, data, resolvedBy, clock.instant());
        openById.remove(conflictId);
        openByRecord.remove(key(conflict.getTable(), conflict.getRecordId()), conflict);
        resolved.put(conflictId, conflict);
        logger.info("Conflict {} resolved with {} by {}", conflictId, strategy, resolvedBy);
        return Optional.of(new ConflictUpdate(ConflictUpdate.Type.RESOLVED, conflict));
    }

    /**
     * Open conflicts, oldest first. Null filters match everything.
     */
    public synchronized List<Conflict> openConflicts(String table, String recordId) {
        return openById.values().stream()
                .filter(c -> table == null || c.getTable().equalsIgnoreCase(table))
                .filter(c -> recordId == null || c.getRecordId().equals(recordId))
                .sorted(Comparator.comparing(Conflict::getDetectedAt))
                .collect(Collectors.toList());
    }

    public synchronized Optional<Conflict> find(String conflictId) {
        Conflict conflict = openById.get(conflictId);
        return Optional.ofNullable(conflict != null ? conflict : resolved.get(conflictId));
    }

    /**
     * Forgets pending edits older than the window.
     */
    public synchronized int purgeIdle() {
        Instant horizon = clock.instant().minus(window);
        int purged = 0;
        Iterator<SyncEvent> it = pending.values().iterator();
        while (it.hasNext()) {
            if (it.next().getTimestamp().isBefore(horizon)) {
                it.remove();
                purged++;
            }
        }
        return purged;
    }

    private boolean withinWindow(SyncEvent earlier, SyncEvent later) {
        Duration gap = Duration.between(earlier.getTimestamp(), later.getTimestamp()).abs();
        return gap.compareTo(window) <= 0;
    }

    private static boolean differentAuthors(SyncEvent a, SyncEvent b) {
        if (a.getSessionId() != null || b.getSessionId() != null) {
            return !Objects.equals(a.getSessionId(), b.getSessionId());
        }
        return !Objects.equals(a.getUserId(), b.getUserId());
    }

    private static String key(String table, String recordId) {
        return table.toLowerCase(Locale.ROOT) + ":" + recordId;
    }
}
