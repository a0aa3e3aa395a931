package com.example.sheetsync.sync;

import com.example.sheetsync.config.SyncSettings;
import com.example.sheetsync.model.Conflict;
import com.example.sheetsync.model.NotificationEvent;
import com.example.sheetsync.model.ResolutionStrategy;
import com.example.sheetsync.model.SessionIdentity;
import com.example.sheetsync.model.Subscription;
import com.example.sheetsync.model.SyncEvent;
import com.example.sheetsync.service.NotificationRuleEngine;
import com.example.sheetsync.service.SyncAuditRecorder;
import com.example.sheetsync.service.TeamDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fans committed events out to interested connections and feeds the session-independent
 * consumers: conflict detection, notification rules, the team directory and the audit trail.
 * Delivery only enqueues on bounded per-connection channels and never waits on a client.
 */
@Service
public class SyncBroadcaster {

    private static final Logger logger = LoggerFactory.getLogger(SyncBroadcaster.class);

    private final ConnectionRegistry registry;
    private final EventHistory history;
    private final ConflictDetector conflictDetector;
    private final NotificationRuleEngine ruleEngine;
    private final TeamDirectory directory;
    private final SyncAuditRecorder auditRecorder;
    private final SyncSettings settings;
    private final Clock clock;

    private final AtomicLong eventsBroadcast = new AtomicLong();
    private final AtomicLong deliveries = new AtomicLong();
    private final AtomicLong notificationsSent = new AtomicLong();

    public SyncBroadcaster(ConnectionRegistry registry, EventHistory history, ConflictDetector conflictDetector,
                           NotificationRuleEngine ruleEngine, TeamDirectory directory, SyncAuditRecorder auditRecorder,
                           SyncSettings settings, Clock clock) {
        this.registry = registry;
        this.history = history;
        this.conflictDetector = conflictDetector;
        this.ruleEngine = ruleEngine;
        this.directory = directory;
        this.auditRecorder = auditRecorder;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * @return number of connections the event was queued for
     */
    public int broadcast(SyncEvent event) {
        history.append(event);
        eventsBroadcast.incrementAndGet();

        int delivered = 0;
        ChannelMessage message = ChannelMessage.syncEvent(event);
        for (Connection connection : registry.matching(event)) {
            if (isAuthor(connection, event)) continue;
            if (connection.getChannel().offer(message)) delivered++;
        }
        deliveries.addAndGet(delivered);
        logger.debug("Event {} ({} {} {}) delivered to {} connections", event.getId(), event.getOperation(),
                event.getTable(), event.getRecordId(), delivered);

        try {
            directory.apply(event);
        } catch (RuntimeException e) {
            logger.error("Team directory update failed for event {}", event.getId(), e);
        }
        try {
            conflictDetector.observe(event).ifPresent(update -> advise(ChannelMessage.conflict(update.getConflict(), clock.instant()),
                    update.getConflict().getTable()));
        } catch (RuntimeException e) {
            logger.error("Conflict detection failed for event {}", event.getId(), e);
        }
        ruleEngine.evaluate(event).forEach(this::deliverNotification);
        auditRecorder.record(event);
        return delivered;
    }

    /**
     * Registers a connection, greets it and replays recent matching events it has not authored.
     */
    public Connection attach(SessionIdentity identity, List<Subscription> subscriptions) {
        Connection connection = registry.add(identity, subscriptions);
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("connectionId", connection.getId());
        info.put("userId", connection.getUserId());
        info.put("sessionId", connection.getSessionId());
        info.put("subscriptions", connection.getSubscriptions());
        connection.getChannel().offer(ChannelMessage.connected(info, clock.instant()));

        List<SyncEvent> missed = history.since(settings.getReplayWindow(),
                event -> connection.wants(event) && !isAuthor(connection, event));
        for (SyncEvent event : missed) {
            if (!connection.getChannel().offer(ChannelMessage.syncEvent(event))) break;
        }
        if (!missed.isEmpty()) {
            logger.info("Replayed {} recent events to {}", missed.size(), connection.getId());
        }
        return connection;
    }

    public boolean detach(String connectionId) {
        return registry.remove(connectionId);
    }

    /**
     * Queues the notification for every live connection of its target users.
     */
    public int deliverNotification(NotificationEvent notification) {
        int delivered = 0;
        ChannelMessage message = ChannelMessage.notification(notification);
        for (Connection connection : registry.connectionsForUsers(notification.getTargetUsers())) {
            if (connection.getChannel().offer(message)) delivered++;
        }
        notificationsSent.addAndGet(delivered);
        logger.info("Notification {} ({}) sent to {} connections of {} users", notification.getId(),
                notification.getType(), delivered, notification.getTargetUsers().size());
        return delivered;
    }

    public Optional<Conflict> resolveConflict(String conflictId, ResolutionStrategy strategy,
                                              Map<String, Object> mergedData, String resolvedBy) {
        return conflictDetector.resolve(conflictId, strategy, mergedData, resolvedBy)
                .map(update -> {
                    if (update.getType() == ConflictUpdate.Type.RESOLVED) {
                        advise(ChannelMessage.conflictResolved(update.getConflict()), update.getConflict().getTable());
                    }
                    return update.getConflict();
                });
    }

    public List<Conflict> openConflicts(String table, String recordId) {
        return conflictDetector.openConflicts(table, recordId);
    }

    public Optional<Conflict> findConflict(String conflictId) {
        return conflictDetector.find(conflictId);
    }

    public Map<String, Object> stats() {
        Map<String, Object> stats = new LinkedHashMap<>(registry.stats());
        stats.put("bufferedEvents", history.size());
        stats.put("eventsBroadcast", eventsBroadcast.get());
        stats.put("deliveries", deliveries.get());
        stats.put("openConflicts", conflictDetector.openConflicts(null, null).size());
        stats.put("notificationsSent", notificationsSent.get());
        return stats;
    }

    /**
     * Conflict advisories go to every subscriber of the table, authors included.
     */
    private void advise(ChannelMessage message, String table) {
        int delivered = 0;
        for (Connection connection : registry.subscribersOf(table)) {
            if (connection.getChannel().offer(message)) delivered++;
        }
        logger.debug("{} advisory {} sent to {} connections", message.getType(), message.getId(), delivered);
    }

    private static boolean isAuthor(Connection connection, SyncEvent event) {
        return event.getSessionId() != null && Objects.equals(connection.getSessionId(), event.getSessionId());
    }
}
