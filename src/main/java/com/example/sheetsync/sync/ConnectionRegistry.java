package com.example.sheetsync.sync;

import com.example.sheetsync.config.SyncSettings;
import com.example.sheetsync.model.SessionIdentity;
import com.example.sheetsync.model.Subscription;
import com.example.sheetsync.model.SyncEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Live client sessions and their interest filters. Each instance is independent;
 * nothing here is static.
 */
public class ConnectionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Map<String, Connection> connections = new ConcurrentHashMap<>();
    private final SyncSettings settings;
    private final Clock clock;

    public ConnectionRegistry(SyncSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    public Connection add(SessionIdentity identity, List<Subscription> subscriptions) {
        String id = "conn_" + UUID.randomUUID();
        ConnectionChannel channel = new ConnectionChannel(id, settings.getChannelCapacity(), () -> remove(id));
        Connection connection = new Connection(id, identity, subscriptions, clock.instant(), channel);
        connections.put(id, connection);
        logger.info("Connection added: {} for user {} (session {})", id, identity.getUserId(), identity.getSessionId());
        return connection;
    }

    public boolean remove(String id) {
        Connection connection = connections.remove(id);
        if (connection == null) return false;
        connection.markDisconnected();
        connection.getChannel().close();
        logger.info("Connection removed: {}", id);
        return true;
    }

    public Optional<Connection> find(String id) {
        return Optional.ofNullable(connections.get(id));
    }

    public boolean updateSubscriptions(String id, List<Subscription> subscriptions) {
        Connection connection = connections.get(id);
        if (connection == null) return false;
        connection.subscribe(subscriptions);
        logger.debug("Subscriptions of {} updated: {}", id, subscriptions);
        return true;
    }

    public boolean heartbeat(String id) {
        Connection connection = connections.get(id);
        if (connection == null) return false;
        connection.beat(clock.instant());
        return true;
    }

    /**
     * Live connections interested in the event. The author's own session is not excluded here.
     */
    public List<Connection> matching(SyncEvent event) {
        Instant now = clock.instant();
        return connections.values().stream()
                .filter(c -> c.isLive(now, settings.getHeartbeatTimeout()))
                .filter(c -> c.wants(event))
                .collect(Collectors.toList());
    }

    public List<Connection> connectionsForUsers(Collection<String> userIds) {
        if (userIds == null || userIds.isEmpty()) return List.of();
        Set<String> wanted = Set.copyOf(userIds);
        Instant now = clock.instant();
        return connections.values().stream()
                .filter(c -> c.isLive(now, settings.getHeartbeatTimeout()))
                .filter(c -> c.getUserId() != null && wanted.contains(c.getUserId()))
                .collect(Collectors.toList());
    }

    public List<Connection> subscribersOf(String table) {
        Instant now = clock.instant();
        return connections.values().stream()
                .filter(c -> c.isLive(now, settings.getHeartbeatTimeout()))
                .filter(c -> c.coversTable(table))
                .collect(Collectors.toList());
    }

    public Collection<Connection> all() {
        return List.copyOf(connections.values());
    }

    /**
     * Marks silent connections disconnected and drops those silent past the removal timeout.
     *
     * @return number of removed connections
     */
    public int reapStale() {
        Instant now = clock.instant();
        int removed = 0;
        for (Connection connection : List.copyOf(connections.values())) {
            if (connection.silentFor(now).compareTo(settings.getRemovalTimeout()) > 0) {
                if (remove(connection.getId())) removed++;
            } else if (connection.isConnected() && !connection.isLive(now, settings.getHeartbeatTimeout())) {
                connection.markDisconnected();
                logger.info("Connection {} missed its heartbeat, marked disconnected", connection.getId());
            }
        }
        return removed;
    }

    public Map<String, Object> stats() {
        Instant now = clock.instant();
        List<Connection> snapshot = List.copyOf(connections.values());
        List<Connection> live = snapshot.stream()
                .filter(c -> c.isLive(now, settings.getHeartbeatTimeout()))
                .collect(Collectors.toList());
        Map<String, Long> byUser = new TreeMap<>(live.stream()
                .collect(Collectors.groupingBy(c -> Objects.toString(c.getUserId(), "anonymous"), Collectors.counting())));

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("totalConnections", snapshot.size());
        stats.put("activeConnections", live.size());
        stats.put("connectionsByUser", byUser);
        return stats;
    }
}
