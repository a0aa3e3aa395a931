package com.example.sheetsync.sync;

import com.example.sheetsync.model.SessionIdentity;
import com.example.sheetsync.model.Subscription;
import com.example.sheetsync.model.SyncEvent;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * A live client session. Identity is fixed; subscriptions, heartbeat and the
 * connected flag change over its lifetime.
 */
@Getter
public class Connection {

    private final String id;
    private final String userId;
    private final String userName;
    private final String sessionId;
    private final Instant connectedAt;
    private volatile List<Subscription> subscriptions;
    private volatile Instant lastHeartbeat;
    private volatile boolean connected = true;
    @JsonIgnore
    private final ConnectionChannel channel;

    Connection(String id, SessionIdentity identity, List<Subscription> subscriptions, Instant now,
               ConnectionChannel channel) {
        this.id = id;
        this.userId = identity.getUserId();
        this.userName = identity.getUserName();
        this.sessionId = identity.getSessionId();
        this.connectedAt = now;
        this.lastHeartbeat = now;
        this.subscriptions = List.copyOf(subscriptions);
        this.channel = channel;
    }

    /**
     * An empty subscription list means everything.
     */
    public boolean wants(SyncEvent event) {
        List<Subscription> current = subscriptions;
        return current.isEmpty() || current.stream().anyMatch(s -> s.matches(event));
    }

    public boolean coversTable(String table) {
        List<Subscription> current = subscriptions;
        return current.isEmpty() || current.stream().anyMatch(s -> s.coversTable(table));
    }

    public boolean isLive(Instant now, Duration heartbeatTimeout) {
        return connected && !lastHeartbeat.plus(heartbeatTimeout).isBefore(now);
    }

    public Duration silentFor(Instant now) {
        return Duration.between(lastHeartbeat, now);
    }

    void subscribe(List<Subscription> subscriptions) {
        this.subscriptions = List.copyOf(subscriptions);
    }

    void beat(Instant now) {
        this.lastHeartbeat = now;
        this.connected = true;
    }

    void markDisconnected() {
        this.connected = false;
    }
}
