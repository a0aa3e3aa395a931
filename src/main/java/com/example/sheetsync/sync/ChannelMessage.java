package com.example.sheetsync.sync;

import com.example.sheetsync.model.Conflict;
import com.example.sheetsync.model.NotificationEvent;
import com.example.sheetsync.model.SyncEvent;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * One item on a connection's outbound channel. {@code type} becomes the SSE event name.
 */
@Value
public class ChannelMessage {

    public static final String CONNECTED = "connected";
    public static final String SYNC_EVENT = "sync-event";
    public static final String NOTIFICATION = "notification";
    public static final String CONFLICT = "conflict";
    public static final String CONFLICT_RESOLVED = "conflict-resolved";
    public static final String HEARTBEAT = "heartbeat";

    String type;
    String id;
    Object payload;
    Instant timestamp;

    public static ChannelMessage connected(Map<String, Object> info, Instant at) {
        return new ChannelMessage(CONNECTED, null, info, at);
    }

    public static ChannelMessage heartbeat(Map<String, Object> stats, Instant at) {
        return new ChannelMessage(HEARTBEAT, null, stats, at);
    }

    public static ChannelMessage syncEvent(SyncEvent event) {
        return new ChannelMessage(SYNC_EVENT, event.getId(), event, event.getTimestamp());
    }

    public static ChannelMessage notification(NotificationEvent notification) {
        return new ChannelMessage(NOTIFICATION, notification.getId(), notification, notification.getTimestamp());
    }

    public static ChannelMessage conflict(Conflict conflict, Instant at) {
        return new ChannelMessage(CONFLICT, conflict.getId(), conflict, at);
    }

    public static ChannelMessage conflictResolved(Conflict conflict) {
        return new ChannelMessage(CONFLICT_RESOLVED, conflict.getId(), conflict, conflict.getResolvedAt());
    }
}
