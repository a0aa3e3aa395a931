package com.example.sheetsync.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class SyncSettings {
    @Builder.Default
    Duration heartbeatTimeout = Duration.ofSeconds(60);
    @Builder.Default
    Duration removalTimeout = Duration.ofMinutes(5);
    @Builder.Default
    Duration conflictWindow = Duration.ofSeconds(5);
    @Builder.Default
    int channelCapacity = 256;
    @Builder.Default
    int historySize = 1000;
    @Builder.Default
    Duration historyMaxAge = Duration.ofHours(24);
    @Builder.Default
    Duration replayWindow = Duration.ofMinutes(2);
    @Builder.Default
    int resolvedConflictHistory = 500;
    /** Period of the server heartbeat written to each event stream. */
    @Builder.Default
    Duration streamHeartbeat = Duration.ofSeconds(30);
}
