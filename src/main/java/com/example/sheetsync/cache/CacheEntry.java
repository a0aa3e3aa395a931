package com.example.sheetsync.cache;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

@Value
public class CacheEntry {
    String key;
    Object value;
    Instant storedAt;
    Duration ttl;

    public Duration age(Instant now) {
        return Duration.between(storedAt, now);
    }

    public boolean isExpired(Instant now) {
        return age(now).compareTo(ttl) > 0;
    }
}
