package com.example.sheetsync.cache;

import com.example.sheetsync.model.SyncOperation;

import java.time.Duration;
import java.util.Optional;

public interface CacheStore {
    /** Live value, or empty when absent or past its TTL. */
    Optional<Object> get(String key);
    /** Entry regardless of TTL, as long as it is inside the retention horizon. */
    Optional<CacheEntry> peek(String key);
    void set(String key, Object value, Duration ttl);
    /** Drops every key of the table, whatever its kind, filter or page suffix. */
    int invalidate(String table, SyncOperation operation);
    int invalidatePrefix(String prefix);
    void clear();
    CacheStats stats();
}
