package com.example.sheetsync.cache;

import com.example.sheetsync.model.SyncOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded in-process store. Reads go straight to a {@link ConcurrentHashMap}; only
 * eviction takes a lock. Entries past TTL stay readable through {@link #peek} until
 * {@code retention} and are purged lazily once they age beyond it.
 */
public class InMemoryCacheStore implements CacheStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryCacheStore.class);

    private final Map<String, Slot> entries = new ConcurrentHashMap<>();
    private final Object evictionLock = new Object();
    private final AtomicLong accessTick = new AtomicLong();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final int maxEntries;
    private final Duration retention;
    private final Clock clock;

    public InMemoryCacheStore(int maxEntries, Duration retention, Clock clock) {
        if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be positive");
        this.maxEntries = maxEntries;
        this.retention = retention;
        this.clock = clock;
    }

    @Override
    public Optional<Object> get(String key) {
        Slot slot = liveSlot(key);
        Instant now = clock.instant();
        if (slot == null || slot.entry.isExpired(now)) {
            misses.incrementAndGet();
            logger.debug("Cache MISS: {}", key);
            return Optional.empty();
        }
        slot.lastAccess = accessTick.incrementAndGet();
        hits.incrementAndGet();
        logger.debug("Cache HIT: {} (age {}s)", key, slot.entry.age(now).toSeconds());
        return Optional.ofNullable(slot.entry.getValue());
    }

    @Override
    public Optional<CacheEntry> peek(String key) {
        Slot slot = liveSlot(key);
        return slot == null ? Optional.empty() : Optional.of(slot.entry);
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) return;
        Slot slot = new Slot(new CacheEntry(key, value, clock.instant(), ttl), accessTick.incrementAndGet());
        entries.put(key, slot);
        logger.debug("Cache SET: {} ttl={}s size={}", key, ttl.toSeconds(), entries.size());
        if (entries.size() > maxEntries) {
            evictLeastRecentlyUsed();
        }
    }

    @Override
    public int invalidate(String table, SyncOperation operation) {
        int removed = invalidatePrefix(CacheKeys.tablePrefix(table));
        logger.debug("Cache invalidation for {} on {}: {} entries", operation, table, removed);
        return removed;
    }

    @Override
    public int invalidatePrefix(String prefix) {
        int removed = 0;
        Iterator<String> keys = entries.keySet().iterator();
        while (keys.hasNext()) {
            if (keys.next().startsWith(prefix)) {
                keys.remove();
                removed++;
            }
        }
        return removed;
    }

    @Override
    public void clear() {
        int previous = entries.size();
        entries.clear();
        logger.info("Cache cleared ({} entries)", previous);
    }

    @Override
    public CacheStats stats() {
        return new CacheStats(hits.get(), misses.get(), evictions.get(), entries.size());
    }

    private Slot liveSlot(String key) {
        Slot slot = entries.get(key);
        if (slot == null) return null;
        if (slot.entry.age(clock.instant()).compareTo(retention) > 0) {
            entries.remove(key, slot);
            return null;
        }
        return slot;
    }

    private void evictLeastRecentlyUsed() {
        synchronized (evictionLock) {
            while (entries.size() > maxEntries) {
                String oldestKey = null;
                long oldestAccess = Long.MAX_VALUE;
                for (Map.Entry<String, Slot> e : entries.entrySet()) {
                    if (e.getValue().lastAccess < oldestAccess) {
                        oldestAccess = e.getValue().lastAccess;
                        oldestKey = e.getKey();
                    }
                }
                if (oldestKey == null || entries.remove(oldestKey) == null) {
                    return;
                }
                evictions.incrementAndGet();
                logger.debug("Cache eviction (lru): {}", oldestKey);
            }
        }
    }

    private static final class Slot {
        final CacheEntry entry;
        volatile long lastAccess;

        Slot(CacheEntry entry, long lastAccess) {
            this.entry = entry;
            this.lastAccess = lastAccess;
        }
    }
}
