package com.example.sheetsync.cache;

import com.example.sheetsync.model.SyncOperation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Shared cache for deployments running several gateway instances. Each value is a JSON
 * envelope {@code {"value":..,"storedAt":..,"ttlMs":..}}; Redis expiry is set to the
 * retention horizon so fallback reads still find stale entries.
 */
public class RedisCacheStore implements CacheStore {

    private static final Logger logger = LoggerFactory.getLogger(RedisCacheStore.class);
    static final String NAMESPACE = "sheetsync:";

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final Duration retention;
    private final Clock clock;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public RedisCacheStore(StringRedisTemplate redis, ObjectMapper objectMapper, Duration retention, Clock clock) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.retention = retention;
        this.clock = clock;
    }

    @Override
    public Optional<Object> get(String key) {
        Optional<CacheEntry> entry = peek(key);
        if (entry.isEmpty() || entry.get().isExpired(clock.instant())) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.ofNullable(entry.get().getValue());
    }

    @Override
    public Optional<CacheEntry> peek(String key) {
        String raw = redis.opsForValue().get(NAMESPACE + key);
        if (raw == null) return Optional.empty();
        try {
            JsonNode node = objectMapper.readTree(raw);
            Object value = objectMapper.treeToValue(node.get("value"), Object.class);
            Instant storedAt = Instant.ofEpochMilli(node.path("storedAt").asLong());
            Duration ttl = Duration.ofMillis(node.path("ttlMs").asLong());
            return Optional.of(new CacheEntry(key, value, storedAt, ttl));
        } catch (JsonProcessingException e) {
            logger.warn("Dropping unreadable cache entry {}", key, e);
            redis.delete(NAMESPACE + key);
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) return;
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.set("value", objectMapper.valueToTree(value));
        envelope.put("storedAt", clock.millis());
        envelope.put("ttlMs", ttl.toMillis());
        Duration expiry = ttl.compareTo(retention) > 0 ? ttl : retention;
        redis.opsForValue().set(NAMESPACE + key, envelope.toString(), expiry);
    }

    @Override
    public int invalidate(String table, SyncOperation operation) {
        int removed = invalidatePrefix(CacheKeys.tablePrefix(table));
        logger.debug("Redis cache invalidation for {} on {}: {} keys", operation, table, removed);
        return removed;
    }

    @Override
    public int invalidatePrefix(String prefix) {
        List<String> keys = scan(NAMESPACE + prefix);
        if (keys.isEmpty()) return 0;
        Long deleted = redis.delete(keys);
        return deleted == null ? 0 : deleted.intValue();
    }

    @Override
    public void clear() {
        invalidatePrefix("");
    }

    @Override
    public CacheStats stats() {
        return new CacheStats(hits.get(), misses.get(), 0, scan(NAMESPACE).size());
    }

    private List<String> scan(String prefix) {
        ScanOptions options = ScanOptions.scanOptions().match(prefix + "*").count(500).build();
        try (RedisConnection conn = Objects.requireNonNull(redis.getConnectionFactory()).getConnection()) {
            List<String> keys = new ArrayList<>();
            try (var cursor = conn.keyCommands().scan(options)) {
                while (cursor.hasNext()) {
                    keys.add(new String(cursor.next(), StandardCharsets.UTF_8));
                }
            }
            return keys;
        }
    }
}
