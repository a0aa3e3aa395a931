package com.example.sheetsync.cache;

import com.example.sheetsync.MutableClock;
import com.example.sheetsync.model.SyncOperation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryCacheStoreTest {

    private MutableClock clock;
    private InMemoryCacheStore cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
        cache = new InMemoryCacheStore(3, Duration.ofHours(1), clock);
    }

    @Test
    void testGet_HitWithinTtl() {
        // Given
        cache.set("proyectos:list", List.of("p1"), Duration.ofMinutes(5));

        // When
        clock.advance(Duration.ofMinutes(4));
        Optional<Object> value = cache.get("proyectos:list");

        // Then
        assertEquals(Optional.of(List.of("p1")), value);
        assertEquals(1, cache.stats().getHits());
    }

    @Test
    void testGet_ExpiredEntryIsMissButStillPeekable() {
        // Given
        cache.set("proyectos:get:P1", "record", Duration.ofMinutes(5));

        // When
        clock.advance(Duration.ofMinutes(10));

        // Then
        assertTrue(cache.get("proyectos:get:P1").isEmpty());
        Optional<CacheEntry> entry = cache.peek("proyectos:get:P1");
        assertTrue(entry.isPresent());
        assertEquals(Duration.ofMinutes(10), entry.get().age(clock.instant()));
        assertEquals(1, cache.stats().getMisses());
    }

    @Test
    void testPeek_EntryPastRetentionIsPurged() {
        // Given
        cache.set("proyectos:get:P1", "record", Duration.ofMinutes(5));

        // When
        clock.advance(Duration.ofHours(2));

        // Then
        assertTrue(cache.peek("proyectos:get:P1").isEmpty());
        assertEquals(0, cache.stats().getSize());
    }

    @Test
    void testSet_ZeroTtlIsNotStored() {
        // When
        cache.set("proyectos:create", "x", Duration.ZERO);

        // Then
        assertEquals(0, cache.stats().getSize());
    }

    @Test
    void testInvalidate_RemovesOnlyThatTable() {
        // Given
        cache.set("proyectos:list", "a", Duration.ofMinutes(5));
        cache.set("proyectos:get:P1", "b", Duration.ofMinutes(5));
        cache.set("materiales:list", "c", Duration.ofMinutes(5));

        // When
        int removed = cache.invalidate("Proyectos", SyncOperation.UPDATE);

        // Then
        assertEquals(2, removed);
        assertTrue(cache.get("proyectos:list").isEmpty());
        assertTrue(cache.get("materiales:list").isPresent());
    }

    @Test
    void testSet_EvictsLeastRecentlyUsedAboveCapacity() {
        // Given
        cache.set("a:list", 1, Duration.ofMinutes(5));
        cache.set("b:list", 2, Duration.ofMinutes(5));
        cache.set("c:list", 3, Duration.ofMinutes(5));
        cache.get("a:list");

        // When
        cache.set("d:list", 4, Duration.ofMinutes(5));

        // Then
        assertEquals(3, cache.stats().getSize());
        assertEquals(1, cache.stats().getEvictions());
        assertTrue(cache.peek("b:list").isEmpty());
        assertTrue(cache.peek("a:list").isPresent());
    }

    @Test
    void testStats_HitRate() {
        // Given
        cache.set("a:list", 1, Duration.ofMinutes(5));
        cache.get("a:list");
        cache.get("a:list");
        cache.get("missing");

        // When
        CacheStats stats = cache.stats();

        // Then
        assertEquals(2, stats.getHits());
        assertEquals(1, stats.getMisses());
        assertEquals(2.0 / 3.0, stats.getHitRate(), 0.0001);
    }

    @Test
    void testClear() {
        cache.set("a:list", 1, Duration.ofMinutes(5));
        cache.clear();
        assertEquals(0, cache.stats().getSize());
    }
}
