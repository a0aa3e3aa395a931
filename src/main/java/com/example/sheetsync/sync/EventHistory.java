package com.example.sheetsync.sync;

import com.example.sheetsync.model.SyncEvent;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Bounded buffer of recently broadcast events, oldest first. Bounded by count and by age.
 */
public class EventHistory {

    private final Deque<SyncEvent> events = new ArrayDeque<>();
    private final int maxSize;
    private final Duration maxAge;
    private final Clock clock;

    public EventHistory(int maxSize, Duration maxAge, Clock clock) {
        this.maxSize = maxSize;
        this.maxAge = maxAge;
        this.clock = clock;
    }

    public synchronized void append(SyncEvent event) {
        events.addLast(event);
        while (events.size() > maxSize) {
            events.removeFirst();
        }
        trim(clock.instant());
    }

    /**
     * Events newer than {@code window} that pass the filter, in broadcast order.
     */
    public synchronized List<SyncEvent> since(Duration window, Predicate<SyncEvent> filter) {
        Instant now = clock.instant();
        trim(now);
        Instant from = now.minus(window);
        List<SyncEvent> recent = new ArrayList<>();
        for (SyncEvent event : events) {
            if (!event.getTimestamp().isBefore(from) && filter.test(event)) {
                recent.add(event);
            }
        }
        return recent;
    }

    public synchronized int size() {
        return events.size();
    }

    private void trim(Instant now) {
        Instant horizon = now.minus(maxAge);
        Iterator<SyncEvent> it = events.iterator();
        while (it.hasNext() && it.next().getTimestamp().isBefore(horizon)) {
            it.remove();
        }
    }
}
