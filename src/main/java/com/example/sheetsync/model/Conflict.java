package com.example.sheetsync.model;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Concurrent edits of one record by different sessions. Only the conflict detector
 * mutates it, under its own lock; readers get copies.
 */
@Getter
public class Conflict {

    private final String id;
    private final String table;
    private final String recordId;
    private final Instant detectedAt;
    private final List<SyncEvent> events = new CopyOnWriteArrayList<>();
    private volatile ConflictStatus status = ConflictStatus.OPEN;
    private volatile ResolutionStrategy resolution;
    private volatile Map<String, Object> resolvedData;
    private volatile Instant resolvedAt;
    private volatile String resolvedBy;

    public Conflict(String id, SyncEvent first, SyncEvent second, Instant detectedAt) {
        if (!first.getTable().equals(second.getTable()) || !first.getRecordId().equals(second.getRecordId())) {
            throw new IllegalArgumentException("Conflicting events must target the same record");
        }
        this.id = id;
        this.table = first.getTable();
        this.recordId = first.getRecordId();
        this.detectedAt = detectedAt;
        this.events.add(first);
        this.events.add(second);
    }

    public List<SyncEvent> getEvents() {
        return Collections.unmodifiableList(new ArrayList<>(events));
    }

    public SyncEvent earliest() {
        return events.get(0);
    }

    public SyncEvent latest() {
        return events.get(events.size() - 1);
    }

    public boolean isOpen() {
        return status == ConflictStatus.OPEN;
    }

    public boolean involvesSession(String sessionId) {
        return events.stream().anyMatch(e -> Objects.equals(e.getSessionId(), sessionId));
    }

    public void attach(SyncEvent event) {
        if (!isOpen()) throw new IllegalStateException("Conflict " + id + " is already resolved");
        events.add(event);
    }

    /**
     * Fields written by more than one event with different values.
     */
    public Set<String> getConflictingFields() {
        Map<String, Object> seen = new HashMap<>();
        Set<String> conflicting = new LinkedHashSet<>();
        for (SyncEvent event : events) {
            if (event.getData() == null) continue;
            event.getData().forEach((field, value) -> {
                if (seen.containsKey(field) && !Objects.equals(seen.get(field), value)) {
                    conflicting.add(field);
                }
                seen.putIfAbsent(field, value);
            });
        }
        return conflicting;
    }

    public void resolve(ResolutionStrategy strategy, Map<String, Object> data, String by, Instant at) {
        this.status = ConflictStatus.RESOLVED;
        this.resolution = strategy;
        this.resolvedData = data;
        this.resolvedBy = by;
        this.resolvedAt = at;
    }
}
