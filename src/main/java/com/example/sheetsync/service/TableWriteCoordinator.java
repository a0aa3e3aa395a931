package com.example.sheetsync.service;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serializes cache invalidation and event emission per table. Every commit bumps the
 * table's generation; a read may only populate the cache if the generation it saw
 * before calling out is still current, so a read racing a write cannot put stale rows
 * back. Tables are locked in name order, unrelated tables never contend.
 */
@Component
public class TableWriteCoordinator {

    private final ConcurrentHashMap<String, TableState> tables = new ConcurrentHashMap<>();

    public long generation(String table) {
        TableState state = state(table);
        state.lock.lock();
        try {
            return state.generation;
        } finally {
            state.lock.unlock();
        }
    }

    /**
     * Runs {@code populate} if no commit touched the table since {@code observedGeneration}.
     */
    public boolean populateIfCurrent(String table, long observedGeneration, Runnable populate) {
        TableState state = state(table);
        state.lock.lock();
        try {
            if (state.generation != observedGeneration) {
                return false;
            }
            populate.run();
            return true;
        } finally {
            state.lock.unlock();
        }
    }

    /**
     * Runs {@code action} holding the locks of all given tables, after bumping their generations.
     */
    public void commit(Collection<String> affectedTables, Runnable action) {
        List<TableState> locked = new ArrayList<>();
        TreeSet<String> ordered = new TreeSet<>();
        affectedTables.forEach(t -> ordered.add(normalize(t)));
        try {
            for (String table : ordered) {
                TableState state = tables.computeIfAbsent(table, k -> new TableState());
                state.lock.lock();
                locked.add(state);
                state.generation++;
            }
            action.run();
        } finally {
            for (int i = locked.size() - 1; i >= 0; i--) {
                locked.get(i).lock.unlock();
            }
        }
    }

    private TableState state(String table) {
        return tables.computeIfAbsent(normalize(table), k -> new TableState());
    }

    private static String normalize(String table) {
        return table.toLowerCase(Locale.ROOT);
    }

    private static final class TableState {
        final ReentrantLock lock = new ReentrantLock();
        long generation;
    }
}
