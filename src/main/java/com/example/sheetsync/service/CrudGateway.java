package com.example.sheetsync.service;

import com.example.sheetsync.cache.CacheKeys;
import com.example.sheetsync.cache.CacheStore;
import com.example.sheetsync.config.CacheSettings;
import com.example.sheetsync.error.ClassifiedError;
import com.example.sheetsync.error.ErrorClassifier;
import com.example.sheetsync.error.RemoteStoreException;
import com.example.sheetsync.model.GatewayResult;
import com.example.sheetsync.model.Operation;
import com.example.sheetsync.model.OperationKind;
import com.example.sheetsync.model.Pagination;
import com.example.sheetsync.model.SessionIdentity;
import com.example.sheetsync.model.SheetTable;
import com.example.sheetsync.model.SyncEvent;
import com.example.sheetsync.model.SyncOperation;
import com.example.sheetsync.remote.RemoteResponse;
import com.example.sheetsync.remote.SheetsClient;
import com.example.sheetsync.sync.SyncBroadcaster;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Entry point of the UI for data of record. Reads go through the cache, writes
 * invalidate it and produce exactly one {@link SyncEvent} each.
 */
@Service
public class CrudGateway {

    private static final Logger logger = LoggerFactory.getLogger(CrudGateway.class);

    private static final TypeReference<Map<String, Object>> RECORD = new TypeReference<>() {};
    private static final TypeReference<List<Map<String, Object>>> RECORDS = new TypeReference<>() {};

    private final SheetsClient sheetsClient;
    private final CacheStore cache;
    private final RetryFallbackExecutor executor;
    private final TableWriteCoordinator coordinator;
    private final SyncBroadcaster broadcaster;
    private final ErrorClassifier classifier;
    private final CacheSettings cacheSettings;
    private final RetryPolicy retryPolicy;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public CrudGateway(SheetsClient sheetsClient, CacheStore cache, RetryFallbackExecutor executor,
                       TableWriteCoordinator coordinator, SyncBroadcaster broadcaster, ErrorClassifier classifier,
                       CacheSettings cacheSettings, RetryPolicy retryPolicy, ObjectMapper objectMapper, Clock clock) {
        this.sheetsClient = sheetsClient;
        this.cache = cache;
        this.executor = executor;
        this.coordinator = coordinator;
        this.broadcaster = broadcaster;
        this.classifier = classifier;
        this.cacheSettings = cacheSettings;
        this.retryPolicy = retryPolicy;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Mono<GatewayResult<List<Map<String, Object>>>> list(String table, Map<String, Object> filters,
                                                               Pagination page, boolean forceRefresh) {
        return read(Operation.list(table, filters, page), forceRefresh, this::toRecords);
    }

    public Mono<GatewayResult<Map<String, Object>>> get(String table, String id, boolean forceRefresh) {
        Operation operation = Operation.get(table, id);
        return read(operation, forceRefresh, data -> requireRecord(data, operation));
    }

    public Mono<GatewayResult<Map<String, Object>>> create(String table, Map<String, Object> data,
                                                           SessionIdentity identity) {
        return write(Operation.create(table, data), identity, null);
    }

    public Mono<GatewayResult<Map<String, Object>>> update(String table, String id, Map<String, Object> data,
                                                           SessionIdentity identity) {
        return previousRecord(table, id)
                .flatMap(previous -> write(Operation.update(table, id, data), identity, previous.orElse(null)));
    }

    public Mono<GatewayResult<Map<String, Object>>> delete(String table, String id, SessionIdentity identity) {
        return previousRecord(table, id)
                .flatMap(previous -> write(Operation.delete(table, id), identity, previous.orElse(null)));
    }

    @SuppressWarnings("unchecked")
    private <T> Mono<GatewayResult<T>> read(Operation operation, boolean forceRefresh, Function<JsonNode, T> mapper) {
        Map<String, Object> context = context(operation);
        return Mono.defer(() -> {
            String key = CacheKeys.of(operation);
            if (cacheSettings.isEnabled() && !forceRefresh) {
                Optional<Object> cached = cachedValue(key);
                if (cached.isPresent()) {
                    return Mono.just(GatewayResult.<T>builder()
                            .ok(true).data((T) cached.get()).cacheHit(true).timestamp(clock.instant()).build());
                }
            }
            long generation = coordinator.generation(operation.getTable());
            return executor.execute(() -> sheetsClient.execute(operation).map(response -> mapper.apply(response.getData())),
                            cacheSettings.isEnabled() ? key : null, retryPolicy, context)
                    .map(result -> {
                        if (!result.isFromCache()) {
                            populate(operation, key, generation, result.getData());
                        }
                        return GatewayResult.<T>builder()
                                .ok(true)
                                .data(result.getData())
                                .fromCache(result.isFromCache())
                                .message(result.getMessage())
                                .timestamp(clock.instant())
                                .build();
                    });
        }).onErrorResume(failure -> Mono.just(this.<T>failed(failure, operation, context)));
    }

    private Mono<GatewayResult<Map<String, Object>>> write(Operation operation, SessionIdentity identity,
                                                           Map<String, Object> previous) {
        Map<String, Object> context = context(operation);
        return executor.execute(() -> sheetsClient.execute(operation).map(response -> writtenRecord(response, operation, previous)),
                        null, retryPolicy, context)
                .map(result -> {
                    Map<String, Object> record = result.getData();
                    SyncEvent event = toEvent(operation, record, previous, identity);
                    commit(event);
                    logger.info("{} {} {} committed by {} ({})", operation.getKind().wireName(), operation.getTable(),
                            event.getRecordId(), identity.getUserId(), identity.getSessionId());
                    return GatewayResult.<Map<String, Object>>builder()
                            .ok(true)
                            .data(record)
                            .eventId(event.getId())
                            .timestamp(clock.instant())
                            .build();
                })
                .onErrorResume(failure -> Mono.just(this.<Map<String, Object>>failed(failure, operation, context)));
    }

    /**
     * Announces a write committed outside this gateway. The event goes through the same
     * invalidate-then-notify path as local writes.
     *
     * @return the number of connections the event was queued for
     */
    public int publishExternal(SyncEvent event) {
        int delivered = commit(event);
        logger.info("External {} on {} {} published to {} connections", event.getOperation(), event.getTable(),
                event.getRecordId(), delivered);
        return delivered;
    }

    /**
     * Invalidation and broadcast run under the table locks, in that order.
     */
    private int commit(SyncEvent event) {
        String table = event.getTable();
        Set<String> affected = new LinkedHashSet<>();
        affected.add(table);
        Optional<SheetTable> sheet = SheetTable.fromName(table);
        sheet.ifPresent(s -> s.relatedTables().forEach(related -> affected.add(related.sheetName())));

        AtomicInteger delivered = new AtomicInteger();
        coordinator.commit(affected, () -> {
            try {
                cache.invalidate(table, event.getOperation());
                sheet.ifPresent(s -> s.relatedTables().forEach(related ->
                        cache.invalidatePrefix(CacheKeys.kindPrefix(related.sheetName(), OperationKind.LIST))));
            } catch (RuntimeException e) {
                logger.error("Cache invalidation failed for {} after {}", table, event.getOperation(), e);
            }
            try {
                delivered.set(broadcaster.broadcast(event));
            } catch (RuntimeException e) {
                logger.error("Broadcast of {} failed", event.getId(), e);
            }
        });
        return delivered.get();
    }

    private void populate(Operation operation, String key, long generation, Object value) {
        if (!cacheSettings.isEnabled()) return;
        try {
            boolean stored = coordinator.populateIfCurrent(operation.getTable(), generation,
                    () -> cache.set(key, value, cacheSettings.ttlFor(operation.getKind())));
            if (!stored) {
                logger.debug("Skipped caching {}: {} was written during the read", key, operation.getTable());
            }
        } catch (RuntimeException e) {
            logger.warn("Could not cache {}", key, e);
        }
    }

    private Optional<Object> cachedValue(String key) {
        try {
            return cache.get(key);
        } catch (RuntimeException e) {
            logger.warn("Cache read failed for {}, going remote", key, e);
            return Optional.empty();
        }
    }

    /**
     * Current remote state of a record before it is changed. A failure here only costs
     * the event its previous data.
     */
    private Mono<Optional<Map<String, Object>>> previousRecord(String table, String id) {
        Operation operation = Operation.get(table, id);
        return sheetsClient.execute(operation)
                .map(response -> Optional.ofNullable(toRecord(response.getData())))
                .onErrorResume(e -> {
                    logger.warn("Could not fetch previous state of {} {}: {}", table, id, e.toString());
                    return Mono.just(Optional.empty());
                });
    }

    private Map<String, Object> writtenRecord(RemoteResponse response, Operation operation, Map<String, Object> previous) {
        if (operation.getKind() == OperationKind.DELETE) {
            Map<String, Object> deleted = new LinkedHashMap<>();
            deleted.put("id", operation.getId());
            return deleted;
        }
        Map<String, Object> returned = toRecord(response.getData());
        Map<String, Object> record = new LinkedHashMap<>();
        if (previous != null) record.putAll(previous);
        if (operation.getData() != null) record.putAll(operation.getData());
        if (returned != null) record.putAll(returned);
        if (operation.getId() != null) record.putIfAbsent("id", operation.getId());
        return record;
    }

    private SyncEvent toEvent(Operation operation, Map<String, Object> record, Map<String, Object> previous,
                              SessionIdentity identity) {
        SyncOperation syncOperation = SyncOperation.from(operation.getKind());
        String recordId = operation.getId();
        if (recordId == null) {
            recordId = Objects.toString(record.get("id"), UUID.randomUUID().toString());
        }
        return SyncEvent.builder()
                .id("event_" + UUID.randomUUID())
                .table(operation.getTable())
                .operation(syncOperation)
                .recordId(recordId)
                .data(syncOperation == SyncOperation.DELETE ? null : record)
                .previousData(previous)
                .timestamp(clock.instant())
                .userId(identity.getUserId())
                .userName(identity.getUserName())
                .sessionId(identity.getSessionId())
                .version(version(record))
                .build();
    }

    private <T> GatewayResult<T> failed(Throwable failure, Operation operation, Map<String, Object> context) {
        ClassifiedError error = classifier.classify(failure, context);
        logger.error("API operation failed: {} {} - {} ({})", operation.getKind().wireName(), operation.getTable(),
                error.getKind(), error.getMessage());
        return GatewayResult.failure(error, clock.instant());
    }

    private List<Map<String, Object>> toRecords(JsonNode data) {
        if (data == null || data.isNull() || data.isMissingNode()) return new ArrayList<>();
        if (data.isArray()) return objectMapper.convertValue(data, RECORDS);
        if (data.isObject() && data.has("items") && data.get("items").isArray()) {
            return objectMapper.convertValue(data.get("items"), RECORDS);
        }
        throw new RemoteStoreException(null, "Expected a list of records, got " + data.getNodeType(), null);
    }

    private Map<String, Object> requireRecord(JsonNode data, Operation operation) {
        Map<String, Object> record = toRecord(data);
        if (record == null) {
            throw new RemoteStoreException(404, "Record not found: " + operation.getTable() + "/" + operation.getId(), null);
        }
        return record;
    }

    private Map<String, Object> toRecord(JsonNode data) {
        if (data == null || !data.isObject()) return null;
        return objectMapper.convertValue(data, RECORD);
    }

    private static Integer version(Map<String, Object> record) {
        Object version = record == null ? null : record.get("version");
        if (version instanceof Number) return ((Number) version).intValue();
        if (version instanceof String) {
            try {
                return Integer.parseInt((String) version);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Map<String, Object> context(Operation operation) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("table", operation.getTable());
        context.put("operation", operation.getKind().wireName());
        if (operation.getId() != null) context.put("id", operation.getId());
        return context;
    }
}
