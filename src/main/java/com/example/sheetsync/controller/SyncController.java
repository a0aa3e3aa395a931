package com.example.sheetsync.controller;

import com.example.sheetsync.config.SyncSettings;
import com.example.sheetsync.model.BroadcastRequest;
import com.example.sheetsync.model.Conflict;
import com.example.sheetsync.model.ResolveRequest;
import com.example.sheetsync.model.SessionIdentity;
import com.example.sheetsync.model.Subscription;
import com.example.sheetsync.model.SyncEvent;
import com.example.sheetsync.model.SyncOperation;
import com.example.sheetsync.service.CrudGateway;
import com.example.sheetsync.sync.ChannelMessage;
import com.example.sheetsync.sync.Connection;
import com.example.sheetsync.sync.ConnectionRegistry;
import com.example.sheetsync.sync.SyncBroadcaster;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/sync")
public class SyncController {

    private static final Logger logger = LoggerFactory.getLogger(SyncController.class);

    private final SyncBroadcaster broadcaster;
    private final CrudGateway gateway;
    private final ConnectionRegistry registry;
    private final SyncSettings settings;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public SyncController(SyncBroadcaster broadcaster, CrudGateway gateway, ConnectionRegistry registry,
                          SyncSettings settings, ObjectMapper objectMapper, Clock clock) {
        this.broadcaster = broadcaster;
        this.gateway = gateway;
        this.registry = registry;
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> events(@RequestParam(required = false) String userId,
                                                @RequestParam(required = false) String userName,
                                                @RequestParam(required = false) String sessionId,
                                                @RequestParam(required = false) String tables,
                                                @RequestParam(required = false) String operations,
                                                @RequestParam(required = false) String projectId,
                                                @RequestParam(required = false) String authorId) {
        List<Subscription> subscriptions = subscriptions(tables, operations, projectId, authorId);
        Connection connection = broadcaster.attach(new SessionIdentity(userId, userName, sessionId), subscriptions);
        String connectionId = connection.getId();

        Flux<ChannelMessage> heartbeats = Flux.interval(settings.getStreamHeartbeat())
                .map(tick -> {
                    registry.heartbeat(connectionId);
                    return ChannelMessage.heartbeat(broadcaster.stats(), clock.instant());
                });

        // the channel admits a single subscriber; heartbeats stop once it completes
        Flux<ChannelMessage> messages = connection.getChannel().asFlux().share();
        return Flux.merge(messages, heartbeats.takeUntilOther(messages.ignoreElements()))
                .map(this::toServerSentEvent)
                .doFinally(signal -> {
                    logger.info("Event stream of {} ended: {}", connectionId, signal);
                    broadcaster.detach(connectionId);
                });
    }

    @PostMapping("/connections/{id}/heartbeat")
    public ResponseEntity<Map<String, Object>> heartbeat(@PathVariable String id) {
        return registry.heartbeat(id) ? ResponseEntity.ok(Map.of("ok", true)) : notFound("Unknown connection " + id);
    }

    @PutMapping("/connections/{id}/subscriptions")
    public ResponseEntity<Map<String, Object>> updateSubscriptions(@PathVariable String id,
                                                                   @RequestBody List<Subscription> subscriptions) {
        return registry.updateSubscriptions(id, subscriptions)
                ? ResponseEntity.ok(Map.of("ok", true))
                : notFound("Unknown connection " + id);
    }

    @DeleteMapping("/connections/{id}")
    public ResponseEntity<Map<String, Object>> disconnect(@PathVariable String id) {
        return broadcaster.detach(id) ? ResponseEntity.ok(Map.of("ok", true)) : notFound("Unknown connection " + id);
    }

    @PostMapping("/broadcast")
    public ResponseEntity<Map<String, Object>> broadcast(@RequestBody BroadcastRequest request,
                                                         @RequestHeader(value = "X-User-Id", required = false) String userId,
                                                         @RequestHeader(value = "X-User-Name", required = false) String userName,
                                                         @RequestHeader(value = "X-Session-Id", required = false) String sessionHeader) {
        if (request.getTable() == null || request.getOperation() == null || request.getRecordId() == null) {
            throw new IllegalArgumentException("Missing required fields: table, operation, recordId");
        }
        SyncEvent event = SyncEvent.builder()
                .id("event_" + UUID.randomUUID())
                .table(request.getTable())
                .operation(request.getOperation())
                .recordId(request.getRecordId())
                .data(request.getData())
                .previousData(request.getPreviousData())
                .timestamp(clock.instant())
                .userId(userId)
                .userName(userName)
                .sessionId(request.getSessionId() != null ? request.getSessionId() : sessionHeader)
                .version(request.getVersion())
                .build();
        int delivered = gateway.publishExternal(event);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", true);
        body.put("eventId", event.getId());
        body.put("delivered", delivered);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/conflicts")
    public List<Conflict> conflicts(@RequestParam(required = false) String table,
                                    @RequestParam(required = false) String recordId) {
        return broadcaster.openConflicts(table, recordId);
    }

    @PostMapping("/conflicts/{id}/resolve")
    public ResponseEntity<?> resolve(@PathVariable String id, @RequestBody ResolveRequest request) {
        if (request.getStrategy() == null) {
            throw new IllegalArgumentException("A resolution strategy is required");
        }
        return broadcaster.resolveConflict(id, request.getStrategy(), request.getMergedData(), request.getResolvedBy())
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> notFound("Unknown conflict " + id));
    }

    @GetMapping("/stats")
    public Map<String, Object> stats() {
        return broadcaster.stats();
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("ok", false, "message", e.getMessage()));
    }

    private ServerSentEvent<String> toServerSentEvent(ChannelMessage message) {
        String data;
        try {
            data = objectMapper.writeValueAsString(message.getPayload());
        } catch (JsonProcessingException e) {
            logger.error("Could not serialize {} {}", message.getType(), message.getId(), e);
            data = "{}";
        }
        ServerSentEvent.Builder<String> builder = ServerSentEvent.<String>builder()
                .event(message.getType())
                .data(data);
        if (message.getId() != null) builder.id(message.getId());
        return builder.build();
    }

    static List<Subscription> subscriptions(String tables, String operations, String projectId, String authorId) {
        if (isBlank(tables) && isBlank(operations) && isBlank(projectId) && isBlank(authorId)) {
            return List.of();
        }
        Set<String> tableSet = isBlank(tables) ? null : Arrays.stream(tables.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toSet());
        Set<SyncOperation> operationSet = isBlank(operations) ? null : SyncOperation.parseList(operations);
        return List.of(Subscription.builder()
                .tables(tableSet)
                .operations(operationSet)
                .projectId(isBlank(projectId) ? null : projectId)
                .userId(isBlank(authorId) ? null : authorId)
                .build());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static ResponseEntity<Map<String, Object>> notFound(String message) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("ok", false, "message", message));
    }
}
