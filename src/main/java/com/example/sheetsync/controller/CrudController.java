package com.example.sheetsync.controller;

import com.example.sheetsync.model.GatewayResult;
import com.example.sheetsync.model.Pagination;
import com.example.sheetsync.model.SessionIdentity;
import com.example.sheetsync.service.CrudGateway;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Table CRUD for the UI. Query parameters other than paging become equality filters.
 */
@RestController
@RequestMapping("/api")
public class CrudController {

    private static final Set<String> RESERVED_PARAMS = Set.of("page", "limit", "refresh");

    private final CrudGateway gateway;

    public CrudController(CrudGateway gateway) {
        this.gateway = gateway;
    }

    @GetMapping("/{table}")
    public Mono<ResponseEntity<GatewayResult<List<Map<String, Object>>>>> list(
            @PathVariable String table,
            @RequestParam Map<String, String> params,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit,
            @RequestParam(defaultValue = "false") boolean refresh) {
        Map<String, Object> filters = new LinkedHashMap<>();
        params.forEach((name, value) -> {
            if (!RESERVED_PARAMS.contains(name)) filters.put(name, value);
        });
        return gateway.list(table, filters, Pagination.of(page, limit), refresh).map(result -> respond(result, HttpStatus.OK));
    }

    @GetMapping("/{table}/{id}")
    public Mono<ResponseEntity<GatewayResult<Map<String, Object>>>> get(
            @PathVariable String table,
            @PathVariable String id,
            @RequestParam(defaultValue = "false") boolean refresh) {
        return gateway.get(table, id, refresh).map(result -> respond(result, HttpStatus.OK));
    }

    @PostMapping("/{table}")
    public Mono<ResponseEntity<GatewayResult<Map<String, Object>>>> create(
            @PathVariable String table,
            @RequestBody Map<String, Object> data,
            @RequestHeader(value = "X-User-Id", required = false) String userId,
            @RequestHeader(value = "X-User-Name", required = false) String userName,
            @RequestHeader(value = "X-Session-Id", required = false) String sessionId) {
        return gateway.create(table, data, new SessionIdentity(userId, userName, sessionId))
                .map(result -> respond(result, HttpStatus.CREATED));
    }

    @PutMapping("/{table}/{id}")
    public Mono<ResponseEntity<GatewayResult<Map<String, Object>>>> update(
            @PathVariable String table,
            @PathVariable String id,
            @RequestBody Map<String, Object> data,
            @RequestHeader(value = "X-User-Id", required = false) String userId,
            @RequestHeader(value = "X-User-Name", required = false) String userName,
            @RequestHeader(value = "X-Session-Id", required = false) String sessionId) {
        return gateway.update(table, id, data, new SessionIdentity(userId, userName, sessionId))
                .map(result -> respond(result, HttpStatus.OK));
    }

    @DeleteMapping("/{table}/{id}")
    public Mono<ResponseEntity<GatewayResult<Map<String, Object>>>> delete(
            @PathVariable String table,
            @PathVariable String id,
            @RequestHeader(value = "X-User-Id", required = false) String userId,
            @RequestHeader(value = "X-User-Name", required = false) String userName,
            @RequestHeader(value = "X-Session-Id", required = false) String sessionId) {
        return gateway.delete(table, id, new SessionIdentity(userId, userName, sessionId))
                .map(result -> respond(result, HttpStatus.OK));
    }

    private static <T> ResponseEntity<GatewayResult<T>> respond(GatewayResult<T> result, HttpStatus success) {
        if (result.isOk()) {
            return ResponseEntity.status(success).body(result);
        }
        return ResponseEntity.status(result.getError().responseStatus()).body(result);
    }
}
