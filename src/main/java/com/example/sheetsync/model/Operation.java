package com.example.sheetsync.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * A single request against the remote store. Immutable once built.
 */
@Value
@Builder
public class Operation {
    String table;
    OperationKind kind;
    String id;
    Map<String, Object> data;
    @Singular
    Map<String, Object> filters;
    Pagination page;

    public boolean isRead() {
        return kind.isRead();
    }

    public static Operation list(String table, Map<String, Object> filters, Pagination page) {
        return Operation.builder().table(table).kind(OperationKind.LIST)
                .filters(filters == null ? Map.of() : filters).page(page).build();
    }

    public static Operation get(String table, String id) {
        return Operation.builder().table(table).kind(OperationKind.GET).id(id).build();
    }

    public static Operation create(String table, Map<String, Object> data) {
        return Operation.builder().table(table).kind(OperationKind.CREATE).data(data).build();
    }

    public static Operation update(String table, String id, Map<String, Object> data) {
        return Operation.builder().table(table).kind(OperationKind.UPDATE).id(id).data(data).build();
    }

    public static Operation delete(String table, String id) {
        return Operation.builder().table(table).kind(OperationKind.DELETE).id(id).build();
    }
}
