package com.example.sheetsync.service;

import com.example.sheetsync.model.NotificationEvent;
import com.example.sheetsync.model.SheetTable;
import com.example.sheetsync.model.SyncEvent;
import com.example.sheetsync.model.SyncOperation;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Declarative notification rule. {@code condition} and {@code generator} must be pure:
 * no I/O, no shared state. The generator may return null to emit nothing.
 */
@Value
@Builder(toBuilder = true)
public class NotificationRule {
    String id;
    String name;
    String description;
    SheetTable table;
    /** Null matches every operation. */
    SyncOperation operation;
    @JsonIgnore
    @Builder.Default
    Predicate<SyncEvent> condition = event -> true;
    @JsonIgnore
    Function<SyncEvent, NotificationEvent> generator;
    @Builder.Default
    boolean enabled = true;

    public boolean appliesTo(SyncEvent event) {
        return enabled
                && event.isFor(table)
                && (operation == null || operation == event.getOperation());
    }
}
