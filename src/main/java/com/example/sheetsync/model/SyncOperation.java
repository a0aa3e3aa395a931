package com.example.sheetsync.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Committed write kinds, the only operations that produce sync events.
 */
public enum SyncOperation {
    CREATE, UPDATE, DELETE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public static SyncOperation from(OperationKind kind) {
        switch (kind) {
            case CREATE: return CREATE;
            case UPDATE: return UPDATE;
            case DELETE: return DELETE;
            default: throw new IllegalArgumentException("Not a write operation: " + kind);
        }
    }

    @JsonCreator
    public static SyncOperation parse(String value) {
        for (SyncOperation op : values()) {
            if (op.name().equalsIgnoreCase(value)) return op;
        }
        throw new IllegalArgumentException("Invalid operation type: " + value);
    }

    public static Set<SyncOperation> parseList(String csv) {
        Set<SyncOperation> result = EnumSet.noneOf(SyncOperation.class);
        for (String part : csv.split(",")) {
            if (!part.isBlank()) result.add(parse(part.trim()));
        }
        return result;
    }
}
