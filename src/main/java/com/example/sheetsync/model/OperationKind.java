package com.example.sheetsync.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum OperationKind {
    LIST, GET, CREATE, UPDATE, DELETE;

    public boolean isRead() {
        return this == LIST || this == GET;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static OperationKind parse(String value) {
        for (OperationKind kind : values()) {
            if (kind.name().equalsIgnoreCase(value)) return kind;
        }
        throw new IllegalArgumentException("Unknown operation: " + value);
    }
}
