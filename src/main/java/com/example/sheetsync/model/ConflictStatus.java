package com.example.sheetsync.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConflictStatus {
    OPEN, RESOLVED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
