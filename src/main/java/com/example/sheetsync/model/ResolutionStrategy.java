package com.example.sheetsync.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ResolutionStrategy {
    /** Keep the earliest event's data. */
    ACCEPT_CURRENT,
    /** Keep the latest event's data. */
    ACCEPT_INCOMING,
    /** Keep a payload merged by the caller. */
    MERGE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ResolutionStrategy parse(String value) {
        if (value == null) throw new IllegalArgumentException("A resolution strategy is required");
        String normalized = value.trim().replace('-', '_');
        for (ResolutionStrategy s : values()) {
            if (s.name().equalsIgnoreCase(normalized)) return s;
        }
        throw new IllegalArgumentException("Unknown resolution: " + value);
    }
}
