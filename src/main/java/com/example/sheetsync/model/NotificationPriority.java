package com.example.sheetsync.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationPriority {
    LOW, MEDIUM, HIGH, CRITICAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
