package com.example.sheetsync.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationType {
    PROJECT_UPDATE, STOCK_ALERT, ACTIVITY_COMPLETE, ASSIGNMENT_CHANGE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
