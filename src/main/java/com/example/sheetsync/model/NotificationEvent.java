package com.example.sheetsync.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class NotificationEvent {
    String id;
    NotificationType type;
    String title;
    String message;
    Map<String, Object> data;
    @Singular
    List<String> targetUsers;
    Instant timestamp;
    NotificationPriority priority;
    String ruleId;
}
