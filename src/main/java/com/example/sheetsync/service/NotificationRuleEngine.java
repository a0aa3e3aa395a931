package com.example.sheetsync.service;

import com.example.sheetsync.model.NotificationEvent;
import com.example.sheetsync.model.SyncEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Evaluates rules against committed events. Rules are independent; evaluation order
 * is unspecified and one failing rule never stops the others.
 */
public class NotificationRuleEngine {

    private static final Logger logger = LoggerFactory.getLogger(NotificationRuleEngine.class);

    private final Map<String, NotificationRule> rules = new ConcurrentHashMap<>();

    public void addRule(NotificationRule rule) {
        if (rule.getId() == null || rule.getTable() == null || rule.getGenerator() == null) {
            throw new IllegalArgumentException("A rule needs an id, a table and a generator");
        }
        rules.put(rule.getId(), rule);
        logger.info("Notification rule added: {}", rule.getId());
    }

    public boolean removeRule(String ruleId) {
        boolean removed = rules.remove(ruleId) != null;
        if (removed) logger.info("Notification rule removed: {}", ruleId);
        return removed;
    }

    public boolean setEnabled(String ruleId, boolean enabled) {
        NotificationRule updated = rules.computeIfPresent(ruleId, (id, rule) -> rule.toBuilder().enabled(enabled).build());
        if (updated != null) logger.info("Notification rule {} {}", ruleId, enabled ? "enabled" : "disabled");
        return updated != null;
    }

    public List<NotificationRule> rules() {
        return rules.values().stream()
                .sorted(Comparator.comparing(NotificationRule::getId))
                .collect(Collectors.toList());
    }

    public List<NotificationEvent> evaluate(SyncEvent event) {
        List<NotificationEvent> notifications = new ArrayList<>();
        for (NotificationRule rule : rules.values()) {
            if (!rule.appliesTo(event)) continue;
            try {
                if (!rule.getCondition().test(event)) continue;
                NotificationEvent notification = rule.getGenerator().apply(event);
                if (notification != null) {
                    notifications.add(notification);
                }
            } catch (RuntimeException e) {
                logger.error("Error evaluating notification rule {} on {} {}", rule.getId(), event.getTable(),
                        event.getRecordId(), e);
            }
        }
        return notifications;
    }
}
