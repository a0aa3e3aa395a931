package com.example.sheetsync.mcp;

import com.example.sheetsync.service.NotificationRule;
import com.example.sheetsync.service.NotificationRuleEngine;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class NotificationTools {

    private final NotificationRuleEngine ruleEngine;

    public NotificationTools(NotificationRuleEngine ruleEngine) {
        this.ruleEngine = ruleEngine;
    }

    @Tool(description = "List notification rules with their table, operation and enabled flag")
    public List<NotificationRule> notification_rules_list() {
        return ruleEngine.rules();
    }

    @Tool(description = "Enable or disable a notification rule by id")
    public Map<String, Object> notification_rule_toggle(String ruleId, boolean enabled) {
        boolean found = ruleEngine.setEnabled(ruleId, enabled);
        return Map.of("ok", found, "ruleId", ruleId, "enabled", enabled);
    }
}
