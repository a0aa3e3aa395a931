package com.example.sheetsync.mcp;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;

@Configuration
public class ToolRegistrationConfig {

    private final SyncTools syncTools;
    private final CacheTools cacheTools;
    private final NotificationTools notificationTools;

    public ToolRegistrationConfig(SyncTools syncTools, CacheTools cacheTools, NotificationTools notificationTools) {
        this.syncTools = syncTools;
        this.cacheTools = cacheTools;
        this.notificationTools = notificationTools;
    }

    @Bean
    public ToolCallbackProvider toolCallbacks() {
        return MethodToolCallbackProvider.builder()
                .toolObjects(syncTools, cacheTools, notificationTools)
                .build();
    }
}
