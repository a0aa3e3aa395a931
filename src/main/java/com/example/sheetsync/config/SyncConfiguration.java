package com.example.sheetsync.config;

import com.example.sheetsync.cache.CacheStore;
import com.example.sheetsync.cache.InMemoryCacheStore;
import com.example.sheetsync.cache.RedisCacheStore;
import com.example.sheetsync.remote.SheetsClient;
import com.example.sheetsync.remote.WebClientSheetsClient;
import com.example.sheetsync.service.DefaultNotificationRules;
import com.example.sheetsync.service.NotificationRuleEngine;
import com.example.sheetsync.service.RetryPolicy;
import com.example.sheetsync.service.TeamDirectory;
import com.example.sheetsync.sync.ConflictDetector;
import com.example.sheetsync.sync.ConnectionRegistry;
import com.example.sheetsync.sync.EventHistory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Assembles the {@code app.*} properties into settings objects and wires the
 * explicitly owned sync structures.
 */
@Configuration
public class SyncConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(SyncConfiguration.class);

    @Value("${app.remote.base-url:http://localhost:8081/exec}")
    private String remoteBaseUrl;

    @Value("${app.remote.token:}")
    private String remoteToken;

    @Value("${app.remote.timeout-ms:30000}")
    private long remoteTimeoutMs;

    @Value("${app.retry.max-attempts:3}")
    private int maxAttempts;

    @Value("${app.retry.initial-delay-ms:1000}")
    private long initialDelayMs;

    @Value("${app.retry.max-delay-ms:10000}")
    private long maxDelayMs;

    @Value("${app.retry.backoff-multiplier:2.0}")
    private double backoffMultiplier;

    @Value("${app.retry.jitter:true}")
    private boolean jitter;

    @Value("${app.cache.enabled:true}")
    private boolean cacheEnabled;

    @Value("${app.cache.max-entries:2000}")
    private int cacheMaxEntries;

    @Value("${app.cache.list-ttl-seconds:300}")
    private long listTtlSeconds;

    @Value("${app.cache.record-ttl-seconds:600}")
    private long recordTtlSeconds;

    @Value("${app.cache.fallback-max-age-seconds:3600}")
    private long fallbackMaxAgeSeconds;

    @Value("${app.sync.heartbeat-timeout-ms:60000}")
    private long heartbeatTimeoutMs;

    @Value("${app.sync.removal-timeout-ms:300000}")
    private long removalTimeoutMs;

    @Value("${app.sync.conflict-window-ms:5000}")
    private long conflictWindowMs;

    @Value("${app.sync.channel-capacity:256}")
    private int channelCapacity;

    @Value("${app.sync.history-size:1000}")
    private int historySize;

    @Value("${app.sync.history-max-age-ms:86400000}")
    private long historyMaxAgeMs;

    @Value("${app.sync.replay-window-ms:120000}")
    private long replayWindowMs;

    @Value("${app.sync.stream-heartbeat-ms:30000}")
    private long streamHeartbeatMs;

    @Value("${app.notifications.admin-users:}")
    private String adminUsers;

    @Value("${app.notifications.admin-roles:admin,admin_lider}")
    private String adminRoles;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RemoteSettings remoteSettings() {
        return RemoteSettings.builder()
                .baseUrl(remoteBaseUrl)
                .token(remoteToken)
                .timeout(Duration.ofMillis(remoteTimeoutMs))
                .build();
    }

    @Bean
    public CacheSettings cacheSettings() {
        return CacheSettings.builder()
                .enabled(cacheEnabled)
                .maxEntries(cacheMaxEntries)
                .listTtl(Duration.ofSeconds(listTtlSeconds))
                .recordTtl(Duration.ofSeconds(recordTtlSeconds))
                .fallbackMaxAge(Duration.ofSeconds(fallbackMaxAgeSeconds))
                .build();
    }

    @Bean
    public RetryPolicy retryPolicy(CacheSettings cacheSettings) {
        return RetryPolicy.builder()
                .maxAttempts(maxAttempts)
                .initialDelay(Duration.ofMillis(initialDelayMs))
                .maxDelay(Duration.ofMillis(maxDelayMs))
                .backoffMultiplier(backoffMultiplier)
                .jitter(jitter)
                .fallbackEnabled(cacheSettings.isEnabled())
                .fallbackMaxAge(cacheSettings.getFallbackMaxAge())
                .build();
    }

    @Bean
    public SyncSettings syncSettings() {
        return SyncSettings.builder()
                .heartbeatTimeout(Duration.ofMillis(heartbeatTimeoutMs))
                .removalTimeout(Duration.ofMillis(removalTimeoutMs))
                .conflictWindow(Duration.ofMillis(conflictWindowMs))
                .channelCapacity(channelCapacity)
                .historySize(historySize)
                .historyMaxAge(Duration.ofMillis(historyMaxAgeMs))
                .replayWindow(Duration.ofMillis(replayWindowMs))
                .streamHeartbeat(Duration.ofMillis(streamHeartbeatMs))
                .build();
    }

    @Bean
    @ConditionalOnProperty(name = "app.cache.backend", havingValue = "memory", matchIfMissing = true)
    public CacheStore inMemoryCacheStore(CacheSettings cacheSettings, Clock clock) {
        logger.info("Using in-memory cache (max {} entries)", cacheSettings.getMaxEntries());
        return new InMemoryCacheStore(cacheSettings.getMaxEntries(), retention(cacheSettings), clock);
    }

    @Bean
    @ConditionalOnProperty(name = "app.cache.backend", havingValue = "redis")
    public CacheStore redisCacheStore(StringRedisTemplate redis, ObjectMapper objectMapper,
                                      CacheSettings cacheSettings, Clock clock) {
        logger.info("Using Redis cache");
        return new RedisCacheStore(redis, objectMapper, retention(cacheSettings), clock);
    }

    @Bean
    public WebClient sheetsWebClient(WebClient.Builder builder) {
        return builder.build();
    }

    @Bean
    public SheetsClient sheetsClient(WebClient sheetsWebClient, RemoteSettings remoteSettings, ObjectMapper objectMapper) {
        return new WebClientSheetsClient(sheetsWebClient, remoteSettings, objectMapper);
    }

    @Bean
    public Scheduler retryScheduler() {
        return Schedulers.parallel();
    }

    @Bean
    public ConnectionRegistry connectionRegistry(SyncSettings syncSettings, Clock clock) {
        return new ConnectionRegistry(syncSettings, clock);
    }

    @Bean
    public EventHistory eventHistory(SyncSettings syncSettings, Clock clock) {
        return new EventHistory(syncSettings.getHistorySize(), syncSettings.getHistoryMaxAge(), clock);
    }

    @Bean
    public ConflictDetector conflictDetector(SyncSettings syncSettings, Clock clock) {
        return new ConflictDetector(syncSettings.getConflictWindow(), syncSettings.getResolvedConflictHistory(), clock);
    }

    @Bean
    public TeamDirectory teamDirectory() {
        return new TeamDirectory(csv(adminUsers), csv(adminRoles));
    }

    @Bean
    public NotificationRuleEngine notificationRuleEngine(TeamDirectory teamDirectory, Clock clock) {
        NotificationRuleEngine engine = new NotificationRuleEngine();
        DefaultNotificationRules.create(teamDirectory, clock).forEach(engine::addRule);
        return engine;
    }

    /**
     * Entries are kept past their TTL for as long as they may still serve as fallback.
     */
    private static Duration retention(CacheSettings settings) {
        return Stream.of(settings.getFallbackMaxAge(), settings.getListTtl(), settings.getRecordTtl())
                .max(Duration::compareTo)
                .orElse(settings.getFallbackMaxAge());
    }

    private static List<String> csv(String value) {
        if (value == null || value.isBlank()) return List.of();
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }
}
