package com.example.sheetsync.config;

import com.example.sheetsync.model.OperationKind;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class CacheSettings {
    @Builder.Default
    boolean enabled = true;
    @Builder.Default
    int maxEntries = 2000;
    @Builder.Default
    Duration listTtl = Duration.ofMinutes(5);
    @Builder.Default
    Duration recordTtl = Duration.ofMinutes(10);
    @Builder.Default
    Duration fallbackMaxAge = Duration.ofHours(1);

    /** Zero for writes: they are never cached. */
    public Duration ttlFor(OperationKind kind) {
        switch (kind) {
            case LIST: return listTtl;
            case GET: return recordTtl;
            default: return Duration.ZERO;
        }
    }
}
