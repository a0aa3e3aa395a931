package com.example.sheetsync.service;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder(toBuilder = true)
public class RetryPolicy {
    /** Attempts including the first one. */
    @Builder.Default
    int maxAttempts = 3;
    @Builder.Default
    Duration initialDelay = Duration.ofSeconds(1);
    @Builder.Default
    Duration maxDelay = Duration.ofSeconds(10);
    @Builder.Default
    double backoffMultiplier = 2.0;
    @Builder.Default
    boolean jitter = true;
    @Builder.Default
    boolean fallbackEnabled = true;
    @Builder.Default
    Duration fallbackMaxAge = Duration.ofHours(1);

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }
}
